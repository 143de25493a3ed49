package com.statementprocessor.unit.parser;

import static org.assertj.core.api.Assertions.assertThat;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.enums.TradeAction;
import com.statementprocessor.domain.enums.WarningType;
import com.statementprocessor.domain.model.ParseResult;
import com.statementprocessor.domain.model.ProcessingWarning;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.TradeRecord;
import com.statementprocessor.parser.TradesSectionParser;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TradesSectionParserTest {

    private static final String HEADER = "Trades,Header,DataDiscriminator,Asset Category,Currency,Symbol,Date/Time,"
            + "Quantity,T. Price,Proceeds,Comm/Fee,Realized P/L,Code\n";

    private TradesSectionParser tradesParser;

    @BeforeEach
    void setUp() {
        tradesParser = new TradesSectionParser();
    }

    @Nested
    @DisplayName("Activity statement trades")
    class ActivityTrades {

        @Test
        @DisplayName("Parses every order row of both Trades sections")
        void parsesOrders() {
            List<Section> sections = SectionFixtures.activitySections(SectionKind.TRADES);

            ParseResult<TradeRecord> options = tradesParser.parse(sections.get(0), SectionFixtures.context());
            ParseResult<TradeRecord> forex = tradesParser.parse(sections.get(1), SectionFixtures.context());

            assertThat(options.warnings()).isEmpty();
            assertThat(options.records())
                    .extracting(TradeRecord::getInstrument)
                    .containsExactly("ASTS 07FEB25 26 C", "ASTS 07FEB25 28 C", "ASTS 07FEB25 28 C");
            assertThat(options.records())
                    .extracting(TradeRecord::getAction)
                    .containsExactly(TradeAction.SELL, TradeAction.SELL, TradeAction.BUY);
            assertThat(forex.records()).hasSize(1);
            assertThat(forex.records().get(0).getAssetClass()).isEqualTo(AssetClass.FOREX);
            assertThat(forex.records().get(0).getCommission()).isEqualByComparingTo("-2.00");
        }

        @Test
        @DisplayName("Maps signed amounts, codes and timestamps of an opening sell")
        void openingSell() {
            Section section = SectionFixtures.activitySections(SectionKind.TRADES).get(0);

            TradeRecord sell = tradesParser.parse(section, SectionFixtures.context()).records().get(0);

            assertThat(sell.getAccountId()).isEqualTo("U1234567");
            assertThat(sell.getAssetClass()).isEqualTo(AssetClass.OPTION);
            assertThat(sell.getQuantity()).isEqualByComparingTo("-2");
            assertThat(sell.getPrice()).isEqualByComparingTo("1.50");
            assertThat(sell.getProceeds()).isEqualByComparingTo("300");
            assertThat(sell.getCommission()).isEqualByComparingTo("-2.10");
            assertThat(sell.getExecutedAt()).isEqualTo(LocalDateTime.of(2025, 1, 30, 10, 15));
            assertThat(sell.getTradeDate()).isEqualTo(LocalDate.of(2025, 1, 30));
            assertThat(sell.isOpening()).isTrue();
            assertThat(sell.isClosing()).isFalse();
            assertThat(sell.getLineNumber()).isEqualTo(21);
        }
    }

    @Nested
    @DisplayName("Malformed rows")
    class MalformedRows {

        @Test
        @DisplayName("One bad quantity skips only that line, every data line is accounted for")
        void badQuantitySkipsLine() {
            Section section = SectionFixtures.single(HEADER
                    + "Trades,Data,Order,Stocks,USD,AAPL,\"2025-01-30, 09:31:00\",10,230.00,-2300,-1,0,O\n"
                    + "Trades,Data,Order,Stocks,USD,MSFT,\"2025-01-30, 09:32:00\",ten,410.00,-4100,-1,0,O\n"
                    + "Trades,Data,Order,Stocks,USD,NVDA,\"2025-01-30, 09:33:00\",-5,120.00,600,-1,15,C\n");

            ParseResult<TradeRecord> result = tradesParser.parse(section, SectionFixtures.context());

            assertThat(result.records()).extracting(TradeRecord::getInstrument).containsExactly("AAPL", "NVDA");
            assertThat(result.warnings()).hasSize(1);
            ProcessingWarning warning = result.warnings().get(0);
            assertThat(warning.getType()).isEqualTo(WarningType.FIELD_NUMBER);
            assertThat(warning.getField()).isEqualTo("Quantity");
            assertThat(warning.getLineNumber()).isEqualTo(3);
            assertThat(warning.getSectionKind()).isEqualTo(SectionKind.TRADES);
            assertThat(result.records().size() + result.warnings().size()).isEqualTo(section.dataLineCount());
        }

        @Test
        @DisplayName("Missing currency and bad timestamp are field warnings")
        void missingCurrencyAndBadDate() {
            Section section = SectionFixtures.single(HEADER
                    + "Trades,Data,Order,Stocks,,AAPL,\"2025-01-30, 09:31:00\",10,230.00,-2300,-1,0,O\n"
                    + "Trades,Data,Order,Stocks,USD,AAPL,yesterday,10,230.00,-2300,-1,0,O\n");

            ParseResult<TradeRecord> result = tradesParser.parse(section, SectionFixtures.context());

            assertThat(result.records()).isEmpty();
            assertThat(result.warnings())
                    .extracting(ProcessingWarning::getType)
                    .containsExactly(WarningType.FIELD_MISSING, WarningType.FIELD_DATE);
        }

        @Test
        @DisplayName("A header without Date/Time makes every row unparseable")
        void headerMissingColumn() {
            Section section = SectionFixtures.single("Trades,Header,Asset Category,Currency,Symbol,Quantity\n"
                    + "Trades,Data,Stocks,USD,AAPL,10\n"
                    + "Trades,Data,Stocks,USD,MSFT,5\n");

            ParseResult<TradeRecord> result = tradesParser.parse(section, SectionFixtures.context());

            assertThat(result.records()).isEmpty();
            assertThat(result.warnings())
                    .hasSize(2)
                    .allMatch(warning -> warning.getType() == WarningType.SECTION_UNPARSEABLE);
        }
    }

    @Test
    @DisplayName("Assignment, expiration and exercise codes override the quantity sign")
    void actionsFromCodes() {
        Section section = SectionFixtures.single(HEADER
                + "Trades,Data,Order,Equity and Index Options,USD,ASTS 07FEB25 26 C,2025-02-07,2,0,0,0,0,A;C\n"
                + "Trades,Data,Order,Equity and Index Options,USD,ASTS 07FEB25 28 C,2025-02-07,1,0,0,0,0,C;Ep\n"
                + "Trades,Data,Order,Equity and Index Options,USD,ASTS 07FEB25 30 C,2025-02-07,-1,0,0,0,0,Ex\n");

        List<TradeRecord> trades = tradesParser.parse(section, SectionFixtures.context()).records();

        assertThat(trades)
                .extracting(TradeRecord::getAction)
                .containsExactly(TradeAction.ASSIGNMENT, TradeAction.EXPIRATION, TradeAction.EXERCISE);
        assertThat(trades.get(0).isClosing()).isTrue();
    }

    @Test
    @DisplayName("An Account column overrides the run's account")
    void accountColumn() {
        Section section = SectionFixtures.single(
                "Trades,Header,Account,Asset Category,Currency,Symbol,Date/Time,Quantity,Proceeds\n"
                        + "Trades,Data,U7654321,Stocks,USD,AAPL,\"2025-01-30, 09:31:00\",10,-2300\n");

        TradeRecord trade = tradesParser.parse(section, SectionFixtures.context()).records().get(0);

        assertThat(trade.getAccountId()).isEqualTo("U7654321");
    }
}
