package com.statementprocessor.unit.tokenizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.statementprocessor.config.StatementProcessingConfig;
import com.statementprocessor.domain.enums.RowType;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.SectionRow;
import com.statementprocessor.domain.model.StatementDocument;
import com.statementprocessor.exception.ErrorCode;
import com.statementprocessor.exception.StatementFormatException;
import com.statementprocessor.fixtures.StatementFixtures;
import com.statementprocessor.tokenizer.CsvLineSplitter;
import com.statementprocessor.tokenizer.SectionRule;
import com.statementprocessor.tokenizer.SectionRules;
import com.statementprocessor.tokenizer.SectionTokenizer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SectionTokenizerTest {

    private SectionTokenizer sectionTokenizer;

    @BeforeEach
    void setUp() {
        sectionTokenizer = new SectionTokenizer(SectionRules.defaults(), new CsvLineSplitter());
    }

    private List<Section> tokenize(String text) {
        return sectionTokenizer.tokenize(
                StatementDocument.builder().documentId("doc-1").rawText(text).build());
    }

    @Nested
    @DisplayName("Activity statement")
    class ActivityStatement {

        private List<Section> sections;

        @BeforeEach
        void tokenizeFixture() {
            sections = tokenize(StatementFixtures.activityStatement());
        }

        @Test
        @DisplayName("Splits into sections in document order, keeping unmatched headers as UNKNOWN")
        void sectionsInOrder() {
            assertThat(sections)
                    .extracting(Section::getKind)
                    .containsExactly(
                            SectionKind.STATEMENT_INFO,
                            SectionKind.ACCOUNT_INFO,
                            SectionKind.UNKNOWN,
                            SectionKind.MTM_SUMMARY,
                            SectionKind.TRADES,
                            SectionKind.TRADES,
                            SectionKind.POSITIONS,
                            SectionKind.CASH_FOREX,
                            SectionKind.CASH_FOREX,
                            SectionKind.UNKNOWN);
            assertThat(sections)
                    .filteredOn(section -> !section.isRecognized())
                    .extracting(Section::getName)
                    .containsExactly("Net Asset Value", "Codes");
        }

        @Test
        @DisplayName("Every line of the document belongs to exactly one section")
        void linesCoveredOnce() {
            int rows = sections.stream().mapToInt(section -> section.getRows().size()).sum();

            assertThat(rows).isEqualTo(43);
            for (int i = 1; i < sections.size(); i++) {
                assertThat(sections.get(i).getStartLine()).isEqualTo(sections.get(i - 1).getEndLine() + 1);
            }
            assertThat(sections.get(0).getStartLine()).isEqualTo(1);
            assertThat(sections.get(sections.size() - 1).getEndLine()).isEqualTo(43);
        }

        @Test
        @DisplayName("A second Header row with the same name starts a new section with its own columns")
        void repeatedHeaderStartsNewSection() {
            Section optionTrades = sections.get(4);
            Section forexTrades = sections.get(5);

            assertThat(optionTrades.getColumns()).contains("Comm/Fee");
            assertThat(forexTrades.getColumns()).contains("Comm in USD").doesNotContain("Comm/Fee");
            assertThat(optionTrades.getStartLine()).isEqualTo(20);
            assertThat(forexTrades.getStartLine()).isEqualTo(26);
        }

        @Test
        @DisplayName("Total, SubTotal and Lot rows are not counted as data")
        void aggregateAndLotRows() {
            Section positions = sections.get(6);
            Section optionTrades = sections.get(4);
            Section markToMarket = sections.get(3);

            assertThat(positions.getRows())
                    .extracting(SectionRow::getRowType)
                    .containsExactly(RowType.HEADER, RowType.DATA, RowType.DETAIL, RowType.DATA, RowType.TOTAL);
            assertThat(optionTrades.dataLineCount()).isEqualTo(3);
            assertThat(markToMarket.dataLineCount()).isEqualTo(5);
            assertThat(markToMarket.getRows().get(markToMarket.getRows().size() - 1).getRowType())
                    .isEqualTo(RowType.TOTAL);
        }

        @Test
        @DisplayName("Base Currency Summary lines of the Cash Report are aggregates")
        void baseCurrencySummaryIsTotal() {
            Section cashReport = sections.get(8);

            assertThat(cashReport.getName()).isEqualTo("Cash Report");
            assertThat(cashReport.dataLineCount()).isEqualTo(3);
            assertThat(cashReport.getRows().get(1).getRowType()).isEqualTo(RowType.TOTAL);
        }

        @Test
        @DisplayName("Quoted cells keep their embedded commas")
        void quotedCells() {
            SectionRow period = sections.get(0).getRows().get(3);

            assertThat(period.get("Field Name")).isEqualTo("Period");
            assertThat(period.get("Field Value")).isEqualTo("January 30, 2025");
        }
    }

    @Nested
    @DisplayName("Malformed documents")
    class Malformed {

        @Test
        @DisplayName("Text without any recognizable header is a structural failure")
        void noRecognizedSections() {
            assertThatThrownBy(() -> tokenize("hello,world\nthis is not a statement\n"))
                    .isInstanceOf(StatementFormatException.class)
                    .satisfies(e -> assertThat(((StatementFormatException) e).getErrorCode())
                            .isEqualTo(ErrorCode.STATEMENT_FORMAT_UNRECOGNIZED));
        }

        @Test
        @DisplayName("Empty document is a structural failure")
        void emptyDocument() {
            assertThatThrownBy(() -> tokenize("")).isInstanceOf(StatementFormatException.class);
        }

        @Test
        @DisplayName("Data rows of a known section without a header form a headerless section")
        void dataWithoutHeader() {
            List<Section> sections = tokenize("Trades,Data,Order,Stocks,USD,AAPL\n");

            assertThat(sections).hasSize(1);
            assertThat(sections.get(0).getKind()).isEqualTo(SectionKind.TRADES);
            assertThat(sections.get(0).hasHeader()).isFalse();
            assertThat(sections.get(0).dataLineCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Leading byte order mark is ignored")
    void byteOrderMark() {
        List<Section> sections = tokenize("\uFEFFStatement,Header,Field Name,Field Value\r\n"
                + "Statement,Data,Period,\"January 30, 2025\"\r\n");

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).getKind()).isEqualTo(SectionKind.STATEMENT_INFO);
        assertThat(sections.get(0).getName()).isEqualTo("Statement");
    }

    @Test
    @DisplayName("Blank lines are kept as BLANK rows of the surrounding section")
    void blankLinesKept() {
        List<Section> sections = tokenize("Statement,Header,Field Name,Field Value\n"
                + "\n"
                + "Statement,Data,Title,Activity Statement\n");

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).getRows())
                .extracting(SectionRow::getRowType)
                .containsExactly(RowType.HEADER, RowType.BLANK, RowType.DATA);
    }

    @Test
    @DisplayName("Instruments whose symbol starts with Total are data, not aggregates")
    void totalInSymbolIsData() {
        List<Section> sections = tokenize("Open Positions,Header,DataDiscriminator,Asset Category,Currency,Symbol,Quantity\n"
                + "Open Positions,Data,Summary,Stocks,EUR,TOTAL SE,40\n"
                + "Open Positions,Total,,Stocks,EUR,,40\n"
                + "Mark-to-Market Performance Summary,Header,Asset Category,Symbol,Prior Quantity,Current Quantity\n"
                + "Mark-to-Market Performance Summary,Data,Stocks,Total Return ETF,0,10\n"
                + "Mark-to-Market Performance Summary,Data,Total (All Assets),,,\n");

        assertThat(sections.get(0).getRows())
                .extracting(SectionRow::getRowType)
                .containsExactly(RowType.HEADER, RowType.DATA, RowType.TOTAL);
        assertThat(sections.get(1).getRows())
                .extracting(SectionRow::getRowType)
                .containsExactly(RowType.HEADER, RowType.DATA, RowType.TOTAL);
    }

    @Test
    @DisplayName("Configured section aliases are appended after the default rules")
    void configuredAlias() {
        StatementProcessingConfig config = new StatementProcessingConfig();
        config.getSectionAliases().put("Positions and", SectionKind.POSITIONS);
        SectionTokenizer tokenizer = new SectionTokenizer(new CsvLineSplitter(), config);

        List<Section> sections = tokenizer.tokenize(StatementDocument.builder()
                .documentId("doc-3")
                .rawText("Positions and Mark-to-Market Profit and Loss,Header,Symbol,Quantity\n"
                        + "Positions and Mark-to-Market Profit and Loss,Data,AAPL,100\n")
                .build());

        assertThat(sections.get(0).getKind()).isEqualTo(SectionKind.POSITIONS);
        assertThat(sections.get(0).getRuleName()).isEqualTo("alias:Positions and");
    }

    @Test
    @DisplayName("Appended rules recognize new section names")
    void customRule() {
        SectionRules rules = SectionRules.defaults()
                .with(SectionRule.prefix("positions-alt", SectionKind.POSITIONS, "Positions and"));
        SectionTokenizer tokenizer = new SectionTokenizer(rules, new CsvLineSplitter());

        List<Section> sections = tokenizer.tokenize(StatementDocument.builder()
                .documentId("doc-2")
                .rawText("Positions and Mark-to-Market Profit and Loss,Header,Symbol,Quantity\n"
                        + "Positions and Mark-to-Market Profit and Loss,Data,AAPL,100\n")
                .build());

        assertThat(sections.get(0).getKind()).isEqualTo(SectionKind.POSITIONS);
        assertThat(sections.get(0).getRuleName()).isEqualTo("positions-alt");
    }
}
