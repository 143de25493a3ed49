package com.statementprocessor.unit.parser;

import static org.assertj.core.api.Assertions.assertThat;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.MarkToMarketRecord;
import com.statementprocessor.domain.model.ParseResult;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.parser.MarkToMarketSectionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MarkToMarketSectionParserTest {

    @Test
    @DisplayName("Parses instrument and currency rows, skipping the all-assets total")
    void parsesRows() {
        Section section = SectionFixtures.activitySections(SectionKind.MTM_SUMMARY).get(0);

        ParseResult<MarkToMarketRecord> result =
                new MarkToMarketSectionParser().parse(section, SectionFixtures.context());

        assertThat(result.warnings()).isEmpty();
        assertThat(result.records())
                .extracting(MarkToMarketRecord::getInstrument)
                .containsExactly("AAPL", "ASTS 07FEB25 26 C", "ASTS 07FEB25 28 C", "EUR", "USD");
        MarkToMarketRecord usd = result.records().get(4);
        assertThat(usd.getAssetClass()).isEqualTo(AssetClass.FOREX);
        assertThat(usd.getPriorQuantity()).isEqualByComparingTo("10000");
        assertThat(usd.getCurrentQuantity()).isEqualByComparingTo("9803.80");
        assertThat(result.records().get(1).isNew()).isTrue();
        assertThat(result.records().get(1).getTotalPnl()).isEqualByComparingTo("57.90");
    }

    @Test
    @DisplayName("A missing prior quantity reads as zero")
    void missingPriorQuantity() {
        Section section = SectionFixtures.single(
                "Mark-to-Market Performance Summary,Header,Asset Category,Symbol,Prior Quantity,Current Quantity\n"
                        + "Mark-to-Market Performance Summary,Data,Stocks,MSFT,,25\n");

        MarkToMarketRecord record = new MarkToMarketSectionParser()
                .parse(section, SectionFixtures.context())
                .records()
                .get(0);

        assertThat(record.getPriorQuantity()).isEqualByComparingTo("0");
        assertThat(record.getCurrentQuantity()).isEqualByComparingTo("25");
    }
}
