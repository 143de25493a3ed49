package com.statementprocessor.unit.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.statementprocessor.domain.enums.OptionRight;
import com.statementprocessor.domain.enums.WarningType;
import com.statementprocessor.domain.model.OptionContract;
import com.statementprocessor.parser.FieldParseException;
import com.statementprocessor.parser.OptionSymbolParser;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OptionSymbolParserTest {

    @Test
    @DisplayName("Parses the broker display form")
    void displayForm() {
        Optional<OptionContract> contract = OptionSymbolParser.parse("ASTS 07FEB25 26 C");

        assertThat(contract).isPresent();
        assertThat(contract.get().underlying()).isEqualTo("ASTS");
        assertThat(contract.get().expiry()).isEqualTo(LocalDate.of(2025, 2, 7));
        assertThat(contract.get().strike()).isEqualByComparingTo("26");
        assertThat(contract.get().right()).isEqualTo(OptionRight.CALL);
    }

    @Test
    @DisplayName("Display form accepts fractional strikes and puts")
    void fractionalStrikePut() {
        OptionContract contract = OptionSymbolParser.parse("SPY 21MAR25 512.5 P").orElseThrow();

        assertThat(contract.strike()).isEqualByComparingTo("512.5");
        assertThat(contract.right()).isEqualTo(OptionRight.PUT);
    }

    @Test
    @DisplayName("Parses the OCC form with the strike in thousandths")
    void occForm() {
        OptionContract contract = OptionSymbolParser.parse("AAPL  240119C00150000").orElseThrow();

        assertThat(contract.underlying()).isEqualTo("AAPL");
        assertThat(contract.expiry()).isEqualTo(LocalDate.of(2024, 1, 19));
        assertThat(contract.strike()).isEqualByComparingTo("150");
        assertThat(contract.right()).isEqualTo(OptionRight.CALL);
    }

    @Test
    @DisplayName("Tickers, currency pairs and malformed expiries are not options")
    void notOptions() {
        assertThat(OptionSymbolParser.isOption("AAPL")).isFalse();
        assertThat(OptionSymbolParser.isOption("EUR.USD")).isFalse();
        assertThat(OptionSymbolParser.isOption("ASTS 32FEB25 26 C")).isFalse();
        assertThat(OptionSymbolParser.isOption(null)).isFalse();
    }

    @Test
    @DisplayName("Required parse of a non-option raises FIELD_SYMBOL")
    void requiredParse() {
        assertThatThrownBy(() -> OptionSymbolParser.parseRequired("ASTS CALL", "Symbol"))
                .isInstanceOf(FieldParseException.class)
                .satisfies(e -> assertThat(((FieldParseException) e).getWarningType())
                        .isEqualTo(WarningType.FIELD_SYMBOL));
    }
}
