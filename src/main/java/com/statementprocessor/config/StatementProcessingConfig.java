package com.statementprocessor.config;

import com.statementprocessor.domain.enums.SectionKind;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for statement processing.
 *
 * <p>Defaults match a single-account daily activity statement in USD.
 * Properties are read from the {@code statements} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "statements")
@Getter
@Setter
public class StatementProcessingConfig {

    /** Account used when neither the request nor the statement names one. */
    private String defaultAccountId;

    /** Base currency used when the Account Information section does not state one. */
    private String defaultBaseCurrency = "USD";

    /** Contract multiplier for option rows that carry no Mult column. */
    private BigDecimal optionMultiplier = new BigDecimal("100");

    /** Section kinds every statement must contain, in addition to a positions source. */
    private Set<SectionKind> requiredSections = EnumSet.noneOf(SectionKind.class);

    /**
     * Extra section header prefixes and the kind they map to, tried after the built-in rules
     * (e.g. {@code statements.section-aliases[Positions and Mark-to-Market]=POSITIONS}).
     */
    private Map<String, SectionKind> sectionAliases = new LinkedHashMap<>();

    private Reconciliation reconciliation = new Reconciliation();

    private History history = new History();

    @Getter
    @Setter
    public static class Reconciliation {

        /** Absolute difference above which forex cross-checks raise a warning. */
        private BigDecimal forexTolerance = new BigDecimal("1.00");

        /** Net all accounts of a run into one snapshot instead of one per account. */
        private boolean consolidateAccounts = false;

        /** Account id of the consolidated snapshot. */
        private String consolidatedAccountId = "CONSOLIDATED";
    }

    @Getter
    @Setter
    public static class History {

        /** Append trade rows to trade_details for audit. */
        private boolean persistTradeDetails = true;
    }
}
