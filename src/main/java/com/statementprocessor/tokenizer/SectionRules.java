package com.statementprocessor.tokenizer;

import com.statementprocessor.domain.enums.SectionKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered header rule table. This list is the de facto statement format contract: new statement
 * variants are supported by appending rules, and order decides precedence when two rules could match.
 *
 * <p>Default order:
 * <ol>
 *   <li>statement-info: {@code Statement}</li>
 *   <li>account-info: {@code Account Information}</li>
 *   <li>mtm-summary: {@code Mark-to-Market Performance Summary*} (prefix, so per-account variants match)</li>
 *   <li>trades: {@code Trades}</li>
 *   <li>open-positions: {@code Open Positions}</li>
 *   <li>forex-balances: {@code Forex Balances}</li>
 *   <li>cash-report: {@code Cash Report}</li>
 * </ol>
 */
public final class SectionRules {

    private final List<SectionRule> rules;

    private SectionRules(List<SectionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static SectionRules defaults() {
        return new SectionRules(List.of(
                SectionRule.exact("statement-info", SectionKind.STATEMENT_INFO, "Statement"),
                SectionRule.exact("account-info", SectionKind.ACCOUNT_INFO, "Account Information"),
                SectionRule.prefix("mtm-summary", SectionKind.MTM_SUMMARY, "Mark-to-Market Performance Summary"),
                SectionRule.exact("trades", SectionKind.TRADES, "Trades"),
                SectionRule.exact("open-positions", SectionKind.POSITIONS, "Open Positions"),
                SectionRule.exact("forex-balances", SectionKind.CASH_FOREX, "Forex Balances"),
                SectionRule.exact("cash-report", SectionKind.CASH_FOREX, "Cash Report")));
    }

    /** Returns a copy with {@code rule} appended after the existing rules. */
    public SectionRules with(SectionRule rule) {
        List<SectionRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new SectionRules(extended);
    }

    /** First rule matching the section name, in precedence order. */
    public Optional<SectionRule> match(String sectionName) {
        return rules.stream().filter(rule -> rule.matches(sectionName)).findFirst();
    }

    public List<SectionRule> asList() {
        return rules;
    }
}
