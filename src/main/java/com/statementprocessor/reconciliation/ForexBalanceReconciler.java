package com.statementprocessor.reconciliation;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.BalanceSource;
import com.statementprocessor.domain.enums.WarningType;
import com.statementprocessor.domain.model.CashForexRecord;
import com.statementprocessor.domain.model.ForexBalance;
import com.statementprocessor.domain.model.MarkToMarketRecord;
import com.statementprocessor.domain.model.ProcessingWarning;
import com.statementprocessor.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves one closing balance per currency for an account and cross-checks it.
 *
 * <p>Source precedence per currency: Forex Balances section, then the Cash Report "Ending Cash" line,
 * then the Mark-to-Market summary's forex row. A lower-precedence source that differs from the chosen one
 * by more than the tolerance raises FOREX_SOURCE_CONFLICT.
 *
 * <p>For every currency touched by a forex trade in the run, the chosen balance must equal the prior
 * balance (MTM prior quantity, zero when absent) plus the net cash flow of all the run's trades in that
 * currency, within tolerance; otherwise FOREX_DISCREPANCY. A touched currency with no balance from any
 * source raises MISSING_FOREX_BALANCES.
 *
 * <p>Each balance also carries the MTM summary's exchange rate and period P/L for its currency, when the
 * summary has a row for it.
 */
@Component
public class ForexBalanceReconciler {

    private static final Logger log = LoggerFactory.getLogger(ForexBalanceReconciler.class);

    private static final List<BalanceSource> PRECEDENCE =
            List.of(BalanceSource.FOREX_BALANCES, BalanceSource.CASH_REPORT, BalanceSource.MTM_SUMMARY);

    public Resolution resolve(
            String accountId,
            List<CashForexRecord> cashForex,
            List<MarkToMarketRecord> markToMarket,
            List<TradeRecord> trades,
            LocalDate asOfDate,
            BigDecimal tolerance) {

        Map<String, Map<BalanceSource, BigDecimal>> bySource = new TreeMap<>();
        for (CashForexRecord record : cashForex) {
            if (record.isClosingBalance() && record.getAmount() != null) {
                bySource.computeIfAbsent(record.getCurrency(), c -> new EnumMap<>(BalanceSource.class))
                        .merge(record.getSource(), record.getAmount(), BigDecimal::add);
            }
        }
        Map<String, BigDecimal> priorBalances = new TreeMap<>();
        Map<String, MarkToMarketRecord> markedRows = new TreeMap<>();
        for (MarkToMarketRecord record : markToMarket) {
            if (!isCurrencyRow(record)) {
                continue;
            }
            String currency = record.getInstrument().toUpperCase();
            bySource.computeIfAbsent(currency, c -> new EnumMap<>(BalanceSource.class))
                    .merge(BalanceSource.MTM_SUMMARY, record.getCurrentQuantity(), BigDecimal::add);
            priorBalances.merge(currency, record.getPriorQuantity(), BigDecimal::add);
            markedRows.putIfAbsent(currency, record);
        }

        List<ForexBalance> balances = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>();

        for (Map.Entry<String, Map<BalanceSource, BigDecimal>> entry : bySource.entrySet()) {
            String currency = entry.getKey();
            Map<BalanceSource, BigDecimal> candidates = entry.getValue();
            BalanceSource chosen = PRECEDENCE.stream().filter(candidates::containsKey).findFirst().orElseThrow();
            BigDecimal balance = candidates.get(chosen);

            for (Map.Entry<BalanceSource, BigDecimal> other : candidates.entrySet()) {
                if (other.getKey() != chosen && exceeds(balance.subtract(other.getValue()), tolerance)) {
                    warnings.add(warning(
                            WarningType.FOREX_SOURCE_CONFLICT,
                            accountId,
                            currency,
                            currency + " balance " + balance.toPlainString() + " from " + chosen + " differs from "
                                    + other.getValue().toPlainString() + " in " + other.getKey()));
                }
            }

            MarkToMarketRecord marked = markedRows.get(currency);
            balances.add(ForexBalance.builder()
                    .accountId(accountId)
                    .currency(currency)
                    .balance(balance)
                    .asOfDate(asOfDate)
                    .source(chosen)
                    .exchangeRate(marked != null ? marked.getCurrentPrice() : null)
                    .mtmPnl(marked != null ? marked.getTotalPnl() : null)
                    .build());
        }

        for (String currency : currenciesTouchedByForexTrades(trades)) {
            BigDecimal actual = balances.stream()
                    .filter(b -> b.getCurrency().equals(currency))
                    .map(ForexBalance::getBalance)
                    .findFirst()
                    .orElse(null);
            if (actual == null) {
                warnings.add(warning(
                        WarningType.MISSING_FOREX_BALANCES,
                        accountId,
                        currency,
                        "No closing balance for " + currency + " although forex trades touched it"));
                continue;
            }
            BigDecimal expected = priorBalances.getOrDefault(currency, BigDecimal.ZERO).add(netCashFlow(trades, currency));
            if (exceeds(actual.subtract(expected), tolerance)) {
                log.warn("Forex discrepancy for account {} {}: expected={}, actual={}", accountId, currency, expected, actual);
                warnings.add(warning(
                        WarningType.FOREX_DISCREPANCY,
                        accountId,
                        currency,
                        currency + " balance " + actual.toPlainString() + " does not match prior balance plus trade cash flow "
                                + expected.toPlainString()));
            }
        }

        return new Resolution(balances, warnings);
    }

    /** Signed cash flow of the run's trades in one currency: proceeds and commissions, plus forex legs bought or sold. */
    static BigDecimal netCashFlow(List<TradeRecord> trades, String currency) {
        BigDecimal flow = BigDecimal.ZERO;
        for (TradeRecord trade : trades) {
            if (currency.equalsIgnoreCase(trade.getCurrency())) {
                if (trade.getProceeds() != null) {
                    flow = flow.add(trade.getProceeds());
                }
                if (trade.getCommission() != null) {
                    flow = flow.add(trade.getCommission());
                }
            }
            if (trade.getAssetClass() == AssetClass.FOREX && currency.equalsIgnoreCase(baseLeg(trade.getInstrument()))) {
                flow = flow.add(trade.getQuantity());
            }
        }
        return flow;
    }

    private static Set<String> currenciesTouchedByForexTrades(List<TradeRecord> trades) {
        Set<String> touched = new TreeSet<>();
        for (TradeRecord trade : trades) {
            if (trade.getAssetClass() != AssetClass.FOREX) {
                continue;
            }
            String base = baseLeg(trade.getInstrument());
            if (base != null) {
                touched.add(base);
            }
            if (trade.getCurrency() != null) {
                touched.add(trade.getCurrency().toUpperCase());
            }
        }
        return touched;
    }

    private static String baseLeg(String pair) {
        if (pair == null || pair.length() != 7) {
            return null;
        }
        return pair.substring(0, 3).toUpperCase();
    }

    private static boolean isCurrencyRow(MarkToMarketRecord record) {
        return record.getAssetClass() == AssetClass.FOREX
                && record.getInstrument() != null
                && InstrumentClassifier.isCurrencyCode(record.getInstrument().toUpperCase());
    }

    private static boolean exceeds(BigDecimal difference, BigDecimal tolerance) {
        return difference.abs().compareTo(tolerance) > 0;
    }

    private static ProcessingWarning warning(WarningType type, String accountId, String currency, String message) {
        return ProcessingWarning.builder()
                .type(type)
                .accountId(accountId)
                .instrument(currency)
                .message(message)
                .build();
    }

    /** Balances chosen per currency plus the warnings raised while choosing and cross-checking them. */
    public record Resolution(List<ForexBalance> balances, List<ProcessingWarning> warnings) {}
}
