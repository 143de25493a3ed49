package com.statementprocessor.reconciliation;

import com.statementprocessor.config.StatementProcessingConfig;
import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.PositionSide;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.enums.WarningType;
import com.statementprocessor.domain.model.CashForexRecord;
import com.statementprocessor.domain.model.ForexBalance;
import com.statementprocessor.domain.model.MarkToMarketRecord;
import com.statementprocessor.domain.model.OptionContract;
import com.statementprocessor.domain.model.OptionPosition;
import com.statementprocessor.domain.model.ParsedStatement;
import com.statementprocessor.domain.model.PortfolioSnapshot;
import com.statementprocessor.domain.model.PositionRecord;
import com.statementprocessor.domain.model.ProcessingWarning;
import com.statementprocessor.domain.model.ReconciliationOutcome;
import com.statementprocessor.domain.model.StatementMetadata;
import com.statementprocessor.domain.model.TradeRecord;
import com.statementprocessor.domain.vo.Money;
import com.statementprocessor.parser.OptionSymbolParser;
import com.statementprocessor.reconciliation.InstrumentClassifier.Classification;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Merges the parsed sections of one statement into portfolio snapshots.
 *
 * <p>Steps per account (or once for all accounts when consolidation is on):
 * <ol>
 *   <li>Positions from Open Positions; MTM rows with a non-zero current quantity fill instruments the
 *       Open Positions section lacks. Quantity disagreements are reported, Open Positions wins.</li>
 *   <li>Every position and trade is classified. Unclassifiable instruments stay in the position detail
 *       as UNCLASSIFIED and out of every total.</li>
 *   <li>Totals (options credit, option mark values, equity value) over base-currency instruments only;
 *       anything quoted in another currency is reported and excluded, never converted.</li>
 *   <li>Closing balance per currency via {@link ForexBalanceReconciler}.</li>
 * </ol>
 *
 * <p>Never throws for data problems: everything recoverable becomes a warning and the snapshot carries
 * best-effort values.
 */
@Service
public class StatementReconciler {

    private static final Logger log = LoggerFactory.getLogger(StatementReconciler.class);

    private final InstrumentClassifier instrumentClassifier;
    private final OptionsCreditCalculator optionsCreditCalculator;
    private final ForexBalanceReconciler forexBalanceReconciler;
    private final StatementProcessingConfig config;

    public StatementReconciler(
            InstrumentClassifier instrumentClassifier,
            OptionsCreditCalculator optionsCreditCalculator,
            ForexBalanceReconciler forexBalanceReconciler,
            StatementProcessingConfig config) {
        this.instrumentClassifier = instrumentClassifier;
        this.optionsCreditCalculator = optionsCreditCalculator;
        this.forexBalanceReconciler = forexBalanceReconciler;
        this.config = config;
    }

    public ReconciliationOutcome reconcile(ParsedStatement parsed, StatementMetadata metadata) {
        String defaultAccount = metadata.getAccountId();
        Function<String, String> accountOf = account -> account != null ? account : defaultAccount;
        boolean consolidate = config.getReconciliation().isConsolidateAccounts();
        Function<String, String> snapshotKey =
                account -> consolidate ? config.getReconciliation().getConsolidatedAccountId() : account;

        // Group every record under the snapshot it contributes to
        Map<String, AccountRecords> groups = new LinkedHashMap<>();
        for (PositionRecord position : parsed.getPositions()) {
            String account = accountOf.apply(position.getAccountId());
            group(groups, snapshotKey.apply(account))
                    .positions
                    .add(position.getAccountId() != null ? position : position.toBuilder().accountId(account).build());
        }
        for (MarkToMarketRecord record : parsed.getMarkToMarket()) {
            String account = accountOf.apply(record.getAccountId());
            group(groups, snapshotKey.apply(account))
                    .markToMarket
                    .computeIfAbsent(account, k -> new ArrayList<>())
                    .add(record);
        }
        for (TradeRecord trade : parsed.getTrades()) {
            String account = accountOf.apply(trade.getAccountId());
            group(groups, snapshotKey.apply(account)).trades.add(trade.toBuilder().accountId(account).build());
        }
        for (CashForexRecord record : parsed.getCashForex()) {
            String account = accountOf.apply(record.getAccountId());
            group(groups, snapshotKey.apply(account))
                    .cashForex
                    .computeIfAbsent(account, k -> new ArrayList<>())
                    .add(record);
        }

        // A statement whose positions were all closed still gets a snapshot
        if (groups.isEmpty() && defaultAccount != null) {
            group(groups, snapshotKey.apply(defaultAccount));
        }

        List<PortfolioSnapshot> snapshots = new ArrayList<>();
        List<TradeRecord> classifiedTrades = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>();

        for (Map.Entry<String, AccountRecords> entry : groups.entrySet()) {
            List<ProcessingWarning> snapshotWarnings = new ArrayList<>();
            PortfolioSnapshot snapshot =
                    reconcileGroup(entry.getKey(), entry.getValue(), metadata, classifiedTrades, snapshotWarnings);
            snapshots.add(snapshot);
            warnings.addAll(snapshotWarnings);
            log.info(
                    "Reconciled snapshot account={} asOf={}: positions={}, optionsCredit={}, forexBalances={}, warnings={}",
                    snapshot.getAccountId(),
                    snapshot.getAsOfDate(),
                    snapshot.getPositions().size(),
                    snapshot.getOptionsCredit().getAmount(),
                    snapshot.getForexBalances().size(),
                    snapshotWarnings.size());
        }

        return new ReconciliationOutcome(snapshots, classifiedTrades, warnings);
    }

    private PortfolioSnapshot reconcileGroup(
            String snapshotAccount,
            AccountRecords records,
            StatementMetadata metadata,
            List<TradeRecord> classifiedTrades,
            List<ProcessingWarning> warnings) {

        String baseCurrency = metadata.getBaseCurrency();

        // 1. Positions: Open Positions first, MTM fills gaps
        Map<String, PositionRecord> positions = new LinkedHashMap<>();
        for (PositionRecord position : records.positions) {
            positions.putIfAbsent(key(position.getAccountId(), position.getInstrument()), position);
        }
        Map<String, MarkToMarketRecord> markedInstruments = new HashMap<>();
        for (Map.Entry<String, List<MarkToMarketRecord>> byAccount : records.markToMarket.entrySet()) {
            for (MarkToMarketRecord mtm : byAccount.getValue()) {
                String key = key(byAccount.getKey(), mtm.getInstrument());
                markedInstruments.putIfAbsent(key, mtm);
                if (isCashRow(mtm) || mtm.getCurrentQuantity().signum() == 0) {
                    continue;
                }
                PositionRecord existing = positions.get(key);
                if (existing == null) {
                    positions.put(key, fromMarkToMarket(byAccount.getKey(), mtm, metadata));
                } else if (existing.getQuantity().compareTo(mtm.getCurrentQuantity()) != 0) {
                    warnings.add(warning(
                            WarningType.QUANTITY_MISMATCH,
                            existing.getAccountId(),
                            existing.getInstrument(),
                            "Open Positions quantity " + existing.getQuantity().toPlainString()
                                    + " differs from MTM summary quantity "
                                    + mtm.getCurrentQuantity().toPlainString()));
                }
            }
        }

        // 2. Classification, one classification warning per instrument
        Set<String> reported = new HashSet<>();
        List<PositionRecord> classified = new ArrayList<>(positions.size());
        for (PositionRecord position : positions.values()) {
            MarkToMarketRecord mtm = markedInstruments.get(key(position.getAccountId(), position.getInstrument()));
            classified.add(withMarkToMarket(classifyPosition(position, reported, warnings), mtm));
        }
        List<TradeRecord> trades = new ArrayList<>(records.trades.size());
        for (TradeRecord trade : records.trades) {
            String key = key(trade.getAccountId(), trade.getInstrument());
            Classification classification = instrumentClassifier.classify(trade.getInstrument(), trade.getAssetClass());
            if (!classification.isClean() && reported.add(key)) {
                warnings.add(warning(
                        classification.warning(),
                        trade.getAccountId(),
                        trade.getInstrument(),
                        classification.reason() + " (trade at line " + trade.getLineNumber() + ")"));
            }
            TradeRecord classifiedTrade = trade.toBuilder().assetClass(classification.assetClass()).build();
            trades.add(classifiedTrade);
            if (classifiedTrade.getAssetClass() != AssetClass.FOREX
                    && !positions.containsKey(key)
                    && !markedInstruments.containsKey(key)) {
                warnings.add(warning(
                        WarningType.TRADE_WITHOUT_POSITION,
                        trade.getAccountId(),
                        trade.getInstrument(),
                        "Trade at line " + trade.getLineNumber() + " has no matching position or MTM row"));
            }
        }
        classifiedTrades.addAll(trades);

        // 3. Base-currency totals
        List<PositionRecord> inBaseCurrency = new ArrayList<>();
        for (PositionRecord position : classified) {
            if (position.getAssetClass() == AssetClass.FOREX || position.getAssetClass() == AssetClass.UNCLASSIFIED) {
                continue;
            }
            if (!baseCurrency.equalsIgnoreCase(position.getCurrency())) {
                warnings.add(warning(
                        WarningType.CURRENCY_MISMATCH,
                        position.getAccountId(),
                        position.getInstrument(),
                        "Position quoted in " + position.getCurrency() + " excluded from " + baseCurrency + " totals"));
                continue;
            }
            inBaseCurrency.add(position);
        }

        Money shortOptions = Money.zero(baseCurrency);
        Money longOptions = Money.zero(baseCurrency);
        Money equities = Money.zero(baseCurrency);
        int openShortOptions = 0;
        for (PositionRecord position : inBaseCurrency) {
            Money value = position.marketValueMoney();
            if (position.getAssetClass() == AssetClass.OPTION) {
                if (position.getSide() == PositionSide.SHORT) {
                    shortOptions = shortOptions.add(value);
                    openShortOptions++;
                } else if (position.getSide() == PositionSide.LONG) {
                    longOptions = longOptions.add(value);
                }
            } else if (position.getAssetClass() == AssetClass.EQUITY) {
                equities = equities.add(value);
            }
        }
        Map<String, BigDecimal> priorQuantities = new HashMap<>();
        markedInstruments.forEach((key, mtm) -> priorQuantities.put(key, mtm.getPriorQuantity()));
        Money optionsCredit = optionsCreditCalculator.calculate(inBaseCurrency, trades, priorQuantities, baseCurrency);

        // 4. Forex balances, resolved per source account and summed per currency when consolidated
        Map<String, ForexBalance> forexBalances = new TreeMap<>();
        Set<String> accounts = new HashSet<>(records.cashForex.keySet());
        accounts.addAll(records.markToMarket.keySet());
        trades.forEach(trade -> accounts.add(trade.getAccountId()));
        for (String account : accounts) {
            ForexBalanceReconciler.Resolution resolution = forexBalanceReconciler.resolve(
                    account,
                    records.cashForex.getOrDefault(account, List.of()),
                    records.markToMarket.getOrDefault(account, List.of()),
                    trades.stream().filter(trade -> account.equals(trade.getAccountId())).toList(),
                    metadata.getPeriodEnd(),
                    config.getReconciliation().getForexTolerance());
            warnings.addAll(resolution.warnings());
            for (ForexBalance balance : resolution.balances()) {
                forexBalances.merge(
                        balance.getCurrency(),
                        balance.toBuilder().accountId(snapshotAccount).build(),
                        (left, right) -> left.toBuilder()
                                .balance(left.getBalance().add(right.getBalance()))
                                .exchangeRate(left.getExchangeRate() != null ? left.getExchangeRate() : right.getExchangeRate())
                                .mtmPnl(sum(left.getMtmPnl(), right.getMtmPnl()))
                                .build());
            }
        }

        return PortfolioSnapshot.builder()
                .accountId(snapshotAccount)
                .asOfDate(metadata.getPeriodEnd())
                .periodStart(metadata.getPeriodStart())
                .baseCurrency(baseCurrency)
                .optionsCredit(optionsCredit)
                .shortOptionMarkValue(shortOptions)
                .longOptionMarkValue(longOptions)
                .equityPositionValue(equities)
                .openShortOptionCount(openShortOptions)
                .forexBalances(List.copyOf(forexBalances.values()))
                .positions(List.copyOf(classified))
                .warningCount(warnings.size())
                .build();
    }

    private PositionRecord classifyPosition(
            PositionRecord position, Set<String> reported, List<ProcessingWarning> warnings) {
        Classification classification =
                instrumentClassifier.classify(position.getInstrument(), position.getAssetClass());
        if (!classification.isClean() && reported.add(key(position.getAccountId(), position.getInstrument()))) {
            warnings.add(warning(
                    classification.warning(), position.getAccountId(), position.getInstrument(), classification.reason()));
        }
        if (position.getAssetClass() == classification.assetClass()) {
            return position;
        }
        return position.toBuilder().assetClass(classification.assetClass()).build();
    }

    private static PositionRecord withMarkToMarket(PositionRecord position, MarkToMarketRecord mtm) {
        if (mtm == null) {
            return position;
        }
        return position.toBuilder().mtmPnl(mtm.getTotalPnl()).newInPeriod(mtm.isNew()).build();
    }

    private static BigDecimal sum(BigDecimal left, BigDecimal right) {
        if (left == null) {
            return right;
        }
        return right != null ? left.add(right) : left;
    }

    private PositionRecord fromMarkToMarket(String account, MarkToMarketRecord mtm, StatementMetadata metadata) {
        Optional<OptionContract> contract = OptionSymbolParser.parse(mtm.getInstrument());
        PositionRecord.PositionRecordBuilder<?, ?> builder;
        BigDecimal multiplier;
        if (contract.isPresent()) {
            OptionContract terms = contract.get();
            builder = OptionPosition.builder()
                    .underlying(terms.underlying())
                    .strike(terms.strike())
                    .expiry(terms.expiry())
                    .right(terms.right());
            multiplier = config.getOptionMultiplier();
        } else {
            builder = PositionRecord.builder();
            multiplier = BigDecimal.ONE;
        }
        // The MTM summary is reported in the base currency and carries no value column
        return builder.accountId(account)
                .instrument(mtm.getInstrument())
                .assetCategory(mtm.getAssetCategory())
                .assetClass(mtm.getAssetClass())
                .currency(metadata.getBaseCurrency())
                .quantity(mtm.getCurrentQuantity())
                .multiplier(multiplier)
                .markPrice(mtm.getCurrentPrice())
                .asOfDate(metadata.getPeriodEnd())
                .source(SectionKind.MTM_SUMMARY)
                .lineNumber(mtm.getLineNumber())
                .build();
    }

    private static boolean isCashRow(MarkToMarketRecord mtm) {
        return mtm.getAssetClass() == AssetClass.FOREX;
    }

    private static AccountRecords group(Map<String, AccountRecords> groups, String snapshotAccount) {
        return groups.computeIfAbsent(snapshotAccount, k -> new AccountRecords());
    }

    private static String key(String account, String instrument) {
        return account + "|" + instrument;
    }

    private static ProcessingWarning warning(WarningType type, String accountId, String instrument, String message) {
        return ProcessingWarning.builder()
                .type(type)
                .accountId(accountId)
                .instrument(instrument)
                .message(message)
                .build();
    }

    /** Records of one snapshot, with MTM and cash rows kept per source account. */
    private static final class AccountRecords {

        private final List<PositionRecord> positions = new ArrayList<>();
        private final List<TradeRecord> trades = new ArrayList<>();
        private final Map<String, List<MarkToMarketRecord>> markToMarket = new LinkedHashMap<>();
        private final Map<String, List<CashForexRecord>> cashForex = new LinkedHashMap<>();
    }
}
