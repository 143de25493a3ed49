package com.statementprocessor.reconciliation;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.PositionSide;
import com.statementprocessor.domain.enums.TradeAction;
import com.statementprocessor.domain.model.PositionRecord;
import com.statementprocessor.domain.model.TradeRecord;
import com.statementprocessor.domain.vo.Money;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Net premium retained on open short option positions.
 *
 * <p>Each short option position is split into the contracts carried in from an earlier period and the
 * contracts opened in this run:
 * <ul>
 *   <li>opened in this run: premium received on its sells minus premium paid on its buys, taken from the
 *       signed trade proceeds</li>
 *   <li>carried in: the premium still held for those contracts. The cost basis covers every open contract,
 *       so the carried share is the absolute cost basis less the proceeds of this run's opening sells; without
 *       a cost basis it is cost price times carried quantity times multiplier</li>
 * </ul>
 * The carried quantity is the MTM prior quantity when the summary has a row for the leg, otherwise the
 * position quantity less the contracts opened in the run plus those bought back.
 *
 * <p>Long options, closed positions and positions outside the base currency contribute nothing; the caller
 * filters out the latter and reports them.
 */
@Component
public class OptionsCreditCalculator {

    private static final Logger log = LoggerFactory.getLogger(OptionsCreditCalculator.class);

    /**
     * @param priorQuantities MTM prior quantity per {@code account|instrument}, for the legs the summary lists
     */
    public Money calculate(
            List<PositionRecord> positions,
            List<TradeRecord> trades,
            Map<String, BigDecimal> priorQuantities,
            String baseCurrency) {
        Map<String, List<TradeRecord>> tradesByInstrument = trades.stream()
                .filter(trade -> trade.getAssetClass() == AssetClass.OPTION)
                .collect(Collectors.groupingBy(OptionsCreditCalculator::key));

        Money total = Money.zero(baseCurrency);
        for (PositionRecord position : positions) {
            if (position.getAssetClass() != AssetClass.OPTION || position.getSide() != PositionSide.SHORT) {
                continue;
            }
            if (!baseCurrency.equalsIgnoreCase(position.getCurrency())) {
                continue;
            }
            List<TradeRecord> legTrades = tradesByInstrument.getOrDefault(key(position), List.of());
            Money credit = credit(position, legTrades, priorQuantities.get(key(position)), baseCurrency);
            log.debug("Options credit {} {}: {}", position.getAccountId(), position.getInstrument(), credit.getAmount());
            total = total.add(credit);
        }
        return total;
    }

    private static Money credit(
            PositionRecord position, List<TradeRecord> legTrades, BigDecimal priorQuantity, String baseCurrency) {
        List<TradeRecord> openingSells = legTrades.stream()
                .filter(trade -> trade.getAction() == TradeAction.SELL && !trade.isClosing())
                .toList();
        if (openingSells.isEmpty()) {
            return carriedPremium(position, position.getQuantity().abs(), BigDecimal.ZERO, baseCurrency);
        }

        BigDecimal carriedQuantity;
        if (priorQuantity != null) {
            carriedQuantity = priorQuantity.signum() < 0 ? priorQuantity.abs() : BigDecimal.ZERO;
        } else {
            BigDecimal opened = sumQuantity(openingSells);
            BigDecimal boughtBack = sumQuantity(legTrades.stream()
                    .filter(trade -> trade.getAction() == TradeAction.BUY)
                    .toList());
            carriedQuantity = position.getQuantity().abs().subtract(opened).add(boughtBack).max(BigDecimal.ZERO);
        }

        Money fromTrades = premiumFromTrades(legTrades, baseCurrency);
        if (carriedQuantity.signum() == 0) {
            return fromTrades;
        }
        BigDecimal openingProceeds = openingSells.stream()
                .map(trade -> trade.getProceeds() != null ? trade.getProceeds().abs() : BigDecimal.ZERO)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return fromTrades.add(carriedPremium(position, carriedQuantity, openingProceeds, baseCurrency));
    }

    private static BigDecimal sumQuantity(List<TradeRecord> trades) {
        return trades.stream()
                .map(trade -> trade.getQuantity() != null ? trade.getQuantity().abs() : BigDecimal.ZERO)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static Money premiumFromTrades(List<TradeRecord> legTrades, String baseCurrency) {
        BigDecimal received = BigDecimal.ZERO;
        BigDecimal paid = BigDecimal.ZERO;
        for (TradeRecord trade : legTrades) {
            BigDecimal proceeds = trade.getProceeds() != null ? trade.getProceeds() : BigDecimal.ZERO;
            if (trade.getAction() == TradeAction.SELL) {
                received = received.add(proceeds.abs());
            } else if (trade.getAction() == TradeAction.BUY) {
                paid = paid.add(proceeds.abs());
            }
        }
        return Money.of(received.subtract(paid), baseCurrency);
    }

    private static Money carriedPremium(
            PositionRecord position, BigDecimal carriedQuantity, BigDecimal openingProceeds, String baseCurrency) {
        if (position.getCostBasis() != null) {
            return Money.of(position.getCostBasis().abs().subtract(openingProceeds).max(BigDecimal.ZERO), baseCurrency);
        }
        if (position.getCostPrice() != null) {
            BigDecimal multiplier = position.getMultiplier() != null ? position.getMultiplier() : BigDecimal.ONE;
            return Money.of(position.getCostPrice().multiply(carriedQuantity).multiply(multiplier).abs(), baseCurrency);
        }
        return Money.zero(baseCurrency);
    }

    private static String key(TradeRecord trade) {
        return trade.getAccountId() + "|" + trade.getInstrument();
    }

    private static String key(PositionRecord position) {
        return position.getAccountId() + "|" + position.getInstrument();
    }
}
