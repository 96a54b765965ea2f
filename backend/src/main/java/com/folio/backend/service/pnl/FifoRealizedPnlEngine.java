package com.folio.backend.service.pnl;

import com.folio.backend.model.StockTransaction;
import com.folio.backend.model.TransactionType;
import com.folio.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Realized profit/loss by first-in-first-out lot matching. Stateless: every
 * call replays the log it is given from scratch.
 *
 * <p>Transactions are grouped by symbol and ordered by timestamp; the sort is
 * stable, so equal timestamps keep the order of the input list (log order).
 * A sell larger than all open lots matches what it can and books the rest at
 * zero cost.
 */
@Slf4j
@Component
public class FifoRealizedPnlEngine {

    public RealizedPnl calculate(List<StockTransaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return RealizedPnl.empty();
        }
        Map<String, List<StockTransaction>> bySymbol = new TreeMap<>();
        for (StockTransaction transaction : transactions) {
            bySymbol.computeIfAbsent(transaction.getSymbol(), key -> new ArrayList<>()).add(transaction);
        }

        BigDecimal totalRealized = MoneyUtils.ZERO;
        BigDecimal totalSoldValue = MoneyUtils.ZERO;
        BigDecimal totalCostBasis = MoneyUtils.ZERO;
        List<SymbolRealizedPnl> breakdown = new ArrayList<>();

        for (Map.Entry<String, List<StockTransaction>> entry : bySymbol.entrySet()) {
            SymbolRealizedPnl result = replaySymbol(entry.getKey(), entry.getValue());
            breakdown.add(result);
            totalRealized = MoneyUtils.add(totalRealized, result.amount());
            totalSoldValue = MoneyUtils.add(totalSoldValue, result.soldValue());
            totalCostBasis = MoneyUtils.add(totalCostBasis, result.soldCostBasis());
        }

        return new RealizedPnl(
                totalRealized,
                MoneyUtils.percentage(totalRealized, totalCostBasis),
                totalSoldValue,
                totalCostBasis,
                List.copyOf(breakdown)
        );
    }

    private SymbolRealizedPnl replaySymbol(String symbol, List<StockTransaction> transactions) {
        List<StockTransaction> ordered = new ArrayList<>(transactions);
        ordered.sort(Comparator.comparing(StockTransaction::getTimestamp));

        Deque<OpenLot> lots = new ArrayDeque<>();
        BigDecimal realized = MoneyUtils.ZERO;
        BigDecimal soldValue = MoneyUtils.ZERO;
        BigDecimal soldCostBasis = MoneyUtils.ZERO;
        int unmatched = 0;

        for (StockTransaction transaction : ordered) {
            if (transaction.getType() == TransactionType.BUY) {
                lots.addLast(new OpenLot(transaction.getQuantity(), transaction.getPrice()));
                continue;
            }
            int remaining = transaction.getQuantity();
            BigDecimal sellValue = MoneyUtils.multiply(transaction.getPrice(), transaction.getQuantity());
            BigDecimal costBasis = MoneyUtils.ZERO;
            while (remaining > 0 && !lots.isEmpty()) {
                OpenLot oldest = lots.peekFirst();
                int consumed = oldest.consume(remaining);
                costBasis = MoneyUtils.add(costBasis, MoneyUtils.multiply(oldest.price(), consumed));
                remaining -= consumed;
                if (oldest.isEmpty()) {
                    lots.removeFirst();
                }
            }
            if (remaining > 0) {
                log.warn("SELL {} of {} exceeds open lots by {} shares; excess booked at zero cost",
                        transaction.getId(), symbol, remaining);
                unmatched += remaining;
            }
            realized = MoneyUtils.add(realized, MoneyUtils.subtract(sellValue, costBasis));
            soldValue = MoneyUtils.add(soldValue, sellValue);
            soldCostBasis = MoneyUtils.add(soldCostBasis, costBasis);
        }
        return new SymbolRealizedPnl(symbol, realized, soldValue, soldCostBasis, unmatched);
    }
}
