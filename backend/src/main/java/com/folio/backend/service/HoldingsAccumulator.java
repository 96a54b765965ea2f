package com.folio.backend.service;

import com.folio.backend.exception.InsufficientSharesException;
import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.model.Holding;
import com.folio.backend.repository.HoldingRepository;
import com.folio.backend.repository.PortfolioRepository;
import com.folio.backend.repository.StockRepository;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Applies fills to the holdings cache using weighted-average cost. Each
 * holding carries its unrounded cost; buys add to it and derive the average
 * with a single rounding, sells shrink it in proportion and leave the average
 * as it was. Touches nothing but the holdings table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldingsAccumulator {

    public static final int COST_SCALE = 10;

    private final HoldingRepository holdingRepository;
    private final PortfolioRepository portfolioRepository;
    private final StockRepository stockRepository;

    @Transactional
    public Holding applyBuy(Long portfolioId, Long stockId, Integer quantity, BigDecimal price) {
        requirePositiveQuantity(quantity);
        if (!MoneyUtils.isPositive(MoneyUtils.scale(price))) {
            throw new InvalidInputException("price", "Price must be greater than zero");
        }
        Optional<Holding> existing = holdingRepository.findByPortfolioIdAndStockId(portfolioId, stockId);
        Holding holding;
        if (existing.isPresent()) {
            holding = existing.get();
            int newQuantity = holding.getQuantity() + quantity;
            BigDecimal cost = addCost(costOf(holding), quantity, price);
            holding.setQuantity(newQuantity);
            holding.setCostBasis(cost);
            holding.setAvgBuyPrice(averageCost(cost, newQuantity));
        } else {
            BigDecimal cost = addCost(BigDecimal.ZERO, quantity, price);
            holding = Holding.builder()
                    .portfolio(portfolioRepository.getReferenceById(portfolioId))
                    .stock(stockRepository.getReferenceById(stockId))
                    .quantity(quantity)
                    .costBasis(cost)
                    .avgBuyPrice(averageCost(cost, quantity))
                    .build();
        }
        Holding saved = holdingRepository.save(holding);
        log.debug("Holding portfolio={} stock={} now qty={} avg={}", portfolioId, stockId,
                saved.getQuantity(), saved.getAvgBuyPrice());
        return saved;
    }

    /**
     * Sell-side pre-check; callers run it before recording anything.
     *
     * @return the holding that backs the sell
     */
    @Transactional(readOnly = true)
    public Holding checkSell(Long portfolioId, Long stockId, Integer quantity) {
        requirePositiveQuantity(quantity);
        Holding holding = holdingRepository.findByPortfolioIdAndStockId(portfolioId, stockId)
                .orElseThrow(() -> new InsufficientSharesException(0, quantity));
        if (holding.getQuantity() < quantity) {
            throw new InsufficientSharesException(holding.getQuantity(), quantity);
        }
        return holding;
    }

    /**
     * @return the remaining holding, or empty when the position was closed and its row deleted
     */
    @Transactional
    public Optional<Holding> applySell(Long portfolioId, Long stockId, Integer quantity) {
        Holding holding = checkSell(portfolioId, stockId, quantity);
        int remaining = holding.getQuantity() - quantity;
        if (remaining == 0) {
            holdingRepository.delete(holding);
            log.debug("Holding portfolio={} stock={} closed", portfolioId, stockId);
            return Optional.empty();
        }
        holding.setCostBasis(reduceCost(costOf(holding), holding.getQuantity(), remaining));
        holding.setQuantity(remaining);
        return Optional.of(holdingRepository.save(holding));
    }

    /**
     * Cost after adding {@code quantity} shares at {@code price}, kept at {@link #COST_SCALE}.
     */
    public static BigDecimal addCost(BigDecimal cost, int quantity, BigDecimal price) {
        BigDecimal added = MoneyUtils.scale(price).multiply(BigDecimal.valueOf(quantity));
        return cost.add(added).setScale(COST_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Cost left after a sell brings {@code heldQuantity} down to {@code remaining}.
     */
    public static BigDecimal reduceCost(BigDecimal cost, int heldQuantity, int remaining) {
        return cost.multiply(BigDecimal.valueOf(remaining))
                .divide(BigDecimal.valueOf(heldQuantity), COST_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code cost / quantity}, rounded once to money scale.
     */
    public static BigDecimal averageCost(BigDecimal cost, int quantity) {
        return cost.divide(BigDecimal.valueOf(quantity), MoneyUtils.SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal costOf(Holding holding) {
        if (holding.getCostBasis() != null) {
            return holding.getCostBasis();
        }
        return MoneyUtils.scale(holding.getAvgBuyPrice()).multiply(BigDecimal.valueOf(holding.getQuantity()));
    }

    private void requirePositiveQuantity(Integer quantity) {
        if (quantity == null || quantity <= 0) {
            throw new InvalidInputException("quantity", "Quantity must be greater than zero");
        }
    }
}
