package com.folio.backend.service.pnl;

import com.folio.backend.model.Stock;
import com.folio.backend.model.StockTransaction;
import com.folio.backend.model.TransactionType;
import com.folio.backend.util.MoneyUtils;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FifoRealizedPnlEngineTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 10, 0);

    private final FifoRealizedPnlEngine engine = new FifoRealizedPnlEngine();
    private final Stock xyz = Stock.builder().id(1L).symbol("XYZ").name("Xyz Corp").currentPrice(MoneyUtils.bd("30")).build();
    private final Stock aapl = Stock.builder().id(2L).symbol("AAPL").name("Apple Inc.").currentPrice(MoneyUtils.bd("180")).build();
    private long nextId = 1;

    @Test
    void sellConsumesOldestLotsFirst() {
        RealizedPnl result = engine.calculate(List.of(
                tx(xyz, TransactionType.BUY, 10, "10", T0),
                tx(xyz, TransactionType.BUY, 10, "20", T0.plusMinutes(1)),
                tx(xyz, TransactionType.SELL, 15, "30", T0.plusMinutes(2))
        ));

        assertThat(result.totalSoldCostBasis()).isEqualByComparingTo("200");
        assertThat(result.totalSoldValue()).isEqualByComparingTo("450");
        assertThat(result.amount()).isEqualByComparingTo("250");
        assertThat(result.percentage()).isEqualByComparingTo("125");
    }

    @Test
    void partialSellRealizesGainAgainstFirstLot() {
        RealizedPnl result = engine.calculate(List.of(
                tx(aapl, TransactionType.BUY, 10, "175.43", T0),
                tx(aapl, TransactionType.SELL, 5, "180", T0.plusMinutes(5))
        ));

        assertThat(result.amount()).isEqualByComparingTo("22.85");
        assertThat(result.totalSoldCostBasis()).isEqualByComparingTo("877.15");
        assertThat(result.bySymbol()).singleElement()
                .satisfies(symbol -> assertThat(symbol.symbol()).isEqualTo("AAPL"));
    }

    @Test
    void ordersBySymbolTimestampRegardlessOfInputOrder() {
        RealizedPnl result = engine.calculate(List.of(
                tx(xyz, TransactionType.SELL, 5, "30", T0.plusMinutes(10)),
                tx(xyz, TransactionType.BUY, 5, "20", T0.plusMinutes(5)),
                tx(xyz, TransactionType.BUY, 5, "10", T0)
        ));

        // oldest lot is the 10.00 buy even though it came last in the input
        assertThat(result.totalSoldCostBasis()).isEqualByComparingTo("50");
        assertThat(result.amount()).isEqualByComparingTo("100");
    }

    @Test
    void equalTimestampsKeepLogOrder() {
        RealizedPnl result = engine.calculate(List.of(
                tx(xyz, TransactionType.BUY, 5, "20", T0),
                tx(xyz, TransactionType.BUY, 5, "10", T0),
                tx(xyz, TransactionType.SELL, 5, "30", T0)
        ));

        assertThat(result.totalSoldCostBasis()).isEqualByComparingTo("100");
        assertThat(result.amount()).isEqualByComparingTo("50");
    }

    @Test
    void sellBeyondOpenLotsBooksExcessAtZeroCost() {
        RealizedPnl result = engine.calculate(List.of(
                tx(xyz, TransactionType.BUY, 5, "10", T0),
                tx(xyz, TransactionType.SELL, 8, "12", T0.plusMinutes(1))
        ));

        assertThat(result.totalSoldValue()).isEqualByComparingTo("96");
        assertThat(result.totalSoldCostBasis()).isEqualByComparingTo("50");
        assertThat(result.amount()).isEqualByComparingTo("46");
        assertThat(result.bySymbol().get(0).unmatchedQuantity()).isEqualTo(3);
    }

    @Test
    void keepsSymbolsApart() {
        RealizedPnl result = engine.calculate(List.of(
                tx(xyz, TransactionType.BUY, 10, "10", T0),
                tx(aapl, TransactionType.BUY, 10, "100", T0.plusMinutes(1)),
                tx(xyz, TransactionType.SELL, 10, "15", T0.plusMinutes(2)),
                tx(aapl, TransactionType.SELL, 10, "90", T0.plusMinutes(3))
        ));

        assertThat(result.bySymbol()).extracting(SymbolRealizedPnl::symbol).containsExactly("AAPL", "XYZ");
        assertThat(result.bySymbol()).extracting(SymbolRealizedPnl::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("-100"), new BigDecimal("50"));
        assertThat(result.amount()).isEqualByComparingTo("-50");
        assertThat(result.totalSoldCostBasis()).isEqualByComparingTo("1100");
    }

    @Test
    void noSellsMeansZeroPercentage() {
        RealizedPnl result = engine.calculate(List.of(tx(xyz, TransactionType.BUY, 3, "10", T0)));

        assertThat(result.amount()).isEqualByComparingTo("0");
        assertThat(result.totalSoldCostBasis()).isEqualByComparingTo("0");
        assertThat(result.percentage()).isEqualByComparingTo("0");
    }

    @Test
    void emptyLogIsEmptyResult() {
        assertThat(engine.calculate(List.of())).isEqualTo(RealizedPnl.empty());
    }

    private StockTransaction tx(Stock stock, TransactionType type, int quantity, String price, LocalDateTime at) {
        return StockTransaction.builder()
                .id(nextId++)
                .stock(stock)
                .portfolioId(1L)
                .type(type)
                .quantity(quantity)
                .price(MoneyUtils.bd(price))
                .timestamp(at)
                .build();
    }
}
