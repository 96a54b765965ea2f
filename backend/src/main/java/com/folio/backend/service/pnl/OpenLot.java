package com.folio.backend.service.pnl;

import java.math.BigDecimal;

/**
 * Shares bought in one fill that have not yet been matched by a sell.
 */
final class OpenLot {

    private int quantity;
    private final BigDecimal price;

    OpenLot(int quantity, BigDecimal price) {
        this.quantity = quantity;
        this.price = price;
    }

    BigDecimal price() {
        return price;
    }

    int consume(int requested) {
        int consumed = Math.min(requested, quantity);
        quantity -= consumed;
        return consumed;
    }

    boolean isEmpty() {
        return quantity == 0;
    }
}
