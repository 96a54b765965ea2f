package com.folio.backend.exception;

import lombok.Getter;

@Getter
public class StockNotFoundException extends NotFoundException {

    private final String symbol;

    public StockNotFoundException(String symbol) {
        super("Stock not found: " + symbol);
        this.symbol = symbol;
    }
}
