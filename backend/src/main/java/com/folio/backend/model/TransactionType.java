package com.folio.backend.model;

public enum TransactionType {
    BUY,
    SELL
}
