package com.folio.backend.exception;

import java.util.Map;

/**
 * A trade rejected by a ledger rule. Subclasses expose the amounts involved
 * so the error body can state them.
 */
public class TradingException extends RuntimeException {
    public TradingException(String message) {
        super(message);
    }

    public Map<String, Object> details() {
        return Map.of();
    }
}
