package com.folio.backend.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class InsufficientSharesException extends TradingException {

    private final int available;
    private final int requested;

    public InsufficientSharesException(int available, int requested) {
        super(String.format("Insufficient shares. You have %d shares but trying to sell %d", available, requested));
        this.available = available;
        this.requested = requested;
    }

    @Override
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("available", available);
        details.put("requested", requested);
        return details;
    }
}
