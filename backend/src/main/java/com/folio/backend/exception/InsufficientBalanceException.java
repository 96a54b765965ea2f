package com.folio.backend.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class InsufficientBalanceException extends TradingException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBalanceException(BigDecimal required, BigDecimal available) {
        super(String.format("Insufficient balance. You need $%s but only have $%s",
                required.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                available.setScale(2, RoundingMode.HALF_UP).toPlainString()));
        this.required = required;
        this.available = available;
    }

    @Override
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required", required);
        details.put("available", available);
        return details;
    }
}
