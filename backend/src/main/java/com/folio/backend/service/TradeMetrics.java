package com.folio.backend.service;

import com.folio.backend.model.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TradeMetrics {

    private final MeterRegistry meterRegistry;

    public void recordExecuted(TransactionType side) {
        Counter.builder("ledger_trades_executed_total")
                .tag("side", side.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordRejected(TransactionType side, String reason) {
        Counter.builder("ledger_trades_rejected_total")
                .tag("side", side.name())
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public double executedCount(TransactionType side) {
        Counter counter = meterRegistry.find("ledger_trades_executed_total").tag("side", side.name()).counter();
        return counter == null ? 0.0 : counter.count();
    }

    public double rejectedCount(TransactionType side, String reason) {
        Counter counter = meterRegistry.find("ledger_trades_rejected_total")
                .tag("side", side.name())
                .tag("reason", reason)
                .counter();
        return counter == null ? 0.0 : counter.count();
    }
}
