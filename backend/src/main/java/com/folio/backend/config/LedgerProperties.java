package com.folio.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Data
@Validated
public class LedgerProperties {

    // Single-ledger model: every balance and snapshot row belongs to this account
    @NotNull
    private Long accountId = 1L;

    @NotNull
    @PositiveOrZero
    private BigDecimal startingBalance = new BigDecimal("100000.00");

    @Min(1)
    private int netWorthHistoryDefaultLimit = 50;

    @Min(1)
    private int recentTransactionsLimit = 50;

    @Min(1)
    private int detailTransactionsLimit = 20;

    @Min(1)
    private int dashboardTransactionsLimit = 10;

    @Valid
    private Seed seed = new Seed();

    @Valid
    private Reconcile reconcile = new Reconcile();

    @Data
    public static class Seed {
        private boolean enabled = true;
    }

    @Data
    public static class Reconcile {
        private boolean onStartup = false;
    }
}
