package com.folio.backend.exception;

import lombok.Getter;

@Getter
public class PortfolioNotFoundException extends NotFoundException {

    private final Long portfolioId;

    public PortfolioNotFoundException(Long portfolioId) {
        super("Portfolio not found: " + portfolioId);
        this.portfolioId = portfolioId;
    }
}
