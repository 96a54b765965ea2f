package com.folio.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every log line of a request with its request and correlation ids and,
 * for stock and portfolio routes, with the ledger entry it targets
 * ({@code AAPL}, {@code portfolio:7}).
 */
@Component
public class RequestCorrelationFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    static final String REQUEST_ID_KEY = "requestId";
    static final String CORRELATION_ID_KEY = "correlationId";
    static final String TARGET_KEY = "target";

    private static final Pattern STOCK_ROUTE = Pattern.compile("^/api/stocks/([A-Za-z0-9.\\-]+)(/.*)?$");
    private static final Pattern PORTFOLIO_ROUTE = Pattern.compile("^/api/portfolios/(\\d+)(/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = idFrom(request.getHeader(REQUEST_ID_HEADER));
        String correlationId = idFrom(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(REQUEST_ID_KEY, requestId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        String target = targetOf(request.getRequestURI().substring(request.getContextPath().length()));
        if (target != null) {
            MDC.put(TARGET_KEY, target);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_KEY);
            MDC.remove(CORRELATION_ID_KEY);
            MDC.remove(TARGET_KEY);
        }
    }

    static String targetOf(String path) {
        Matcher portfolio = PORTFOLIO_ROUTE.matcher(path);
        if (portfolio.matches()) {
            return "portfolio:" + portfolio.group(1);
        }
        Matcher stock = STOCK_ROUTE.matcher(path);
        if (stock.matches() && !"prices".equals(stock.group(1))) {
            return stock.group(1).toUpperCase(Locale.ROOT);
        }
        return null;
    }

    private String idFrom(String header) {
        return (header == null || header.isBlank()) ? UUID.randomUUID().toString() : header;
    }
}
