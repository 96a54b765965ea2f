package com.folio.backend.util;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.Stock;
import com.folio.backend.repository.PortfolioRepository;
import com.folio.backend.repository.StockRepository;
import com.folio.backend.service.AccountBalanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class DatabaseSeeder implements CommandLineRunner {

    private static final List<Stock> DEMO_STOCKS = List.of(
            stock("AAPL", "Apple Inc.", "175.43"),
            stock("GOOGL", "Alphabet Inc.", "2750.12"),
            stock("MSFT", "Microsoft Corporation", "338.85"),
            stock("AMZN", "Amazon.com Inc.", "3380.00"),
            stock("TSLA", "Tesla Inc.", "890.75"),
            stock("META", "Meta Platforms Inc.", "325.20"),
            stock("NVDA", "NVIDIA Corporation", "445.67"),
            stock("NFLX", "Netflix Inc.", "425.89"),
            stock("AMD", "Advanced Micro Devices", "110.45"),
            stock("INTC", "Intel Corporation", "55.78")
    );

    private static final String[][] DEMO_PORTFOLIOS = {
            {"Tech Growth Portfolio", "Focused on high-growth technology companies"},
            {"Dividend Income Portfolio", "Conservative portfolio focused on dividend-paying stocks"},
            {"Aggressive Growth Portfolio", "High-risk, high-reward investment strategy"},
            {"Blue Chip Portfolio", "Large-cap, established companies"},
            {"ESG Sustainable Portfolio", "Environmentally and socially responsible investments"},
            {"Value Investing Portfolio", "Undervalued stocks with strong fundamentals"},
            {"International Diversified", "Global exposure with diverse sector allocation"},
            {"Small Cap Growth", "Small-cap companies with growth potential"},
            {"REIT Portfolio", "Real Estate Investment Trust focused portfolio"},
            {"Balanced Conservative", "Balanced mix of growth and income investments"}
    };

    private final StockRepository stockRepository;
    private final PortfolioRepository portfolioRepository;
    private final AccountBalanceService accountBalanceService;
    private final LedgerProperties ledgerProperties;

    @Override
    @Transactional
    public void run(String... args) {
        if (!ledgerProperties.getSeed().isEnabled()) {
            log.info("⏭️ Demo seeding disabled");
            return;
        }
        if (stockRepository.count() > 0) {
            log.info("⏭️ Database already seeded, skipping...");
            return;
        }
        log.info("🌱 Seeding database with demo data...");
        DEMO_STOCKS.forEach(template -> stockRepository.save(Stock.builder()
                .symbol(template.getSymbol())
                .name(template.getName())
                .currentPrice(template.getCurrentPrice())
                .build()));
        log.info("✅ Stocks created: {}", DEMO_STOCKS.size());

        if (portfolioRepository.count() == 0) {
            for (String[] portfolio : DEMO_PORTFOLIOS) {
                portfolioRepository.save(Portfolio.builder()
                        .name(portfolio[0])
                        .description(portfolio[1])
                        .build());
            }
            log.info("✅ Portfolios created: {}", DEMO_PORTFOLIOS.length);
        }

        // Opens the cash register at the starting balance when it does not exist yet
        accountBalanceService.current();
        log.info("🎉 Database seeding complete");
    }

    private static Stock stock(String symbol, String name, String price) {
        return Stock.builder()
                .symbol(symbol)
                .name(name)
                .currentPrice(MoneyUtils.bd(price))
                .build();
    }
}
