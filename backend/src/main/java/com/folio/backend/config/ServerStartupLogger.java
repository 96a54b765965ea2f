package com.folio.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Prints where the ledger API listens and which ledger settings it booted with.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final LedgerProperties ledgerProperties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        String address = environment.getProperty("server.address");
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        UriComponentsBuilder root = UriComponentsBuilder.newInstance()
                .scheme("http")
                .host(host)
                .port(event.getWebServer().getPort())
                .path(environment.getProperty("server.servlet.context-path", ""));
        String apiUrl = root.cloneBuilder().path("/api").toUriString();
        String docsUrl = root.cloneBuilder()
                .path(environment.getProperty("springdoc.swagger-ui.path", "/swagger-ui.html"))
                .toUriString();

        log.info("Ledger API ready at {} (docs: {})", apiUrl, docsUrl);
        log.info("Ledger account {} starting balance {}, demo seeding {}, reconcile on startup {}",
                ledgerProperties.getAccountId(), ledgerProperties.getStartingBalance(),
                ledgerProperties.getSeed().isEnabled() ? "on" : "off",
                ledgerProperties.getReconcile().isOnStartup() ? "on" : "off");
    }
}
