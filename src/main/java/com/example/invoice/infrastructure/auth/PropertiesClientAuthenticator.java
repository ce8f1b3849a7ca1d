package com.example.invoice.infrastructure.auth;

import com.example.invoice.application.port.ClientAuthenticator;
import com.example.invoice.config.ClientAuthProperties;
import com.example.invoice.infrastructure.exception.CollaboratorUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Authenticator backed by the {@code invoice.auth.clients} registry.
 * Stands in for the external identity provider; secrets are compared in constant time.
 */
@Service
public class PropertiesClientAuthenticator implements ClientAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(PropertiesClientAuthenticator.class);

    private final Map<String, String> clients;

    public PropertiesClientAuthenticator(ClientAuthProperties properties) {
        this.clients = Map.copyOf(properties.getClients());
        log.info("Client authenticator initialized with {} registered client(s)", clients.size());
    }

    @Override
    public CompletableFuture<Boolean> authenticate(String clientId, String clientSecret) {
        if (clients.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new CollaboratorUnavailableException("No API clients are configured under invoice.auth.clients"));
        }
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(clientSecret)) {
            return CompletableFuture.completedFuture(false);
        }
        String expected = clients.get(clientId);
        boolean authorized = expected != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                clientSecret.getBytes(StandardCharsets.UTF_8));
        if (!authorized) {
            log.info("Rejected credentials for client {}", clientId);
        }
        return CompletableFuture.completedFuture(authorized);
    }
}
