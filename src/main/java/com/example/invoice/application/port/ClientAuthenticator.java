package com.example.invoice.application.port;

import java.util.concurrent.CompletableFuture;

/**
 * Decides whether a client id/secret pair may upload invoices.
 */
public interface ClientAuthenticator {

    /**
     * @param clientId     client identifier from the request, may be {@code null}
     * @param clientSecret client secret from the request, may be {@code null}
     * @return future completing with {@code true} when the client is authorized;
     *         completes exceptionally when the authenticator itself fails
     */
    CompletableFuture<Boolean> authenticate(String clientId, String clientSecret);
}
