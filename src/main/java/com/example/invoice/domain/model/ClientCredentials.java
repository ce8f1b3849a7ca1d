package com.example.invoice.domain.model;

/**
 * Client id/secret pair forwarded untouched to the authenticator.
 */
public record ClientCredentials(String clientId, String clientSecret) {

    @Override
    public String toString() {
        return "ClientCredentials[clientId=" + clientId + ", clientSecret=****]";
    }
}
