package com.example.invoice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registered API clients, keyed by client id with the secret as value.
 */
@ConfigurationProperties(prefix = "invoice.auth")
public class ClientAuthProperties {

    private Map<String, String> clients = new LinkedHashMap<>();

    public Map<String, String> getClients() {
        return clients;
    }

    public void setClients(Map<String, String> clients) {
        this.clients = clients;
    }
}
