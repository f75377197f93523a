package com.company.clientpulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "pulse.test-results")
public class TestResultProperties {
    private boolean enabled = true;
    private String baseUrl = "https://hive.ethpandaops.io";

    /**
     * Network names as published by the test-result API, keyed by our network name.
     */
    private Map<String, String> networkAliases = new HashMap<>();

    public String listingNetwork(String network) {
        return networkAliases.getOrDefault(network, network);
    }
}
