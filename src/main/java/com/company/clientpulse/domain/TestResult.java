package com.company.clientpulse.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One test-suite run as published in a network's test listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestResult {
    private String name;
    private String client;
    private String version;
    private int ntests;
    private int passes;
    private int fails;
    private String fileName;
    private Instant timestamp;
    private String testSuiteId;
    private List<String> clients;
    private Map<String, String> versions;
}
