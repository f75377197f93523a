package com.company.clientpulse.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time rollup of a network's test results. Persisted once per day by the snapshot store.
 * The latest per client/test-type results are kept alongside the totals so a later cycle can
 * attribute regressions to individual test types.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SummaryResult {
    private String network;
    private Instant timestamp;
    private int totalTests;
    private int totalPasses;
    private int totalFails;
    private double overallPassRate;
    private Map<String, ClientSummary> clientResults;
    private Set<String> testTypes;
    private List<TestResult> results;
}
