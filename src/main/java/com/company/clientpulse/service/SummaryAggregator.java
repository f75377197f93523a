package com.company.clientpulse.service;

import com.company.clientpulse.domain.ClientSummary;
import com.company.clientpulse.domain.SummaryResult;
import com.company.clientpulse.domain.TestResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rolls per test-type results up into a network summary. Only the latest result for each
 * (client, test type) counts. Totals satisfy {@code passes + fails == tests} at every level.
 */
@Component
@Slf4j
public class SummaryAggregator {

    private static final String UNKNOWN = "unknown";

    private final Clock clock;

    public SummaryAggregator(Clock clock) {
        this.clock = clock;
    }

    public SummaryResult aggregate(String network, List<TestResult> results) {
        if (results == null || results.isEmpty()) {
            return null;
        }

        Map<String, Map<String, TestResult>> latest = new TreeMap<>();
        for (TestResult result : results) {
            if (result.getName() == null || result.getClient() == null) {
                log.debug("Ignoring test result without name or client on {}", network);
                continue;
            }
            latest.computeIfAbsent(result.getClient(), c -> new TreeMap<>())
                    .merge(result.getName(), result, SummaryAggregator::newer);
        }
        if (latest.isEmpty()) {
            return null;
        }

        Instant timestamp = latest.values().stream()
                .flatMap(byType -> byType.values().stream())
                .map(TestResult::getTimestamp)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElseGet(clock::instant);

        Map<String, ClientSummary> clientResults = new TreeMap<>();
        TreeSet<String> testTypes = new TreeSet<>();
        List<TestResult> kept = new ArrayList<>();
        int totalTests = 0;
        int totalPasses = 0;
        int totalFails = 0;

        for (Map.Entry<String, Map<String, TestResult>> entry : latest.entrySet()) {
            String client = entry.getKey();
            ClientSummary summary = ClientSummary.builder()
                    .clientName(client)
                    .clientVersion(UNKNOWN)
                    .testTypes(new ArrayList<>(entry.getValue().keySet()))
                    .build();

            for (TestResult result : entry.getValue().values()) {
                if (UNKNOWN.equals(summary.getClientVersion()) && result.getVersion() != null
                        && !result.getVersion().isEmpty()) {
                    summary.setClientVersion(result.getVersion());
                }

                int passes = result.getPasses();
                int fails = result.getFails();
                if (passes + fails != result.getNtests()) {
                    log.debug("Result {} for {} reports {} tests but {} passes and {} fails, using their sum",
                            result.getName(), client, result.getNtests(), passes, fails);
                }

                summary.setTotalTests(summary.getTotalTests() + passes + fails);
                summary.setPassedTests(summary.getPassedTests() + passes);
                summary.setFailedTests(summary.getFailedTests() + fails);
                testTypes.add(result.getName());
                kept.add(result);
            }

            summary.setPassRate(rate(summary.getPassedTests(), summary.getTotalTests()));
            totalTests += summary.getTotalTests();
            totalPasses += summary.getPassedTests();
            totalFails += summary.getFailedTests();
            clientResults.put(client, summary);
        }

        return SummaryResult.builder()
                .network(network)
                .timestamp(timestamp)
                .totalTests(totalTests)
                .totalPasses(totalPasses)
                .totalFails(totalFails)
                .overallPassRate(rate(totalPasses, totalTests))
                .clientResults(clientResults)
                .testTypes(testTypes)
                .results(kept)
                .build();
    }

    private static TestResult newer(TestResult existing, TestResult candidate) {
        if (existing.getTimestamp() == null) {
            return candidate;
        }
        if (candidate.getTimestamp() == null) {
            return existing;
        }
        return candidate.getTimestamp().isAfter(existing.getTimestamp()) ? candidate : existing;
    }

    private static double rate(int passed, int total) {
        return total > 0 ? (double) passed / total * 100 : 0;
    }
}
