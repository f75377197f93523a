package com.company.clientpulse.service;

import com.company.clientpulse.domain.ClientSummary;
import com.company.clientpulse.domain.Regression;
import com.company.clientpulse.domain.SummaryResult;
import com.company.clientpulse.domain.TestResult;
import com.company.clientpulse.domain.TestTypeRegression;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Compares the current summary with the previous one and reports clients whose failed test
 * count went up, broken down by the test types that got worse.
 */
@Service
@Slf4j
public class RegressionDetector {

    /**
     * @param current     summary of the current cycle
     * @param previous    second-most-recent stored summary
     * @param rawResults  per test-type results of both cycles
     * @return regressions keyed by client, in client order
     */
    public SortedMap<String, Regression> detect(SummaryResult current,
                                                SummaryResult previous,
                                                List<TestResult> rawResults) {
        SortedMap<String, Regression> regressions = new TreeMap<>();
        if (current == null || previous == null) {
            return regressions;
        }

        Map<String, ClientSummary> previousClients = orEmpty(previous.getClientResults());
        Map<String, Map<String, TestResult>> currentByType = latestByClientAndType(rawResults, null);
        Map<String, Map<String, TestResult>> previousByType = latestByClientAndType(rawResults, previous.getTimestamp());

        for (ClientSummary summary : new TreeMap<>(orEmpty(current.getClientResults())).values()) {
            String client = summary.getClientName();
            if (summary.getFailedTests() == 0) {
                continue;
            }

            ClientSummary before = previousClients.get(client);
            if (before == null || summary.getFailedTests() <= before.getFailedTests()) {
                continue;
            }

            Regression regression = Regression.builder()
                    .client(client)
                    .previousFailures(before.getFailedTests())
                    .currentFailures(summary.getFailedTests())
                    .increase(summary.getFailedTests() - before.getFailedTests())
                    .testTypes(findTestTypeRegressions(
                            currentByType.getOrDefault(client, Collections.emptyMap()),
                            previousByType.getOrDefault(client, Collections.emptyMap())))
                    .build();

            log.info("Regression for {} on {}: {}", client, current.getNetwork(), regression.summary());
            regressions.put(client, regression);
        }

        return regressions;
    }

    private List<TestTypeRegression> findTestTypeRegressions(Map<String, TestResult> current,
                                                             Map<String, TestResult> previous) {
        List<TestTypeRegression> regressions = new ArrayList<>();

        for (TestResult now : new TreeMap<>(current).values()) {
            TestResult before = previous.get(now.getName());
            if (before == null || now.getFails() <= before.getFails()) {
                continue;
            }

            double failRate = now.getNtests() > 0 ? (double) now.getFails() / now.getNtests() * 100 : 0;
            regressions.add(TestTypeRegression.builder()
                    .testType(now.getName())
                    .previousFails(before.getFails())
                    .currentFails(now.getFails())
                    .increase(now.getFails() - before.getFails())
                    .failRate(failRate)
                    .build());
        }

        return regressions;
    }

    /**
     * Latest result per (client, test type), optionally ignoring results newer than the cutoff.
     */
    private Map<String, Map<String, TestResult>> latestByClientAndType(List<TestResult> results, Instant cutoff) {
        Map<String, Map<String, TestResult>> grouped = new HashMap<>();
        if (results == null) {
            return grouped;
        }

        for (TestResult result : results) {
            if (result.getTimestamp() == null || result.getName() == null || result.getClient() == null) {
                continue;
            }
            if (cutoff != null && result.getTimestamp().isAfter(cutoff)) {
                continue;
            }

            grouped.computeIfAbsent(result.getClient(), c -> new HashMap<>())
                    .merge(result.getName(), result,
                            (existing, candidate) -> candidate.getTimestamp().isAfter(existing.getTimestamp())
                                    ? candidate
                                    : existing);
        }

        return grouped;
    }

    private static <V> Map<String, V> orEmpty(Map<String, V> map) {
        return map == null ? Collections.emptyMap() : map;
    }
}
