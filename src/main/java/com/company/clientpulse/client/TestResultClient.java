package com.company.clientpulse.client;

import com.company.clientpulse.config.TestResultProperties;
import com.company.clientpulse.domain.TestResult;
import com.company.clientpulse.exception.TestResultFetchException;
import com.company.clientpulse.util.TimeUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a network's test listing ({@code <base>/<network>/listing.jsonl}), one JSON object per line.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TestResultClient {

    private static final String UNKNOWN = "unknown";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TestResultProperties properties;

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    /**
     * Latest result per client and test type. A network without a listing yields no results.
     */
    public List<TestResult> fetchLatest(String network) {
        String url = String.format("%s/%s/listing.jsonl", properties.getBaseUrl(), properties.listingNetwork(network));
        log.debug("Fetching test results from {}", url);

        String body;
        try {
            body = restTemplate.getForObject(url, String.class);
        } catch (HttpClientErrorException.NotFound e) {
            log.info("No test results published for network {}", network);
            return List.of();
        } catch (RestClientException e) {
            throw new TestResultFetchException(network, e);
        }

        return latestPerClientAndType(parseListing(network, body));
    }

    List<TestResult> parseListing(String network, String body) {
        List<TestResult> results = new ArrayList<>();
        if (body == null) {
            return results;
        }

        int skipped = 0;
        for (String line : body.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                TestResult result = objectMapper.readValue(line, TestResult.class);
                if (result.getName() == null || result.getName().isBlank()) {
                    skipped++;
                    continue;
                }
                results.add(normalize(network, result));
            } catch (JsonProcessingException e) {
                skipped++;
            }
        }

        if (skipped > 0) {
            log.warn("Skipped {} malformed or unnamed test result line(s) for {}", skipped, network);
        }
        return results;
    }

    private TestResult normalize(String network, TestResult result) {
        if (result.getTimestamp() == null || !result.getTimestamp().isAfter(Instant.EPOCH)) {
            result.setTimestamp(TimeUtils.timestampFromFileName(result.getFileName()).orElse(null));
        }

        if (result.getClients() != null && !result.getClients().isEmpty()) {
            String fullName = result.getClients().get(0);
            int separator = fullName.indexOf('_');
            result.setClient(separator > 0 ? fullName.substring(0, separator) : fullName);

            if (result.getVersions() != null && result.getVersions().containsKey(fullName)) {
                result.setVersion(result.getVersions().get(fullName));
            }
        }

        if (result.getClient() == null || result.getClient().isEmpty()) {
            result.setClient(UNKNOWN);
        }
        if (result.getVersion() == null || result.getVersion().isEmpty()) {
            result.setVersion(UNKNOWN);
        }
        if (result.getTestSuiteId() == null || result.getTestSuiteId().isEmpty()) {
            result.setTestSuiteId(network);
        }
        return result;
    }

    private List<TestResult> latestPerClientAndType(List<TestResult> results) {
        Map<String, TestResult> latest = new HashMap<>();
        for (TestResult result : results) {
            latest.merge(result.getClient() + "/" + result.getName(), result, (existing, candidate) -> {
                if (existing.getTimestamp() == null) {
                    return candidate;
                }
                if (candidate.getTimestamp() == null) {
                    return existing;
                }
                return candidate.getTimestamp().isAfter(existing.getTimestamp()) ? candidate : existing;
            });
        }
        return new ArrayList<>(latest.values());
    }
}
