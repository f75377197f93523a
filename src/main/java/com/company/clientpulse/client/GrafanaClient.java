package com.company.clientpulse.client;

import com.company.clientpulse.config.GrafanaProperties;
import com.company.clientpulse.exception.MetricsQueryException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs PromQL through Grafana's datasource query API and returns the label sets of the
 * series that matched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GrafanaClient {

    private static final String QUERY_PATH = "/api/ds/query";
    private static final String REF_ID = "pulse";

    private final RestTemplate restTemplate;
    private final GrafanaProperties properties;

    public List<Map<String, String>> queryLabels(String expr) {
        JsonNode response;
        try {
            response = restTemplate.postForObject(
                    properties.getBaseUrl() + QUERY_PATH,
                    new HttpEntity<>(buildPayload(expr), headers()),
                    JsonNode.class);
        } catch (RestClientException e) {
            throw new MetricsQueryException("Metrics query failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new MetricsQueryException("Metrics query returned an empty body");
        }

        List<Map<String, String>> series = new ArrayList<>();
        for (JsonNode frame : response.path("results").path(REF_ID).path("frames")) {
            for (JsonNode field : frame.path("schema").path("fields")) {
                JsonNode labels = field.path("labels");
                if (!labels.isObject() || labels.isEmpty()) {
                    continue;
                }
                Map<String, String> labelSet = new HashMap<>();
                labels.fields().forEachRemaining(e -> labelSet.put(e.getKey(), e.getValue().asText()));
                series.add(labelSet);
            }
        }

        log.debug("Metrics query matched {} series", series.size());
        return series;
    }

    private Map<String, Object> buildPayload(String expr) {
        Map<String, Object> query = new HashMap<>();
        query.put("refId", REF_ID);
        query.put("datasource", Map.of("uid", properties.getDatasourceId() == null ? "" : properties.getDatasourceId()));
        query.put("expr", expr);
        query.put("maxDataPoints", 1);
        query.put("intervalMs", 60000);
        query.put("interval", "1m");
        query.put("legendFormat", "({{ingress_user}}) {{instance}}");

        Map<String, Object> payload = new HashMap<>();
        payload.put("queries", List.of(query));
        payload.put("from", properties.getFrom());
        payload.put("to", properties.getTo());
        return payload;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getToken() != null && !properties.getToken().isEmpty()) {
            headers.setBearerAuth(properties.getToken());
        }
        return headers;
    }
}
