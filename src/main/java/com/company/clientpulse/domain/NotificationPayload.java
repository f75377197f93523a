package com.company.clientpulse.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured alert handed to the notification sink.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPayload {
    private String title;
    private String summary;
    private int activeIssues;
    private String network;
    private String client;
    private String checkId;
    @Builder.Default
    private Map<String, List<String>> failedChecks = new LinkedHashMap<>();
    @Builder.Default
    private List<String> regularInstances = new ArrayList<>();
    @Builder.Default
    private List<String> accessHints = new ArrayList<>();
    @Builder.Default
    private List<String> unrelatedInstances = new ArrayList<>();
    @Builder.Default
    private List<String> infrastructureInstances = new ArrayList<>();
    @Builder.Default
    private List<String> rootCauses = new ArrayList<>();
    @Builder.Default
    private List<String> regressions = new ArrayList<>();
    @Builder.Default
    private List<String> mentions = new ArrayList<>();
    private String imageUrl;
    private Instant generatedAt;
}
