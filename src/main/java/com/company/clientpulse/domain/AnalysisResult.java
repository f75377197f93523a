package com.company.clientpulse.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Correlator output for a single evaluation. Never persisted.
 */
@Getter
@Builder
@ToString
public class AnalysisResult {
    @Singular
    private final Set<String> rootCauses;
    @Singular
    private final List<String> unexplainedIssues;
    @Singular("evidence")
    private final Map<String, String> rootCauseEvidence;

    public boolean isRootCause(String client) {
        return rootCauses.contains(client);
    }

    public boolean hasUnexplainedIssueFor(String client) {
        return unexplainedIssues.stream().anyMatch(issue -> issue.contains(client));
    }

    public boolean hasFindings() {
        return !rootCauses.isEmpty() || !unexplainedIssues.isEmpty();
    }

    public static AnalysisResult empty() {
        return AnalysisResult.builder().build();
    }
}
