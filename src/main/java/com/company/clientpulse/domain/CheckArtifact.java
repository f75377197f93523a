package com.company.clientpulse.domain;

import com.company.clientpulse.domain.enums.CheckCategory;
import com.company.clientpulse.domain.enums.CheckStatus;
import com.company.clientpulse.domain.enums.ClientType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Stored record of one check run, looked up by check id when debugging an alert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckArtifact {
    private String checkId;
    private String network;
    private String client;
    private ClientType clientType;
    @Builder.Default
    private List<Result> results = new ArrayList<>();
    @Builder.Default
    private List<String> rootCauses = new ArrayList<>();
    @Builder.Default
    private List<String> unexplainedIssues = new ArrayList<>();
    @Builder.Default
    private List<String> log = new ArrayList<>();
    private Instant startedAt;
    private Instant finishedAt;

    public static CheckArtifact of(CheckRun run) {
        AnalysisResult analysis = run.getAnalysis() == null ? AnalysisResult.empty() : run.getAnalysis();
        return CheckArtifact.builder()
                .checkId(run.getCheckId())
                .network(run.getNetwork())
                .client(run.getTargetClient())
                .clientType(run.getClientType())
                .results(run.getResults().stream().map(Result::of).collect(Collectors.toList()))
                .rootCauses(new ArrayList<>(new TreeSet<>(analysis.getRootCauses())))
                .unexplainedIssues(new ArrayList<>(analysis.getUnexplainedIssues()))
                .log(new ArrayList<>(run.getLog()))
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {
        private String name;
        private CheckCategory category;
        private CheckStatus status;
        private String description;
        private Instant timestamp;
        @Builder.Default
        private Map<String, String> details = new LinkedHashMap<>();
        @Builder.Default
        private List<String> affectedNodes = new ArrayList<>();

        static Result of(CheckResult result) {
            Map<String, String> details = new LinkedHashMap<>();
            result.getDetails().forEach((key, value) -> details.put(key, value.asText()));
            return Result.builder()
                    .name(result.getName())
                    .category(result.getCategory())
                    .status(result.getStatus())
                    .description(result.getDescription())
                    .timestamp(result.getTimestamp())
                    .details(details)
                    .affectedNodes(new ArrayList<>(result.getAffectedNodes()))
                    .build();
        }
    }
}
