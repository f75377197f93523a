package com.company.clientpulse.domain;

import com.company.clientpulse.domain.enums.ClientType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Output of one check execution: the target's filtered results plus the correlator's analysis.
 */
@Getter
@Builder
@ToString(exclude = "log")
public class CheckRun {
    private final String checkId;
    private final String network;
    private final String targetClient;
    private final ClientType clientType;
    @Singular
    private final List<CheckResult> results;
    private final AnalysisResult analysis;
    @Singular("logLine")
    private final List<String> log;
    private final Instant startedAt;
    private final Instant finishedAt;

    public boolean hasFailures() {
        return results.stream().anyMatch(CheckResult::isFailing);
    }
}
