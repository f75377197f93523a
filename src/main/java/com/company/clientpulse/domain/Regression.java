package com.company.clientpulse.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Increase in a client's failed test count between the previous and the current snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Regression {
    private String client;
    private int previousFailures;
    private int currentFailures;
    private int increase;
    @Builder.Default
    private List<TestTypeRegression> testTypes = new ArrayList<>();

    public String summary() {
        return String.format("%d new failures (from %d to %d)", increase, previousFailures, currentFailures);
    }

    /**
     * The summary line followed by one line per regressed test type.
     */
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        lines.add(summary());
        testTypes.forEach(t -> lines.add(t.describe()));
        return lines;
    }
}
