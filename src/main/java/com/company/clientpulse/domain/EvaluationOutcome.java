package com.company.clientpulse.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;

@Getter
@Builder
@ToString
public class EvaluationOutcome {
    private final EvaluationRequest request;
    private final boolean notificationSent;
    private final Throwable error;
    private final Instant startedAt;
    private final Instant finishedAt;

    public boolean isSuccessful() {
        return error == null;
    }

    public boolean isCancelled() {
        return error instanceof CancellationException;
    }

    public Duration getDuration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
