package com.company.clientpulse.domain;

import com.company.clientpulse.domain.enums.EnqueueStatus;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * Answer to an enqueue call. Accepted results carry the future that completes with the
 * evaluation's single outcome; rejected results carry none.
 */
@Getter
public class EnqueueResult {
    private final String targetKey;
    private final EnqueueStatus status;
    private final CompletableFuture<EvaluationOutcome> outcome;

    private EnqueueResult(String targetKey, EnqueueStatus status, CompletableFuture<EvaluationOutcome> outcome) {
        this.targetKey = targetKey;
        this.status = status;
        this.outcome = outcome;
    }

    public static EnqueueResult accepted(String targetKey, CompletableFuture<EvaluationOutcome> outcome) {
        return new EnqueueResult(targetKey, EnqueueStatus.ACCEPTED, outcome);
    }

    public static EnqueueResult rejected(String targetKey, EnqueueStatus status) {
        return new EnqueueResult(targetKey, status, null);
    }

    public boolean isAccepted() {
        return status.isAccepted();
    }
}
