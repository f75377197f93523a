package com.company.clientpulse.service;

import com.company.clientpulse.domain.EvaluationOutcome;
import com.company.clientpulse.event.EvaluationCompletedEvent;
import com.company.clientpulse.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Logs and meters every finished evaluation
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EvaluationOutcomeListener {

    private final MeterRegistry meterRegistry;

    @EventListener
    @Async
    public void onEvaluationCompleted(EvaluationCompletedEvent event) {
        EvaluationOutcome outcome = event.getOutcome();
        String key = outcome.getRequest().targetKey();
        String result = result(outcome);

        meterRegistry.counter("pulse.evaluations.completed",
                "client", outcome.getRequest().getClient(),
                "result", result
        ).increment();

        if (outcome.isSuccessful()) {
            log.info("Evaluation of {} finished in {} ({})",
                    key, TimeUtils.formatDuration(outcome.getDuration().toMillis()), result);
        } else if (outcome.isCancelled()) {
            log.warn("Evaluation of {} cancelled: {}", key, outcome.getError().getMessage());
        } else {
            log.warn("Evaluation of {} failed after {}: {}",
                    key, TimeUtils.formatDuration(outcome.getDuration().toMillis()), outcome.getError().getMessage());
        }
    }

    private static String result(EvaluationOutcome outcome) {
        if (outcome.isCancelled()) {
            return "cancelled";
        }
        if (!outcome.isSuccessful()) {
            return "failed";
        }
        return outcome.isNotificationSent() ? "notified" : "quiet";
    }
}
