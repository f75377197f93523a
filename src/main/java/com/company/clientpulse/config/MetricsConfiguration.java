package com.company.clientpulse.config;

import com.company.clientpulse.service.EvaluationQueue;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.ObjectProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Evaluation queue metrics, read from the queue's counters on scrape. The queue is resolved
 * lazily since its workers depend on the registry.
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    @Bean
    public MeterBinder evaluationQueueMetrics(ObjectProvider<EvaluationQueue> queue) {
        return (registry) -> {
            Gauge.builder("pulse.queue.depth", queue, q -> q.getObject().stats().getQueueDepth())
                    .description("Evaluations waiting for a worker")
                    .register(registry);

            Gauge.builder("pulse.queue.in_flight", queue, q -> q.getObject().stats().getInFlight())
                    .description("Evaluations currently running")
                    .register(registry);

            FunctionCounter.builder("pulse.queue.enqueued", queue, q -> q.getObject().stats().getEnqueued())
                    .description("Evaluations accepted into the queue")
                    .register(registry);

            FunctionCounter.builder("pulse.queue.rejected", queue, q -> q.getObject().stats().getRejected())
                    .description("Evaluations rejected as duplicate, queue full or stopped")
                    .register(registry);

            FunctionCounter.builder("pulse.queue.started", queue, q -> q.getObject().stats().getStarted())
                    .register(registry);

            FunctionCounter.builder("pulse.queue.succeeded", queue, q -> q.getObject().stats().getSucceeded())
                    .register(registry);

            FunctionCounter.builder("pulse.queue.failed", queue, q -> q.getObject().stats().getFailed())
                    .register(registry);

            FunctionCounter.builder("pulse.queue.notifications_sent", queue, q -> q.getObject().stats().getNotificationsSent())
                    .register(registry);

            log.info("Evaluation queue metrics registered");
        };
    }
}
