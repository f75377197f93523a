package com.company.clientpulse.config;

import com.company.clientpulse.service.EvaluationQueue;
import com.company.clientpulse.service.Evaluator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class QueueConfig {

    @Bean(initMethod = "start", destroyMethod = "stop")
    public EvaluationQueue evaluationQueue(Evaluator evaluator,
                                           ApplicationEventPublisher eventPublisher,
                                           Clock clock,
                                           @Value("${pulse.queue.workers:4}") int workers,
                                           @Value("${pulse.queue.capacity:100}") int capacity,
                                           @Value("${pulse.queue.shutdown-grace:30s}") Duration shutdownGrace) {
        return new EvaluationQueue(evaluator, eventPublisher, clock, workers, capacity, shutdownGrace);
    }
}
