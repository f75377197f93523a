package com.company.clientpulse.service;

import com.company.clientpulse.domain.EvaluationRequest;

/**
 * One full evaluation of a monitored target. Runs on a queue worker thread and should
 * stop promptly when that thread is interrupted.
 *
 * @return true when a notification was sent
 */
@FunctionalInterface
public interface Evaluator {
    boolean evaluate(EvaluationRequest request);
}
