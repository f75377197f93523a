package com.company.clientpulse.service;

import com.company.clientpulse.check.CheckRunner;
import com.company.clientpulse.client.TestResultClient;
import com.company.clientpulse.domain.CheckArtifact;
import com.company.clientpulse.domain.CheckRun;
import com.company.clientpulse.domain.EvaluationRequest;
import com.company.clientpulse.domain.NotificationDecision;
import com.company.clientpulse.domain.Regression;
import com.company.clientpulse.domain.SummaryResult;
import com.company.clientpulse.domain.TestResult;
import com.company.clientpulse.exception.InsufficientHistoryException;
import com.company.clientpulse.exception.StoreException;
import com.company.clientpulse.repository.CheckArtifactRepository;
import com.company.clientpulse.repository.MonitorRepository;
import com.company.clientpulse.repository.SummaryResultRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One evaluation cycle for a target: run checks, diff test results against the previous
 * snapshot, decide and notify. Runs on an evaluation queue worker.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EvaluationWorker implements Evaluator {

    private final CheckRunner checkRunner;
    private final TestResultClient testResultClient;
    private final SummaryAggregator summaryAggregator;
    private final SummaryResultRepository summaryResultRepository;
    private final RegressionDetector regressionDetector;
    private final NotificationDecisionEngine decisionEngine;
    private final NotificationSink notificationSink;
    private final MonitorRepository monitorRepository;
    private final CheckArtifactRepository checkArtifactRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // snapshot history is per network, so clients sharing a network take turns on it
    private final ConcurrentMap<String, Object> networkLocks = new ConcurrentHashMap<>();

    @Override
    public boolean evaluate(EvaluationRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";

        try {
            // check errors abort before any decision
            CheckRun run = checkRunner.run(request.getNetwork(), request.getClient(), request.getClientType());
            MDC.put("checkId", run.getCheckId());
            log.info("Check {} for {} on {} finished with {} result(s)",
                    run.getCheckId(), request.getClient(), request.getNetwork(), run.getResults().size());

            persistArtifact(run);
            recordCheck(request, run.getCheckId());

            Regression regression = findRegression(request);

            NotificationDecision decision = decisionEngine.decide(request, run, regression);
            if (!decision.isSend()) {
                outcome = "suppressed";
                return false;
            }

            boolean sent = notificationSink.send(request.getChannel(), decision.getPayload());
            outcome = sent ? "sent" : "dropped";
            return sent;

        } finally {
            MDC.remove("checkId");
            sample.stop(meterRegistry.timer("pulse.evaluations.duration", "outcome", outcome));
        }
    }

    /**
     * Regression for the request's client, or null when there is nothing to compare.
     * The current snapshot is stored after the previous one has been read, with no other
     * evaluation of the same network in between.
     */
    Regression findRegression(EvaluationRequest request) {
        if (!testResultClient.isEnabled()) {
            return null;
        }

        String network = request.getNetwork();
        synchronized (networkLocks.computeIfAbsent(network, n -> new Object())) {
            return compareWithHistory(request, network);
        }
    }

    private Regression compareWithHistory(EvaluationRequest request, String network) {
        List<TestResult> results = testResultClient.fetchLatest(network);
        SummaryResult current = summaryAggregator.aggregate(network, results);
        if (current == null) {
            log.debug("No test results for {}, skipping regression detection", network);
            return null;
        }

        SummaryResult previous = previousSnapshot(network);
        if (previous != null && previous.getTimestamp() != null
                && previous.getTimestamp().equals(current.getTimestamp())) {
            log.warn("Previous snapshot for {} has the current timestamp, skipping comparison", network);
            previous = null;
        }

        List<TestResult> rawResults = new ArrayList<>(results);
        if (previous != null && previous.getResults() != null) {
            rawResults.addAll(previous.getResults());
        }

        SortedMap<String, Regression> regressions = regressionDetector.detect(current, previous, rawResults);

        summaryResultRepository.storeResult(current);

        return regressions.get(request.getClient());
    }

    private SummaryResult previousSnapshot(String network) {
        try {
            return summaryResultRepository.getPrevious(network);
        } catch (InsufficientHistoryException e) {
            log.info("{}, no regressions reported", e.getMessage());
            return null;
        }
    }

    private void persistArtifact(CheckRun run) {
        try {
            checkArtifactRepository.persist(CheckArtifact.of(run));
        } catch (StoreException e) {
            log.warn("Failed to store artifact for check {}: {}", run.getCheckId(), e.getMessage());
        }
    }

    private void recordCheck(EvaluationRequest request, String checkId) {
        try {
            monitorRepository.get(request.getNetwork(), request.getClient()).ifPresent(target -> {
                target.setLastCheckId(checkId);
                target.setUpdatedAt(clock.instant());
                monitorRepository.persist(target);
            });
        } catch (StoreException e) {
            log.warn("Failed to record check {} on monitor {}: {}", checkId, request.targetKey(), e.getMessage());
        }
    }
}
