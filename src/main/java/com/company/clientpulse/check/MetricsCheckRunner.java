package com.company.clientpulse.check;

import com.company.clientpulse.client.GrafanaClient;
import com.company.clientpulse.config.ChecksProperties;
import com.company.clientpulse.domain.AnalysisResult;
import com.company.clientpulse.domain.CheckResult;
import com.company.clientpulse.domain.CheckRun;
import com.company.clientpulse.domain.DetailValue;
import com.company.clientpulse.domain.enums.ClientType;
import com.company.clientpulse.exception.CheckExecutionException;
import com.company.clientpulse.util.CheckIds;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs all configured checks against every client, correlates the failures, then narrows the
 * results down to the target client.
 */
@Component
@Slf4j
public class MetricsCheckRunner implements CheckRunner {

    private final List<HealthCheck> checks;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Autowired
    public MetricsCheckRunner(ChecksProperties properties, GrafanaClient grafanaClient,
                              Clock clock, MeterRegistry meterRegistry) {
        this(properties.getDefinitions().stream()
                        .map(definition -> (HealthCheck) new QueryHealthCheck(definition, grafanaClient, clock))
                        .collect(Collectors.toList()),
                clock, meterRegistry);
    }

    MetricsCheckRunner(List<HealthCheck> checks, Clock clock, MeterRegistry meterRegistry) {
        this.checks = List.copyOf(checks);
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        log.info("Registered {} health checks", this.checks.size());
    }

    @Override
    public CheckRun run(String network, String client, ClientType clientType) {
        Instant startedAt = clock.instant();
        String checkId = CheckIds.generate(clock);
        CheckContext context = new CheckContext(checkId, network,
                clientType == ClientType.CONSENSUS ? client : CheckContext.ALL_CLIENTS,
                clientType == ClientType.EXECUTION ? client : CheckContext.ALL_CLIENTS);
        context.print("=== Running checks:\n  - %s\n  - %s", client, network);

        // first pass covers every client so the correlator sees the whole network
        CheckContext everyone = context.forAllClients();
        CheckCorrelator correlator = new CheckCorrelator(client, clientType);
        List<CheckResult> allResults = new ArrayList<>();

        for (HealthCheck check : checks) {
            CheckResult result = runCheck(check, everyone, network);
            if (result.isFailing()) {
                result.getAffectedNodes().forEach(node -> correlator.addNodeStatus(node, false));
            }
            allResults.add(result);
        }

        AnalysisResult analysis = correlator.analyze();
        logAnalysis(context, client, analysis);

        List<CheckResult> targetResults = allResults.stream()
                .filter(CheckResult::isFailing)
                .map(result -> narrowToClient(result, client))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        log.info("Check run {} for {} on {}: {}/{} checks failing for client, root causes {}",
                checkId, client, network, targetResults.size(), checks.size(), analysis.getRootCauses());

        return CheckRun.builder()
                .checkId(checkId)
                .network(network)
                .targetClient(client)
                .clientType(clientType)
                .results(targetResults)
                .analysis(analysis)
                .log(context.getLog())
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .build();
    }

    private CheckResult runCheck(HealthCheck check, CheckContext context, String network) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            CheckResult result = check.run(context);
            meterRegistry.counter("pulse.checks.executed",
                    "check", check.name(),
                    "status", result.getStatus().name().toLowerCase()
            ).increment();
            return result;
        } catch (Exception e) {
            meterRegistry.counter("pulse.checks.errors", "check", check.name()).increment();
            log.error("Check {} failed to run on {}", check.name(), network, e);
            throw new CheckExecutionException(check.name(), e);
        } finally {
            sample.stop(meterRegistry.timer("pulse.checks.duration", "check", check.name()));
        }
    }

    /**
     * Copy of a failing result restricted to nodes and detail lines mentioning the client, or
     * null when none do. The query detail is kept as is.
     */
    static CheckResult narrowToClient(CheckResult result, String client) {
        List<String> nodes = result.getAffectedNodes().stream()
                .filter(node -> node.contains(client))
                .collect(Collectors.toList());
        if (nodes.isEmpty()) {
            return null;
        }

        CheckResult.CheckResultBuilder narrowed = result.toBuilder()
                .clearDetails()
                .clearAffectedNodes()
                .affectedNodes(nodes);

        for (Map.Entry<String, DetailValue> detail : result.getDetails().entrySet()) {
            if ("query".equals(detail.getKey())) {
                narrowed.detail(detail.getKey(), detail.getValue());
                continue;
            }
            DetailValue kept = detail.getValue().retainLines(line -> line.contains(client));
            if (kept != null) {
                narrowed.detail(detail.getKey(), kept);
            }
        }

        return narrowed.build();
    }

    private void logAnalysis(CheckContext context, String client, AnalysisResult analysis) {
        context.print("\n=== Analysis summary");
        if (!analysis.hasFindings()) {
            context.print("  - No issues detected");
        }
        analysis.getRootCauses().forEach(rc -> context.print("  - %s identified as root cause (%s)",
                rc, analysis.getRootCauseEvidence().get(rc)));
        analysis.getUnexplainedIssues().forEach(issue -> context.print("  - %s (unexplained issue)", issue));

        context.print("\n=== Notification decision");
        if (analysis.isRootCause(client)) {
            context.print("  - NOTIFY: Client identified as root cause");
        } else if (analysis.hasUnexplainedIssueFor(client)) {
            context.print("  - NOTIFY: Client has unexplained issues");
        } else {
            context.print("  - NO NOTIFICATION: No root cause or unexplained issues");
        }
    }
}
