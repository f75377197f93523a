package com.company.clientpulse.service;

import com.company.clientpulse.config.NotificationProperties;
import com.company.clientpulse.config.ProbeProperties;
import com.company.clientpulse.domain.AnalysisResult;
import com.company.clientpulse.domain.CheckResult;
import com.company.clientpulse.domain.CheckRun;
import com.company.clientpulse.domain.DetailValue;
import com.company.clientpulse.domain.EvaluationRequest;
import com.company.clientpulse.domain.Instance;
import com.company.clientpulse.domain.NotificationDecision;
import com.company.clientpulse.domain.NotificationPayload;
import com.company.clientpulse.domain.Regression;
import com.company.clientpulse.domain.enums.CheckCategory;
import com.company.clientpulse.domain.enums.InstanceCategory;
import com.company.clientpulse.domain.enums.SuppressionReason;
import com.company.clientpulse.util.NodeNames;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Decides whether a client's check failures warrant a notification and builds the payload.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationDecisionEngine {

    private final InstanceClassifier classifier;
    private final MentionService mentionService;
    private final NotificationProperties notificationProperties;
    private final ProbeProperties probeProperties;
    private final MeterRegistry meterRegistry;

    public NotificationDecision decide(EvaluationRequest request, CheckRun run) {
        return decide(request, run, null);
    }

    public NotificationDecision decide(EvaluationRequest request, CheckRun run, Regression regression) {
        String client = request.getClient();
        AnalysisResult analysis = run.getAnalysis();

        boolean rootCause = analysis.isRootCause(client);
        boolean unexplained = notificationProperties.isAlertUnexplained() && analysis.hasUnexplainedIssueFor(client);
        if (!rootCause && !unexplained) {
            return suppressed(request, NotificationDecision.suppress(SuppressionReason.NOT_ELIGIBLE));
        }

        List<CheckResult> failing = run.getResults().stream()
                .filter(CheckResult::isFailing)
                .collect(Collectors.toList());
        if (failing.isEmpty()) {
            // correlator blamed the client but no check of its own failed
            return suppressed(request, NotificationDecision.suppress(SuppressionReason.NO_FAILURES));
        }

        SortedSet<Instance> instances = extractInstances(failing, request.getNetwork(), client);
        Map<Instance, InstanceCategory> categories =
                classifier.classifyAll(instances, client, analysis.getRootCauses());
        Map<InstanceCategory, List<Instance>> grouped = group(categories);

        if (!instances.isEmpty() && grouped.get(InstanceCategory.REGULAR).isEmpty()) {
            log.info("Only infrastructure or unrelated issues for {} on {}: {} unreachable, {} unrelated",
                    client, request.getNetwork(),
                    grouped.get(InstanceCategory.INFRASTRUCTURE_ISSUE).size(),
                    grouped.get(InstanceCategory.UNRELATED).size());
            return suppressed(request,
                    NotificationDecision.suppress(SuppressionReason.ONLY_INFRA_OR_UNRELATED, grouped));
        }

        NotificationPayload payload = buildPayload(request, run, failing, grouped, regression);

        meterRegistry.counter("pulse.notifications.decisions",
                "client", client,
                "decision", "send"
        ).increment();

        return NotificationDecision.send(payload, grouped);
    }

    /**
     * Node names attributed to the client, read from the allow-listed detail keys of failing checks.
     * Lines that do not name a {@code <client>-<client>} node are skipped.
     */
    public SortedSet<Instance> extractInstances(List<CheckResult> failing, String network, String client) {
        SortedSet<Instance> instances = new TreeSet<>();

        for (CheckResult result : failing) {
            for (String key : notificationProperties.getDetailKeys()) {
                DetailValue value = result.getDetails().get(key);
                if (value == null) {
                    continue;
                }
                for (String line : value.lines()) {
                    String name = NodeNames.instanceFromLine(line);
                    if (name != null && NodeNames.belongsTo(name, client)) {
                        instances.add(new Instance(name, network, client));
                    }
                }
            }
        }

        return instances;
    }

    private Map<InstanceCategory, List<Instance>> group(Map<Instance, InstanceCategory> categories) {
        Map<InstanceCategory, List<Instance>> grouped = new EnumMap<>(InstanceCategory.class);
        for (InstanceCategory category : InstanceCategory.values()) {
            grouped.put(category, new ArrayList<>());
        }
        categories.forEach((instance, category) -> grouped.get(category).add(instance));
        return grouped;
    }

    private NotificationPayload buildPayload(EvaluationRequest request,
                                             CheckRun run,
                                             List<CheckResult> failing,
                                             Map<InstanceCategory, List<Instance>> grouped,
                                             Regression regression) {
        Map<String, List<String>> failedChecks = new LinkedHashMap<>();
        for (CheckCategory category : CheckCategory.values()) {
            List<String> names = failing.stream()
                    .filter(r -> r.getCategory() == category)
                    .map(CheckResult::getName)
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
            if (!names.isEmpty()) {
                failedChecks.put(category.getDisplayName(), names);
            }
        }
        int activeIssues = failedChecks.values().stream().mapToInt(List::size).sum();

        List<Instance> regular = grouped.get(InstanceCategory.REGULAR);

        return NotificationPayload.builder()
                .title(titleCase(request.getClient()))
                .summary(String.format("%d active issue%s on %s",
                        activeIssues, activeIssues == 1 ? "" : "s", request.getNetwork()))
                .activeIssues(activeIssues)
                .network(request.getNetwork())
                .client(request.getClient())
                .checkId(run.getCheckId())
                .failedChecks(failedChecks)
                .regularInstances(names(regular))
                .accessHints(regular.stream()
                        .map(i -> i.sshCommand(probeProperties.getSshUser(), probeProperties.getDomain()))
                        .collect(Collectors.toList()))
                .unrelatedInstances(names(grouped.get(InstanceCategory.UNRELATED)))
                .infrastructureInstances(names(grouped.get(InstanceCategory.INFRASTRUCTURE_ISSUE)))
                .rootCauses(new ArrayList<>(new TreeSet<>(run.getAnalysis().getRootCauses())))
                .regressions(regression == null ? new ArrayList<>() : regression.describe())
                .mentions(mentionService.activeMentions(request.getNetwork(), request.getClient()))
                .imageUrl(imageUrl(request))
                .generatedAt(Instant.now())
                .build();
    }

    private String imageUrl(EvaluationRequest request) {
        String template = notificationProperties.getImageUrlTemplate();
        if (template == null || template.isBlank()) {
            return null;
        }
        return String.format(template, request.getNetwork(), request.getClient());
    }

    private NotificationDecision suppressed(EvaluationRequest request, NotificationDecision decision) {
        log.info("Notification for {} on {} suppressed: {}", request.getClient(), request.getNetwork(),
                decision.getSuppressionReason().getDescription());

        meterRegistry.counter("pulse.notifications.decisions",
                "client", request.getClient(),
                "decision", decision.getSuppressionReason().name().toLowerCase()
        ).increment();

        return decision;
    }

    private static List<String> names(List<Instance> instances) {
        return instances.stream().map(Instance::getName).collect(Collectors.toList());
    }

    private static String titleCase(String client) {
        if (client == null || client.isEmpty()) {
            return client;
        }
        return Character.toUpperCase(client.charAt(0)) + client.substring(1);
    }
}
