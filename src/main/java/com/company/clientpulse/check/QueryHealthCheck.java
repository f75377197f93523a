package com.company.clientpulse.check;

import com.company.clientpulse.client.GrafanaClient;
import com.company.clientpulse.config.ChecksProperties;
import com.company.clientpulse.domain.CheckResult;
import com.company.clientpulse.domain.DetailValue;
import com.company.clientpulse.domain.enums.CheckCategory;
import com.company.clientpulse.domain.enums.CheckStatus;
import com.company.clientpulse.domain.enums.ClientType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * A check that fails for every node returned by its PromQL query. The query is expected to
 * select only unhealthy series; each series' {@code instance} label names a node.
 */
@Slf4j
public class QueryHealthCheck implements HealthCheck {

    private final ChecksProperties.Definition definition;
    private final GrafanaClient grafanaClient;
    private final Clock clock;

    public QueryHealthCheck(ChecksProperties.Definition definition, GrafanaClient grafanaClient, Clock clock) {
        this.definition = definition;
        this.grafanaClient = grafanaClient;
        this.clock = clock;
    }

    @Override
    public String name() {
        return definition.getName();
    }

    @Override
    public CheckCategory category() {
        return definition.getCategory() == null ? CheckCategory.GENERAL : definition.getCategory();
    }

    @Override
    public ClientType clientType() {
        return definition.getClientType();
    }

    @Override
    public CheckResult run(CheckContext context) {
        String query = String.format(definition.getQuery(),
                context.getNetwork(), context.getConsensusClient(), context.getExecutionClient());

        context.print("\n=== Running %s", name());

        TreeSet<String> nodes = new TreeSet<>();
        for (Map<String, String> labels : grafanaClient.queryLabels(query)) {
            String instance = labels.get("instance");
            if (instance == null || instance.isEmpty()) {
                continue;
            }
            String ingressUser = labels.getOrDefault("ingress_user", "");
            String node = ingressUser.isEmpty() ? instance : instance.replace(ingressUser + "-", "");
            nodes.add(node);
            context.print("  - %s", node);
        }

        CheckResult.CheckResultBuilder result = CheckResult.builder()
                .name(name())
                .category(category())
                .timestamp(clock.instant())
                .detail("query", DetailValue.text(query));

        if (nodes.isEmpty()) {
            context.print("  - No affected nodes");
            return result
                    .status(CheckStatus.PASS)
                    .description(definition.getSuccessDescription())
                    .build();
        }

        List<String> affected = List.copyOf(nodes);
        log.debug("{} failing on {} node(s) in {}", name(), affected.size(), context.getNetwork());
        return result
                .status(CheckStatus.FAIL)
                .description(definition.getFailureDescription())
                .detail(definition.getDetailKey(), DetailValue.text(String.join("\n", affected)))
                .affectedNodes(affected)
                .build();
    }
}
