package com.company.clientpulse.service;

import com.company.clientpulse.config.ClientCatalog;
import com.company.clientpulse.config.ProbeProperties;
import com.company.clientpulse.domain.Instance;
import com.company.clientpulse.domain.enums.InstanceCategory;
import com.company.clientpulse.domain.enums.ProbeResult;
import com.company.clientpulse.util.NodeNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Labels affected instances as regular, unrelated or infrastructure issues.
 *
 * <p>An instance whose host does not answer with an SSH banner is an infrastructure issue.
 * A reachable instance is unrelated when its other client is pre-production or a root cause,
 * unless the target itself is a root cause, in which case all of its instances are regular.
 */
@Component
@Slf4j
public class InstanceClassifier {

    private final ReachabilityProbe probe;
    private final ClientCatalog catalog;
    private final ProbeProperties properties;
    private final Executor probeExecutor;

    public InstanceClassifier(ReachabilityProbe probe,
                              ClientCatalog catalog,
                              ProbeProperties properties,
                              @Qualifier("probeExecutor") Executor probeExecutor) {
        this.probe = probe;
        this.catalog = catalog;
        this.properties = properties;
        this.probeExecutor = probeExecutor;
    }

    public InstanceCategory classify(Instance instance, String targetClient, Set<String> rootCauses) {
        String host = instance.hostname(properties.getDomain());
        ProbeResult result = probe.probe(host);
        InstanceCategory category = categorize(instance.getName(), result, targetClient, rootCauses);

        log.debug("Instance {} probed {} -> {}", host, result, category);
        return category;
    }

    /**
     * Probes all instances concurrently. The returned map is ordered by instance name.
     */
    public Map<Instance, InstanceCategory> classifyAll(Collection<Instance> instances,
                                                       String targetClient,
                                                       Set<String> rootCauses) {
        Map<Instance, CompletableFuture<InstanceCategory>> pending = new LinkedHashMap<>();
        for (Instance instance : instances) {
            pending.put(instance, CompletableFuture.supplyAsync(
                    () -> classify(instance, targetClient, rootCauses), probeExecutor));
        }

        Map<Instance, InstanceCategory> categories = new TreeMap<>();
        pending.forEach((instance, future) -> categories.put(instance, await(instance, future)));
        return categories;
    }

    /**
     * Classification given an already known probe result. Depends on nothing else.
     */
    public InstanceCategory categorize(String instanceName,
                                       ProbeResult probeResult,
                                       String targetClient,
                                       Set<String> rootCauses) {
        if (!probeResult.isReachable()) {
            return InstanceCategory.INFRASTRUCTURE_ISSUE;
        }

        if (rootCauses.contains(targetClient)) {
            return InstanceCategory.REGULAR;
        }

        String consensus = NodeNames.consensusClient(instanceName);
        String execution = NodeNames.executionClient(instanceName);
        if (consensus == null) {
            return InstanceCategory.REGULAR;
        }

        if (implicates(consensus, targetClient, rootCauses) || implicates(execution, targetClient, rootCauses)) {
            return InstanceCategory.UNRELATED;
        }

        return InstanceCategory.REGULAR;
    }

    private boolean implicates(String component, String targetClient, Set<String> rootCauses) {
        if (component.equals(targetClient)) {
            return false;
        }
        return catalog.isPreProduction(component) || rootCauses.contains(component);
    }

    private InstanceCategory await(Instance instance, CompletableFuture<InstanceCategory> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            log.warn("Classification of {} failed, treating as infrastructure issue", instance.getName(), e.getCause());
            return InstanceCategory.INFRASTRUCTURE_ISSUE;
        }
    }
}
