package com.company.clientpulse.check;

import com.company.clientpulse.domain.AnalysisResult;
import com.company.clientpulse.domain.enums.ClientType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Works out which client is behind a batch of node failures.
 *
 * <p>Nodes are named {@code <consensus>-<execution>-<index>} and grouped by client pair.
 * When targeting a consensus client, an execution client failing alongside more than
 * {@value #MIN_FAILURES_FOR_ROOT_CAUSE} distinct consensus clients is a root cause. When targeting
 * an execution client, the target itself is the root cause once more than
 * {@value #MIN_FAILURES_FOR_ROOT_CAUSE} of its nodes fail. Failing target nodes that no root
 * cause explains are reported as unexplained issues.
 */
@Slf4j
public class CheckCorrelator {

    static final int MIN_FAILURES_FOR_ROOT_CAUSE = 2;

    private final String targetClient;
    private final ClientType clientType;
    private final Map<ClientPair, Map<String, Boolean>> nodeStatus = new TreeMap<>();

    public CheckCorrelator(String targetClient, ClientType clientType) {
        this.targetClient = targetClient;
        this.clientType = clientType;
    }

    public void addNodeStatus(String nodeName, boolean healthy) {
        ClientPair pair = ClientPair.parse(nodeName);
        if (pair == null) {
            log.debug("Ignoring node {} with no client pair", nodeName);
            return;
        }
        // any failing observation marks the node failing
        nodeStatus.computeIfAbsent(pair, p -> new LinkedHashMap<>())
                .merge(nodeName, healthy, Boolean::logicalAnd);
    }

    public AnalysisResult analyze() {
        AnalysisResult.AnalysisResultBuilder result = AnalysisResult.builder();
        Set<String> rootCauses = new TreeSet<>();

        if (clientType == ClientType.CONSENSUS) {
            // execution client -> consensus clients it fails with
            Map<String, Set<String>> failingPeers = new TreeMap<>();
            nodeStatus.forEach((pair, nodes) -> {
                if (nodes.containsValue(false)) {
                    failingPeers.computeIfAbsent(pair.getExecution(), e -> new TreeSet<>()).add(pair.getConsensus());
                }
            });

            failingPeers.forEach((execution, consensus) -> {
                if (consensus.size() > MIN_FAILURES_FOR_ROOT_CAUSE) {
                    rootCauses.add(execution);
                    result.evidence(execution, String.format("Failing with %d CL clients: %s",
                            consensus.size(), String.join(", ", consensus)));
                }
            });
        } else {
            List<String> failures = targetFailures();
            if (failures.size() > MIN_FAILURES_FOR_ROOT_CAUSE) {
                rootCauses.add(targetClient);
                result.evidence(targetClient, String.format("Failing with %d nodes: %s",
                        failures.size(), String.join(", ", failures)));
            }
        }

        result.rootCauses(rootCauses);
        result.unexplainedIssues(unexplainedIssues(rootCauses));

        AnalysisResult analysis = result.build();
        log.debug("Correlation for {} ({}): root causes {}, unexplained {}",
                targetClient, clientType.getShortName(), analysis.getRootCauses(), analysis.getUnexplainedIssues());
        return analysis;
    }

    private List<String> targetFailures() {
        List<String> failures = new ArrayList<>();
        nodeStatus.forEach((pair, nodes) -> {
            if (isTargetPair(pair)) {
                nodes.forEach((name, healthy) -> {
                    if (!healthy) {
                        failures.add(name);
                    }
                });
            }
        });
        return failures;
    }

    private List<String> unexplainedIssues(Set<String> rootCauses) {
        Set<String> unexplained = new LinkedHashSet<>();
        nodeStatus.forEach((pair, nodes) -> {
            if (isTargetPair(pair) && !isExplained(pair, rootCauses)) {
                nodes.forEach((name, healthy) -> {
                    if (!healthy) {
                        unexplained.add(name);
                    }
                });
            }
        });
        return new ArrayList<>(unexplained);
    }

    private boolean isTargetPair(ClientPair pair) {
        return clientType == ClientType.CONSENSUS
                ? pair.getConsensus().equals(targetClient)
                : pair.getExecution().equals(targetClient);
    }

    private boolean isExplained(ClientPair pair, Set<String> rootCauses) {
        if (clientType == ClientType.EXECUTION && rootCauses.contains(targetClient)) {
            return true;
        }
        String peer = clientType == ClientType.CONSENSUS ? pair.getExecution() : pair.getConsensus();
        return rootCauses.contains(peer);
    }

    @Getter
    @EqualsAndHashCode
    static final class ClientPair implements Comparable<ClientPair> {
        private final String consensus;
        private final String execution;

        private ClientPair(String consensus, String execution) {
            this.consensus = consensus;
            this.execution = execution;
        }

        /**
         * Pair for {@code <cl>-<el>-<index>}; null when the name has fewer than three parts.
         */
        static ClientPair parse(String nodeName) {
            String[] parts = nodeName.split("-");
            if (parts.length < 3) {
                return null;
            }
            return new ClientPair(parts[0], parts[1]);
        }

        @Override
        public int compareTo(ClientPair other) {
            int byConsensus = consensus.compareTo(other.consensus);
            return byConsensus != 0 ? byConsensus : execution.compareTo(other.execution);
        }

        @Override
        public String toString() {
            return consensus + "-" + execution;
        }
    }
}
