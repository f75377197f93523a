package com.company.clientpulse.check;

import com.company.clientpulse.domain.CheckResult;
import com.company.clientpulse.domain.CheckRun;
import com.company.clientpulse.domain.DetailValue;
import com.company.clientpulse.domain.enums.CheckCategory;
import com.company.clientpulse.domain.enums.CheckStatus;
import com.company.clientpulse.domain.enums.ClientType;
import com.company.clientpulse.exception.CheckExecutionException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsCheckRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-12T10:15:00Z"), ZoneOffset.UTC);

    /**
     * Check answering from a fixed function of the context.
     */
    private static final class StubCheck implements HealthCheck {
        private final String name;
        private final Function<CheckContext, CheckResult> behaviour;
        private final List<CheckContext> contexts = new ArrayList<>();

        private StubCheck(String name, Function<CheckContext, CheckResult> behaviour) {
            this.name = name;
            this.behaviour = behaviour;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CheckCategory category() {
            return CheckCategory.SYNC;
        }

        @Override
        public ClientType clientType() {
            return ClientType.CONSENSUS;
        }

        @Override
        public CheckResult run(CheckContext context) {
            contexts.add(context);
            return behaviour.apply(context);
        }
    }

    private static CheckResult failing(String name, String detailKey, String... nodes) {
        return CheckResult.builder()
                .name(name)
                .category(CheckCategory.SYNC)
                .status(CheckStatus.FAIL)
                .detail("query", DetailValue.text("eth_con_sync_is_syncing == 1"))
                .detail(detailKey, DetailValue.text(String.join("\n", nodes)))
                .affectedNodes(List.of(nodes))
                .build();
    }

    private static CheckResult passing(String name) {
        return CheckResult.builder()
                .name(name)
                .category(CheckCategory.SYNC)
                .status(CheckStatus.PASS)
                .build();
    }

    private static MetricsCheckRunner runner(HealthCheck... checks) {
        return new MetricsCheckRunner(List.of(checks), CLOCK, new SimpleMeterRegistry());
    }

    @Nested
    @DisplayName("Run")
    class Run {

        @Test
        @DisplayName("Should query every client and narrow failures to the target")
        void shouldNarrowToTarget() {
            // Given
            StubCheck sync = new StubCheck("Node failing to sync", ctx -> failing("Node failing to sync",
                    "notSyncedNodes", "lighthouse-geth-1", "nimbus-geth-1", "prysm-geth-1"));
            StubCheck head = new StubCheck("Head slot not advancing", ctx -> passing("Head slot not advancing"));

            // When
            CheckRun run = runner(sync, head).run("devnet-7", "nimbus", ClientType.CONSENSUS);

            // Then
            assertThat(sync.contexts).hasSize(1);
            assertThat(sync.contexts.get(0).getConsensusClient()).isEqualTo(CheckContext.ALL_CLIENTS);
            assertThat(sync.contexts.get(0).getExecutionClient()).isEqualTo(CheckContext.ALL_CLIENTS);

            assertThat(run.getResults()).hasSize(1);
            CheckResult result = run.getResults().get(0);
            assertThat(result.getAffectedNodes()).containsExactly("nimbus-geth-1");
            assertThat(result.getDetails().get("notSyncedNodes").asText()).isEqualTo("nimbus-geth-1");
            assertThat(result.getDetails()).containsKey("query");

            assertThat(run.getAnalysis().getRootCauses()).containsExactly("geth");
            assertThat(run.hasFailures()).isTrue();
            assertThat(run.getCheckId()).matches("20250312-101500-[0-9a-f]{16}");
            assertThat(run.getLog()).contains("  - NO NOTIFICATION: No root cause or unexplained issues");
        }

        @Test
        @DisplayName("Should abort the run when a check cannot execute")
        void shouldAbortOnCheckError() {
            // Given
            StubCheck broken = new StubCheck("Low peer count", ctx -> {
                throw new IllegalStateException("grafana unavailable");
            });

            // When / Then
            assertThatThrownBy(() -> runner(broken).run("devnet-7", "nimbus", ClientType.CONSENSUS))
                    .isInstanceOf(CheckExecutionException.class)
                    .hasMessageContaining("Low peer count")
                    .hasRootCauseMessage("grafana unavailable");
        }
    }

    @Nested
    @DisplayName("Narrow to client")
    class NarrowToClient {

        @Test
        @DisplayName("Should return null when no node mentions the client")
        void shouldDropUnrelatedResult() {
            CheckResult result = failing("Node failing to sync", "notSyncedNodes", "lighthouse-geth-1");

            assertThat(MetricsCheckRunner.narrowToClient(result, "nimbus")).isNull();
        }

        @Test
        @DisplayName("Should drop detail keys left without lines")
        void shouldDropEmptyDetails() {
            // Given
            CheckResult result = failing("Node failing to sync", "notSyncedNodes", "nimbus-geth-1").toBuilder()
                    .detail("stuckNodes", DetailValue.list(List.of("teku-besu-1")))
                    .detail("threshold", DetailValue.number(5))
                    .build();

            // When
            CheckResult narrowed = MetricsCheckRunner.narrowToClient(result, "nimbus");

            // Then
            assertThat(narrowed.getDetails()).containsOnlyKeys("query", "notSyncedNodes", "threshold");
            assertThat(narrowed.getName()).isEqualTo("Node failing to sync");
        }
    }
}
