package com.company.clientpulse.service;

import com.company.clientpulse.config.ClientCatalog;
import com.company.clientpulse.config.ProbeProperties;
import com.company.clientpulse.domain.Instance;
import com.company.clientpulse.domain.enums.InstanceCategory;
import com.company.clientpulse.domain.enums.ProbeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InstanceClassifierTest {

    @Mock
    private ReachabilityProbe probe;

    private InstanceClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new InstanceClassifier(probe, new ClientCatalog(), new ProbeProperties(), Runnable::run);
    }

    @Nested
    @DisplayName("Categorize")
    class Categorize {

        @ParameterizedTest
        @EnumSource(value = ProbeResult.class, names = {"WRONG_BANNER", "UNREACHABLE", "READ_TIMEOUT"})
        @DisplayName("Should treat every failed probe as an infrastructure issue")
        void shouldFlagFailedProbe(ProbeResult result) {
            assertThat(classifier.categorize("nimbus-geth-1", result, "nimbus", Set.of("nimbus")))
                    .isEqualTo(InstanceCategory.INFRASTRUCTURE_ISSUE);
        }

        @Test
        @DisplayName("Should keep instances regular when the target is a root cause")
        void shouldKeepRegularWhenTargetIsRootCause() {
            assertThat(classifier.categorize("nimbus-ethereumjs-1", ProbeResult.REACHABLE, "nimbus", Set.of("nimbus")))
                    .isEqualTo(InstanceCategory.REGULAR);
        }

        @Test
        @DisplayName("Should mark instances paired with a pre-production client as unrelated")
        void shouldMarkPreProductionPeerUnrelated() {
            assertThat(classifier.categorize("nimbus-ethereumjs-1", ProbeResult.REACHABLE, "nimbus", Set.of()))
                    .isEqualTo(InstanceCategory.UNRELATED);
        }

        @Test
        @DisplayName("Should mark instances paired with another root cause as unrelated")
        void shouldMarkRootCausePeerUnrelated() {
            assertThat(classifier.categorize("nimbus-besu-1", ProbeResult.REACHABLE, "nimbus", Set.of("besu")))
                    .isEqualTo(InstanceCategory.UNRELATED);
        }

        @Test
        @DisplayName("Should not treat the target's own pre-production status as unrelated")
        void shouldIgnoreTargetComponent() {
            assertThat(classifier.categorize("lighthouse-ethereumjs-1", ProbeResult.REACHABLE, "ethereumjs", Set.of()))
                    .isEqualTo(InstanceCategory.REGULAR);
        }

        @Test
        @DisplayName("Should classify identically for identical inputs")
        void shouldBeDeterministic() {
            InstanceCategory first = classifier.categorize("teku-nimbusel-2", ProbeResult.REACHABLE, "teku", Set.of());
            InstanceCategory second = classifier.categorize("teku-nimbusel-2", ProbeResult.REACHABLE, "teku", Set.of());

            assertThat(first).isEqualTo(second).isEqualTo(InstanceCategory.UNRELATED);
        }
    }

    @Nested
    @DisplayName("Probing")
    class Probing {

        @Test
        @DisplayName("Should probe the instance's fully qualified host")
        void shouldProbeHostname() {
            // Given
            Instance instance = new Instance("nimbus-geth-1", "devnet-7", "nimbus");
            when(probe.probe("nimbus-geth-1.devnet-7.ethpandaops.io")).thenReturn(ProbeResult.REACHABLE);

            // When
            InstanceCategory category = classifier.classify(instance, "nimbus", Set.of("nimbus"));

            // Then
            assertThat(category).isEqualTo(InstanceCategory.REGULAR);
        }

        @Test
        @DisplayName("Should classify all instances in name order and absorb probe failures")
        void shouldClassifyAll() {
            // Given
            Instance unreachable = new Instance("nimbus-geth-2", "devnet-7", "nimbus");
            Instance broken = new Instance("nimbus-besu-1", "devnet-7", "nimbus");
            Instance healthy = new Instance("nimbus-geth-1", "devnet-7", "nimbus");

            when(probe.probe("nimbus-geth-2.devnet-7.ethpandaops.io")).thenReturn(ProbeResult.READ_TIMEOUT);
            when(probe.probe("nimbus-besu-1.devnet-7.ethpandaops.io")).thenThrow(new IllegalStateException("boom"));
            when(probe.probe("nimbus-geth-1.devnet-7.ethpandaops.io")).thenReturn(ProbeResult.REACHABLE);

            // When
            Map<Instance, InstanceCategory> categories =
                    classifier.classifyAll(List.of(unreachable, broken, healthy), "nimbus", Set.of("nimbus"));

            // Then
            assertThat(categories.keySet()).extracting(Instance::getName)
                    .containsExactly("nimbus-besu-1", "nimbus-geth-1", "nimbus-geth-2");
            assertThat(categories.get(broken)).isEqualTo(InstanceCategory.INFRASTRUCTURE_ISSUE);
            assertThat(categories.get(healthy)).isEqualTo(InstanceCategory.REGULAR);
            assertThat(categories.get(unreachable)).isEqualTo(InstanceCategory.INFRASTRUCTURE_ISSUE);
        }
    }
}
