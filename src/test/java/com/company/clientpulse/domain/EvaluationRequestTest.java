package com.company.clientpulse.domain;

import com.company.clientpulse.domain.enums.ClientType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluationRequestTest {

    @Test
    @DisplayName("Should keep dashed network names apart from dashed client names")
    void shouldNotCollideOnDashes() {
        assertThat(EvaluationRequest.targetKey("pectra-devnet", "7"))
                .isNotEqualTo(EvaluationRequest.targetKey("pectra", "devnet-7"));
        assertThat(EvaluationRequest.targetKey("devnet-7", "nimbus")).isEqualTo("devnet-7/nimbus");
    }

    @Test
    @DisplayName("Should build the request and key from a monitor")
    void shouldBuildFromMonitor() {
        // Given
        MonitoredTarget target = MonitoredTarget.builder()
                .network("devnet-7")
                .client("geth")
                .clientType(ClientType.EXECUTION)
                .channel("#geth-alerts")
                .build();

        // When
        EvaluationRequest request = EvaluationRequest.of(target);

        // Then
        assertThat(request.getClientType()).isEqualTo(ClientType.EXECUTION);
        assertThat(request.getChannel()).isEqualTo("#geth-alerts");
        assertThat(request.targetKey()).isEqualTo(target.targetKey()).isEqualTo("devnet-7/geth");
    }
}
