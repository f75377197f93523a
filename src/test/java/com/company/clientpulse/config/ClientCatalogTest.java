package com.company.clientpulse.config;

import com.company.clientpulse.domain.enums.ClientType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClientCatalogTest {

    private final ClientCatalog catalog = new ClientCatalog();

    @Test
    @DisplayName("Should resolve the layer of known clients")
    void shouldResolveClientType() {
        assertThat(catalog.typeOf("lighthouse")).contains(ClientType.CONSENSUS);
        assertThat(catalog.typeOf("nethermind")).contains(ClientType.EXECUTION);
        assertThat(catalog.typeOf("openethereum")).isEmpty();
        assertThat(catalog.isKnown("grandine")).isTrue();
    }

    @Test
    @DisplayName("Should flag pre-production clients")
    void shouldFlagPreProduction() {
        assertThat(catalog.isPreProduction("ethereumjs")).isTrue();
        assertThat(catalog.isPreProduction("geth")).isFalse();
        assertThat(catalog.isPreProduction(null)).isFalse();
    }
}
