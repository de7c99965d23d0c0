package com.jay.valuator.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValuatorConfigTest {

    @Test
    void bundledYamlLoads() {
        ValuatorConfig config = new ValuatorConfig();
        config.load();

        assertThat(config.comps().getMinComposite()).isEqualTo(0.3);
        assertThat(config.comps().getSectorGroups()).hasSize(4);
        assertThat(config.dcf().getWaccDeltas()).containsExactly(-0.02, -0.01, 0.0, 0.01, 0.02);
        assertThat(config.lastRound().getStalenessMonths()).isEqualTo(18);
        assertThat(config.blender().getTightRangeMinComps()).isEqualTo(5);
        assertThat(config.marketData().getMaxConcurrentRequests()).isEqualTo(5);
        assertThat(config.pipeline().getAsyncThreads()).isEqualTo(4);
        assertThat(config.pipeline().getCompletedBusRetentionSeconds()).isEqualTo(600);
    }

    @Test
    void unsetPlaceholdersResolveToTheirDefaults() {
        ValuatorConfig config = new ValuatorConfig();
        config.load();

        // no Environment outside Spring, so ${VAR:default} falls back to the default
        assertThat(config.llm().getApiKey()).isEmpty();
        assertThat(config.llm().isConfigured()).isFalse();
        assertThat(config.marketData().getUseMock()).isEqualTo("false");
        assertThat(config.marketData().isMockEnabled()).isFalse();
    }

    @Test
    void defaultsApplyWithoutAFile() {
        ValuatorConfig config = new ValuatorConfig();

        assertThat(config.blender().getCompsFullWeight()).isEqualTo(0.40);
        assertThat(config.dcf().getDefaultMargin()).isEqualTo(0.20);
        assertThat(config.consistency().getMaxSourceLinks()).isEqualTo(5);
        assertThat(config.llm().getModel()).isEqualTo("gpt-4o-mini");
    }
}
