package com.rcmp.marketplace.config;

import io.micrometer.cloudwatch2.CloudWatchConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for MetricsConfig.
 */
@DisplayName("MetricsConfig Tests")
class MetricsConfigTest {

    @Test
    @DisplayName("cloudWatchSettings - Exposes namespace, step and batch size")
    void cloudWatchSettings_ExposesValues() {
        // When
        CloudWatchConfig settings = MetricsConfig.cloudWatchSettings("Marketplace", "PT30S", 20);

        // Then
        assertThat(settings.namespace()).isEqualTo("Marketplace");
        assertThat(settings.step()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.batchSize()).isEqualTo(20);
    }

    @Test
    @DisplayName("marketplaceMetersOnly - Keeps marketplace meters and drops the rest")
    void marketplaceMetersOnly_FiltersByPrefix() {
        // Given
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().meterFilter(MetricsConfig.marketplaceMetersOnly());

        // When
        registry.counter("marketplace.checkout.created").increment();
        registry.counter("jvm.gc.pause").increment();

        // Then
        assertThat(registry.find("marketplace.checkout.created").counter()).isNotNull();
        assertThat(registry.find("jvm.gc.pause").counter()).isNull();
    }

    @Test
    @DisplayName("applicationTagCustomizer - Tags every meter with the application name")
    void applicationTagCustomizer_AddsCommonTag() {
        // Given
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        // When
        new MetricsConfig().applicationTagCustomizer("rcmp123-marketplace").customize(registry);
        Counter counter = registry.counter("marketplace.webhook.listing_sold");

        // Then
        assertThat(counter.getId().getTag("application")).isEqualTo("rcmp123-marketplace");
    }
}
