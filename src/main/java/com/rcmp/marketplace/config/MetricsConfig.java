package com.rcmp.marketplace.config;

import io.micrometer.cloudwatch2.CloudWatchConfig;
import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.HashMap;
import java.util.Map;

/**
 * Meter registry setup for the marketplace counters and timers recorded by
 * {@link com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService}.
 *
 * <p>Every registry gets an {@code application} tag. When
 * {@code cloud.aws.cloudwatch.enabled=true} the meters are also shipped to
 * CloudWatch; otherwise the actuator's default registry is used and the
 * meters stay visible under {@code /actuator/metrics}.
 *
 * @author Marketplace Team
 */
@Configuration
public class MetricsConfig {

    static final String MARKETPLACE_METER_PREFIX = "marketplace.";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
            @Value("${spring.application.name:rcmp123-marketplace}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }

    /**
     * Drops every meter outside the {@code marketplace.} namespace.
     */
    static MeterFilter marketplaceMetersOnly() {
        return MeterFilter.denyUnless(id -> id.getName().startsWith(MARKETPLACE_METER_PREFIX));
    }

    static CloudWatchConfig cloudWatchSettings(String namespace, String step, int batchSize) {
        Map<String, String> settings = new HashMap<>();
        settings.put("cloudwatch.namespace", namespace);
        settings.put("cloudwatch.step", step);
        settings.put("cloudwatch.batchSize", String.valueOf(batchSize));
        return settings::get;
    }

    @Configuration
    @ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
    static class CloudWatchExport {

        @Value("${cloud.aws.region:us-east-1}")
        private String awsRegion;

        // Dashboards and alarms look meters up under this namespace
        @Value("${cloud.aws.cloudwatch.namespace:Marketplace}")
        private String namespace;

        // CloudWatch accepts at most 20 datums per PutMetricData call
        @Value("${cloud.aws.cloudwatch.batch-size:20}")
        private Integer batchSize;

        @Value("${cloud.aws.cloudwatch.step:PT1M}")
        private String step;

        @Bean
        public CloudWatchAsyncClient cloudWatchAsyncClient() {
            return CloudWatchAsyncClient.builder()
                    .region(Region.of(awsRegion))
                    .credentialsProvider(DefaultCredentialsProvider.create())
                    .build();
        }

        @Bean
        public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
            CloudWatchMeterRegistry registry = new CloudWatchMeterRegistry(
                    cloudWatchSettings(namespace, step, batchSize), Clock.SYSTEM, cloudWatchAsyncClient);
            registry.config().meterFilter(marketplaceMetersOnly());
            return registry;
        }
    }
}
