package com.feedrelay.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.context.annotation.Configuration;

/**
 * Registry-wide meter settings: the {@code application} tag on every meter and percentiles for
 * the webhook delivery timer. The meters are defined in
 * {@link com.feedrelay.observability.DeliveryMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private static final String DELIVERY_TIMER_PREFIX = "webhook.delivery";

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureRegistry() {
        meterRegistry
                .config()
                .commonTags("application", "feedrelay")
                .meterFilter(MeterFilter.maxExpected(DELIVERY_TIMER_PREFIX, Duration.ofSeconds(30)))
                .meterFilter(new MeterFilter() {
                    @Override
                    public DistributionStatisticConfig configure(
                            Meter.Id id, DistributionStatisticConfig config) {
                        if (id.getName().startsWith(DELIVERY_TIMER_PREFIX)) {
                            return DistributionStatisticConfig.builder()
                                    .percentiles(0.5, 0.95, 0.99)
                                    .build()
                                    .merge(config);
                        }
                        return config;
                    }
                });
    }
}
