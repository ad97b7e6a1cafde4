package com.feedrelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sizing of the executor that runs record fan-out listeners.
 *
 * <pre>
 * feedrelay.async.core-pool-size=2
 * feedrelay.async.max-pool-size=8
 * feedrelay.async.queue-capacity=1000
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "feedrelay.async")
public class AsyncProperties {

    private int corePoolSize = 2;
    private int maxPoolSize = 8;
    private int queueCapacity = 1000;
}
