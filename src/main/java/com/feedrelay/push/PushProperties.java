package com.feedrelay.push;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the /ws/subscribe push channel.
 *
 * <pre>
 * feedrelay.push.poll-interval=5s
 * feedrelay.push.batch-size=50
 * feedrelay.push.scheduler-pool-size=4
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "feedrelay.push")
public class PushProperties {

    private Duration pollInterval = Duration.ofSeconds(5);
    private int batchSize = 50;
    private int schedulerPoolSize = 4;
}
