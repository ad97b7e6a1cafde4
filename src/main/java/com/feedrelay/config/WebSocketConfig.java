package com.feedrelay.config;

import com.feedrelay.api.websocket.PushChannelHandler;
import com.feedrelay.push.PushProperties;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the raw WebSocket push channel at {@code /ws/subscribe} and the scheduler that runs
 * the per-connection delivery loops.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final PushChannelHandler pushChannelHandler;
    private final List<String> allowedOrigins;

    public WebSocketConfig(
            PushChannelHandler pushChannelHandler,
            @Value("${feedrelay.cors.allowed-origins}") List<String> allowedOrigins) {
        this.pushChannelHandler = pushChannelHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(pushChannelHandler, "/ws/subscribe")
                .setAllowedOriginPatterns(allowedOrigins.toArray(String[]::new));
    }

    @Bean("pushTaskScheduler")
    public static ThreadPoolTaskScheduler pushTaskScheduler(PushProperties pushProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(pushProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("push-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
