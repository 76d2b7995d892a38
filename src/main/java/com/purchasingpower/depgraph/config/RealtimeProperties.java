package com.purchasingpower.depgraph.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for realtime query subscriptions.
 *
 * <p>Properties are loaded from the {@code depgraph.realtime} namespace:
 * <pre>
 * depgraph:
 *   realtime:
 *     polling-enabled: true
 *     polling-interval: 1s
 *     query-timeout: 30s
 *     max-connections: 100
 *     max-concurrency: 4
 *     sse-timeout: 30m
 * </pre>
 *
 * <p>{@code query-timeout} is measured from a query's last execution; a query
 * not re-executed within it is deactivated on the next polling tick.
 *
 * @since 2.0.0
 */
@ConfigurationProperties(prefix = "depgraph.realtime")
@Validated
@Data
public class RealtimeProperties {

    private boolean pollingEnabled = true;

    private Duration pollingInterval = Duration.ofSeconds(1);

    private Duration queryTimeout = Duration.ofSeconds(30);

    @Min(1)
    private int maxConnections = 100;

    /**
     * Worker threads used to re-execute queries during one polling tick.
     * Default: 4
     */
    @Min(1)
    private int maxConcurrency = 4;

    private Duration sseTimeout = Duration.ofMinutes(30);
}
