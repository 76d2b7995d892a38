package com.purchasingpower.depgraph.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for query execution and the query result cache.
 *
 * <p>Properties are loaded from the {@code depgraph.query} namespace:
 * <pre>
 * depgraph:
 *   query:
 *     default-timeout: 30s
 *     cache-enabled: true
 *     cache-max-size: 1000
 *     cache-ttl: 5m
 *     cache-optimize-target-ratio: 0.75
 *     default-limit: 1000
 * </pre>
 *
 * @since 2.0.0
 */
@ConfigurationProperties(prefix = "depgraph.query")
@Validated
@Data
public class QueryProperties {

    private Duration defaultTimeout = Duration.ofSeconds(30);

    private boolean cacheEnabled = true;

    /**
     * Maximum cached results before least-recently-used eviction.
     * Default: 1000
     */
    @Min(1)
    private int cacheMaxSize = 1000;

    private Duration cacheTtl = Duration.ofMinutes(5);

    /**
     * Fill ratio the "optimize" cache action shrinks the cache down to.
     * Default: 0.75
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double cacheOptimizeTargetRatio = 0.75;

    /**
     * Row limit applied when a query names none.
     * Default: 1000
     */
    @Min(1)
    private int defaultLimit = 1000;
}
