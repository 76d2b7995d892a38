package com.purchasingpower.depgraph.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the inference engine and its real-time variant.
 *
 * <p>Properties are loaded from the {@code depgraph.inference} namespace in
 * application.yml. Example configuration:
 * <pre>
 * depgraph:
 *   inference:
 *     default-timeout: 30s
 *     enable-cache: true
 *     cache-max-entries: 2000
 *     cache-ttl: 5m
 *     enable-parallel: false
 *     max-concurrency: 4
 *     enable-auto-inference: true
 *     enable-custom-rules: true
 *     rule-ids: []
 *     max-concurrent-inferences: 5
 * </pre>
 *
 * @since 2.0.0
 */
@ConfigurationProperties(prefix = "depgraph.inference")
@Validated
@Data
public class InferenceProperties {

    /**
     * Deadline applied when a caller passes no explicit timeout.
     * Default: 30s
     */
    private Duration defaultTimeout = Duration.ofSeconds(30);

    /**
     * Memoize inference results, invalidated by graph writes.
     * Default: true
     */
    private boolean enableCache = true;

    @Min(1)
    private int cacheMaxEntries = 2000;

    private Duration cacheTtl = Duration.ofMinutes(5);

    /**
     * Expand traversal frontiers on the inference worker pool.
     * Default: false
     */
    private boolean enableParallel = false;

    /**
     * Upper bound on concurrent frontier expansions when parallel mode is on.
     * Default: 4
     */
    @Min(1)
    private int maxConcurrency = 4;

    /**
     * Re-apply custom rules when the realtime layer reports a data change.
     * Default: true
     */
    private boolean enableAutoInference = true;

    private boolean enableCustomRules = true;

    /**
     * Allow-list of rule ids for automatic inference. Empty means every enabled rule.
     */
    private List<String> ruleIds = new ArrayList<>();

    @Min(1)
    private int maxConcurrentInferences = 5;
}
