package com.lyshra.open.flow.core.engine.config;

import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowMissedTickPolicy;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowMissingPathPolicy;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Deployment-level settings of the orchestration core.
 *
 * <p>Every property can be overridden from a system property {@code lyshra.flow.<name>} or
 * an environment variable {@code LYSHRA_FLOW_<NAME>}, system properties winning. Durations
 * use the ISO-8601 form ({@code PT30S}).</p>
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class LyshraOpenFlowConfig {

    // Runs
    @Builder.Default
    private final String defaultNamespace = LyshraOpenFlowConstants.DEFAULT_NAMESPACE;

    /** {@code null} means runs have no deadline. */
    private final Duration runTimeout;

    /** {@code null} means stages without an explicit timeout have no deadline. */
    private final Duration defaultStageTimeout;

    @Builder.Default
    private final Duration runRetention = Duration.ofHours(24);

    /** How often finished runs older than {@link #runRetention} are purged. */
    @Builder.Default
    private final Duration runPurgeInterval = Duration.ofMinutes(1);

    // Object store
    @Builder.Default
    private final LyshraOpenFlowStoreStrategy defaultStoreStrategy = LyshraOpenFlowStoreStrategy.FALLBACK;

    @Builder.Default
    private final Path artifactBasePath = Path.of(System.getProperty("java.io.tmpdir"), "lyshra-open-flow", "artifacts");

    // Executor
    @Builder.Default
    private final int executorParallelism = Math.max(2, Runtime.getRuntime().availableProcessors());

    @Builder.Default
    private final int executorReconnectAttempts = 3;

    @Builder.Default
    private final Duration executorReconnectBackoff = Duration.ofMillis(200);

    @Builder.Default
    private final Duration executorReconnectTimeout = Duration.ofSeconds(30);

    // Triggers
    @Builder.Default
    private final LyshraOpenFlowMissingPathPolicy missingPathPolicy = LyshraOpenFlowMissingPathPolicy.FALSY;

    @Builder.Default
    private final LyshraOpenFlowMissedTickPolicy missedTickPolicy = LyshraOpenFlowMissedTickPolicy.SKIP;

    @Builder.Default
    private final int maxCatchUpTicks = 60;

    public static LyshraOpenFlowConfig defaultConfig() {
        return LyshraOpenFlowConfig.builder().build();
    }

    /**
     * Defaults overridden by {@code lyshra.flow.*} system properties and
     * {@code LYSHRA_FLOW_*} environment variables.
     */
    public static LyshraOpenFlowConfig fromEnvironment() {
        return fromLookup(name -> {
            String property = System.getProperty("lyshra.flow." + name);
            if (property != null) {
                return property;
            }
            return System.getenv("LYSHRA_FLOW_" + name.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT));
        });
    }

    /**
     * Builds a config from a property lookup keyed by dotted property name
     * ({@code default-namespace}, {@code run-timeout}, ...). Absent keys keep their default.
     */
    public static LyshraOpenFlowConfig fromLookup(Function<String, String> lookup) {
        LyshraOpenFlowConfig defaults = defaultConfig();
        LyshraOpenFlowConfigBuilder builder = defaults.toBuilder();

        value(lookup, "default-namespace").ifPresent(builder::defaultNamespace);
        value(lookup, "run-timeout").map(Duration::parse).ifPresent(builder::runTimeout);
        value(lookup, "default-stage-timeout").map(Duration::parse).ifPresent(builder::defaultStageTimeout);
        value(lookup, "run-retention").map(Duration::parse).ifPresent(builder::runRetention);
        value(lookup, "run-purge-interval").map(Duration::parse).ifPresent(builder::runPurgeInterval);
        value(lookup, "default-store-strategy").map(LyshraOpenFlowStoreStrategy::fromWireName)
                .ifPresent(builder::defaultStoreStrategy);
        value(lookup, "artifact-base-path").map(Path::of).ifPresent(builder::artifactBasePath);
        value(lookup, "executor-parallelism").map(Integer::parseInt).ifPresent(builder::executorParallelism);
        value(lookup, "executor-reconnect-attempts").map(Integer::parseInt)
                .ifPresent(builder::executorReconnectAttempts);
        value(lookup, "executor-reconnect-backoff").map(Duration::parse).ifPresent(builder::executorReconnectBackoff);
        value(lookup, "executor-reconnect-timeout").map(Duration::parse).ifPresent(builder::executorReconnectTimeout);
        value(lookup, "missing-path-policy").map(v -> LyshraOpenFlowMissingPathPolicy.valueOf(v.toUpperCase(Locale.ROOT)))
                .ifPresent(builder::missingPathPolicy);
        value(lookup, "missed-tick-policy").map(v -> LyshraOpenFlowMissedTickPolicy.valueOf(v.toUpperCase(Locale.ROOT)))
                .ifPresent(builder::missedTickPolicy);
        value(lookup, "max-catch-up-ticks").map(Integer::parseInt).ifPresent(builder::maxCatchUpTicks);

        LyshraOpenFlowConfig config = builder.build();
        config.validate();
        return config;
    }

    /**
     * @throws IllegalStateException if a setting is out of range
     */
    public void validate() {
        if (defaultNamespace == null || defaultNamespace.isBlank()) {
            throw new IllegalStateException("defaultNamespace must not be blank");
        }
        if (executorParallelism <= 0) {
            throw new IllegalStateException("executorParallelism must be positive");
        }
        if (executorReconnectAttempts < 0) {
            throw new IllegalStateException("executorReconnectAttempts must not be negative");
        }
        if (maxCatchUpTicks <= 0) {
            throw new IllegalStateException("maxCatchUpTicks must be positive");
        }
        requirePositive("runTimeout", runTimeout);
        requirePositive("defaultStageTimeout", defaultStageTimeout);
        requirePositive("executorReconnectTimeout", executorReconnectTimeout);
        if (runPurgeInterval == null) {
            throw new IllegalStateException("runPurgeInterval must be set");
        }
        requirePositive("runPurgeInterval", runPurgeInterval);
        if (runRetention == null || runRetention.isNegative()) {
            throw new IllegalStateException("runRetention must not be negative");
        }
    }

    private static void requirePositive(String name, Duration duration) {
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            throw new IllegalStateException(name + " must be positive");
        }
    }

    private static Optional<String> value(Function<String, String> lookup, String name) {
        return Optional.ofNullable(lookup.apply(name))
                .map(String::trim)
                .filter(v -> !v.isEmpty());
    }
}
