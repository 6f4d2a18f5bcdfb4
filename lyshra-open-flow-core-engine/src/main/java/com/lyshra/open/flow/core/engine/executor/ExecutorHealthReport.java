package com.lyshra.open.flow.core.engine.executor;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowExecutorHealth;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time health of an executor connection.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class ExecutorHealthReport {

    private final LyshraOpenFlowExecutorHealth status;

    private final String executorKind;

    private final boolean running;

    /** Transient failures seen since the last successful call. */
    private final int consecutiveFailures;

    /** Reconnections completed since the executor was wrapped. */
    private final long reconnectCount;

    private final String lastFailureMessage;

    private final Instant lastFailureAt;

    private final Instant lastReconnectAt;

    @Builder.Default
    private final Map<String, Object> environment = Collections.emptyMap();

    public boolean isHealthy() {
        return status == LyshraOpenFlowExecutorHealth.HEALTHY;
    }

    public Optional<String> getLastFailureMessage() {
        return Optional.ofNullable(lastFailureMessage);
    }
}
