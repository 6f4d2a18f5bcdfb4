package com.lyshra.open.flow.core.engine.trigger;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowTriggerRuleType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;

@Getter
@Builder
@ToString
public final class TriggerRuleStatus {

    private final String name;
    private final LyshraOpenFlowTriggerRuleType type;
    private final boolean enabled;
    private final long fireCount;
    private final Instant lastFiredAt;

    /** Why the rule was disabled, absent while it is enabled. */
    private final String disabledReason;

    public Optional<Instant> getLastFiredAt() {
        return Optional.ofNullable(lastFiredAt);
    }

    public Optional<String> getDisabledReason() {
        return Optional.ofNullable(disabledReason);
    }
}
