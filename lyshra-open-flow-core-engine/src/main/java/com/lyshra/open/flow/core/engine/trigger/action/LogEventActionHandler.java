package com.lyshra.open.flow.core.engine.trigger.action;

import com.lyshra.open.flow.core.util.CastUtil;
import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerAction;
import com.lyshra.open.flow.integration.exception.TriggerRuleException;
import com.lyshra.open.flow.integration.models.events.Event;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Diagnostic action: logs the matched event or schedule tick.
 */
@Slf4j
public class LogEventActionHandler implements ITriggerActionHandler {

    @Override
    public String getTarget() {
        return LyshraOpenFlowConstants.ACTION_LOG_EVENT;
    }

    @Override
    public void validate(String ruleName, ITriggerAction action) {
        try {
            level(action);
        } catch (IllegalArgumentException e) {
            throw new TriggerRuleException(ruleName, "unknown log level [" + action.getParameters().get(LyshraOpenFlowConstants.ACTION_PARAM_LEVEL) + "]", e);
        }
    }

    @Override
    public Mono<Void> handle(TriggerFiring firing) {
        return Mono.fromRunnable(() -> {
            Object subject = firing.triggeringEvent()
                    .<Object>map(Event::toMap)
                    .orElse(firing.scheduledAt());
            log.atLevel(level(firing.rule().getAction()))
                    .log("Rule [{}] fired: {}", firing.rule().getName(), subject);
        });
    }

    private static Level level(ITriggerAction action) {
        String level = CastUtil.castAsString(action.getParameters().get(LyshraOpenFlowConstants.ACTION_PARAM_LEVEL));
        return level == null ? Level.INFO : Level.valueOf(level.toUpperCase(Locale.ROOT));
    }
}
