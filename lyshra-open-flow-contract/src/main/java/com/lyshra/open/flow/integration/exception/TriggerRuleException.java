package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

@Getter
public class TriggerRuleException extends LyshraOpenFlowRuntimeException {

    private final String ruleName;

    public TriggerRuleException(String ruleName, String reason) {
        super(LyshraOpenFlowErrorCodes.TRIGGER_RULE_INVALID, ruleName, reason);
        this.ruleName = ruleName;
    }

    public TriggerRuleException(String ruleName, String reason, Throwable cause) {
        super(LyshraOpenFlowErrorCodes.TRIGGER_RULE_INVALID, cause, ruleName, reason);
        this.ruleName = ruleName;
    }
}
