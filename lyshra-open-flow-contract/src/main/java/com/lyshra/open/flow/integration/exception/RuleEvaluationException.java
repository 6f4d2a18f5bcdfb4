package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;

/**
 * A condition tree is malformed or cannot be evaluated against an event.
 */
public class RuleEvaluationException extends LyshraOpenFlowRuntimeException {

    public RuleEvaluationException(String reason) {
        super(LyshraOpenFlowErrorCodes.RULE_EVALUATION_FAILED, reason);
    }

    public RuleEvaluationException(String reason, Throwable cause) {
        super(LyshraOpenFlowErrorCodes.RULE_EVALUATION_FAILED, cause, reason);
    }
}
