package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

@Getter
public class TargetResolutionException extends LyshraOpenFlowRuntimeException {

    private final String target;

    public TargetResolutionException(String target, String reason) {
        super(LyshraOpenFlowErrorCodes.TARGET_RESOLUTION_FAILED, target, reason);
        this.target = target;
    }

    public TargetResolutionException(String target, String reason, Throwable cause) {
        super(LyshraOpenFlowErrorCodes.TARGET_RESOLUTION_FAILED, cause, target, reason);
        this.target = target;
    }
}
