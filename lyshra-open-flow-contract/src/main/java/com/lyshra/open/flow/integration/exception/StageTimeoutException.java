package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

import java.time.Duration;

@Getter
public class StageTimeoutException extends StageExecutionException {

    private final Duration timeout;

    public StageTimeoutException(String stageName, Integer elementIndex, Duration timeout) {
        super(LyshraOpenFlowErrorCodes.STAGE_TIMED_OUT, stageName, elementIndex,
                stageName, elementSuffix(elementIndex), timeout);
        this.timeout = timeout;
    }
}
