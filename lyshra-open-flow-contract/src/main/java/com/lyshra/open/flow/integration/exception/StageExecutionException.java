package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

import java.util.Optional;

/**
 * A stage invocation raised. For parameterized stages {@link #getElementIndex()} names the
 * fan-out element that failed.
 */
@Getter
public class StageExecutionException extends LyshraOpenFlowRuntimeException {

    private final String stageName;
    private final Integer elementIndex;

    public StageExecutionException(String stageName, Integer elementIndex, Throwable cause) {
        super(LyshraOpenFlowErrorCodes.STAGE_EXECUTION_FAILED, cause,
                stageName, elementSuffix(elementIndex), describe(cause));
        this.stageName = stageName;
        this.elementIndex = elementIndex;
    }

    protected StageExecutionException(ILyshraOpenFlowErrorInfo errorInfo, String stageName, Integer elementIndex,
                                      Object... templateArgs) {
        super(errorInfo, templateArgs);
        this.stageName = stageName;
        this.elementIndex = elementIndex;
    }

    public Optional<Integer> elementIndex() {
        return Optional.ofNullable(elementIndex);
    }

    protected static String elementSuffix(Integer elementIndex) {
        return elementIndex == null ? "" : "[" + elementIndex + "]";
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
