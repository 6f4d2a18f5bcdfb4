package com.lyshra.open.flow.integration.exception;

import lombok.Getter;

/**
 * Root of every error raised by the orchestration core. The message is the formatted
 * error template prefixed with its error code.
 */
@Getter
public class LyshraOpenFlowRuntimeException extends RuntimeException {

    private final ILyshraOpenFlowErrorInfo errorInfo;

    public LyshraOpenFlowRuntimeException(ILyshraOpenFlowErrorInfo errorInfo, Object... templateArgs) {
        super(format(errorInfo, templateArgs));
        this.errorInfo = errorInfo;
    }

    public LyshraOpenFlowRuntimeException(ILyshraOpenFlowErrorInfo errorInfo, Throwable cause, Object... templateArgs) {
        super(format(errorInfo, templateArgs), cause);
        this.errorInfo = errorInfo;
    }

    public String getErrorCode() {
        return errorInfo.getErrorCode();
    }

    private static String format(ILyshraOpenFlowErrorInfo errorInfo, Object... templateArgs) {
        return "[" + errorInfo.getErrorCode() + "] " + String.format(errorInfo.getErrorTemplate(), templateArgs);
    }
}
