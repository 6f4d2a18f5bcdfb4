package com.lyshra.open.flow.integration.exception;

public interface ILyshraOpenFlowErrorInfo {
    String getErrorCode();
    String getErrorTemplate();
}
