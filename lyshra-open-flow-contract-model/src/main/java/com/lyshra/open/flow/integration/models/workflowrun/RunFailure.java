package com.lyshra.open.flow.integration.models.workflowrun;

import com.lyshra.open.flow.integration.exception.LyshraOpenFlowRuntimeException;
import com.lyshra.open.flow.integration.exception.StageExecutionException;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result value of a failed run: a serializable description of the failure cause.
 */
@Data
@Builder(toBuilder = true)
public class RunFailure implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String errorCode;
    private final String errorType;
    private final String message;
    private final String stageName;
    private final Integer elementIndex;

    public static RunFailure of(Throwable cause) {
        RunFailureBuilder builder = RunFailure.builder()
                .errorType(cause.getClass().getName())
                .message(cause.getMessage());
        if (cause instanceof LyshraOpenFlowRuntimeException flowException) {
            builder.errorCode(flowException.getErrorCode());
        }
        if (cause instanceof StageExecutionException stageException) {
            builder.stageName(stageException.getStageName())
                    .elementIndex(stageException.getElementIndex());
        }
        return builder.build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("error_code", errorCode);
        map.put("error_type", errorType);
        map.put("message", message);
        map.put("stage", stageName);
        map.put("element_index", elementIndex);
        return map;
    }
}
