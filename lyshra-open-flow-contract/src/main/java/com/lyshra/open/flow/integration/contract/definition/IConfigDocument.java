package com.lyshra.open.flow.integration.contract.definition;

import java.util.Map;

public interface IConfigDocument {

    String getName();

    /**
     * Workflow name or config group this document applies to; {@code null} or blank applies
     * to every workflow.
     */
    String getSelector();

    Map<String, Object> getData();
}
