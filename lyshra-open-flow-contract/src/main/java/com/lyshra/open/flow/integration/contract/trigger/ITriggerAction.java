package com.lyshra.open.flow.integration.contract.trigger;

import java.util.Map;

public interface ITriggerAction {

    /** Action kind, for example {@code run_workflow}. */
    String getTarget();

    Map<String, Object> getParameters();
}
