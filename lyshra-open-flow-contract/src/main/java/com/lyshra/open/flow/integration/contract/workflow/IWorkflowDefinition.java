package com.lyshra.open.flow.integration.contract.workflow;

import java.util.List;
import java.util.Optional;

public interface IWorkflowDefinition {

    String getName();

    String getDescription();

    List<IStageDefinition> getStages();

    /** Selector used to look up config documents for runs of this workflow. */
    String getConfigGroup();

    default Optional<IStageDefinition> findStage(String stageName) {
        return getStages().stream()
                .filter(stage -> stage.getName().equals(stageName))
                .findFirst();
    }
}
