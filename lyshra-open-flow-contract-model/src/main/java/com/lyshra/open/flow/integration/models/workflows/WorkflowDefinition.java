package com.lyshra.open.flow.integration.models.workflows;

import com.lyshra.open.flow.integration.contract.workflow.IStageDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Declarative pipeline. Stage order is declaration order; duplicates are kept so that
 * compilation can report them.
 */
@Data
public class WorkflowDefinition implements IWorkflowDefinition, Serializable {

    @NotBlank
    private final String name;
    private final String description;
    private final String configGroup;
    @NotEmpty
    private final List<@Valid IStageDefinition> stages;

    public static InitialStepBuilder builder() { return new Builder(); }

    public interface InitialStepBuilder { OptionsStep name(String name); }
    public interface OptionsStep {
        OptionsStep description(String description);
        OptionsStep configGroup(String configGroup);
        BuildStep stages(Function<StagesBuilder, StagesBuilder> f);
    }
    public interface BuildStep { WorkflowDefinition build(); }

    public static class StagesBuilder {
        private final List<IStageDefinition> list = new ArrayList<>();

        public StagesBuilder stage(Function<StageDefinition.InitialStepBuilder, StageDefinition.BuildStep> fn) {
            list.add(fn.apply(StageDefinition.builder()).build());
            return this;
        }

        public StagesBuilder stage(IStageDefinition stage) {
            list.add(stage);
            return this;
        }

        List<IStageDefinition> build() { return list; }
    }

    private static class Builder implements InitialStepBuilder, OptionsStep, BuildStep {
        private String name;
        private String description;
        private String configGroup;
        private List<IStageDefinition> stages;

        @Override
        public OptionsStep name(String name) { this.name = name; return this; }

        @Override
        public OptionsStep description(String description) { this.description = description; return this; }

        @Override
        public OptionsStep configGroup(String configGroup) { this.configGroup = configGroup; return this; }

        @Override
        public BuildStep stages(Function<StagesBuilder, StagesBuilder> f) {
            this.stages = f.apply(new StagesBuilder()).build();
            return this;
        }

        @Override
        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                    name,
                    description,
                    configGroup,
                    Collections.unmodifiableList(new ArrayList<>(stages))
            );
        }
    }
}
