package com.lyshra.open.flow.integration.models.workflows;

import com.lyshra.open.flow.integration.contract.workflow.IStageDefinition;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageHandoff;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class StageDefinition implements IStageDefinition, Serializable {

    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_-]+", message = "may only contain letters, digits, '_' and '-'")
    private final String name;
    private final String description;
    @NotBlank
    private final String target;
    @NotNull
    private final LyshraOpenFlowStageKind kind; // NORMAL | PARAMETERIZED
    @NotNull
    private final List<@NotBlank String> dependsOn;
    @NotNull
    private final Map<String, Double> resources;
    private final String mapOn;
    private final Duration timeout;
    @NotNull
    private final LyshraOpenFlowStageHandoff handoff; // DIRECT | OBJECT_STORE
    private final boolean collector;

    public static InitialStepBuilder builder() { return new Builder(); }

    public interface InitialStepBuilder { TargetStep name(String name); }
    public interface TargetStep { OptionsStep target(String target); }
    public interface OptionsStep extends BuildStep {
        OptionsStep description(String description);
        OptionsStep parameterized();
        OptionsStep kind(LyshraOpenFlowStageKind kind);
        OptionsStep dependsOn(String... stageNames);
        OptionsStep dependsOn(List<String> stageNames);
        OptionsStep resource(String label, double amount);
        OptionsStep mapOn(String inputKey);
        OptionsStep timeout(Duration timeout);
        OptionsStep handoff(LyshraOpenFlowStageHandoff handoff);
        OptionsStep collector();
        OptionsStep collector(boolean collector);
    }
    public interface BuildStep { StageDefinition build(); }

    private static class Builder implements InitialStepBuilder, TargetStep, OptionsStep {
        private String name;
        private String description;
        private String target;
        private LyshraOpenFlowStageKind kind = LyshraOpenFlowStageKind.NORMAL;
        private final List<String> dependsOn = new ArrayList<>();
        private final Map<String, Double> resources = new LinkedHashMap<>();
        private String mapOn;
        private Duration timeout;
        private LyshraOpenFlowStageHandoff handoff = LyshraOpenFlowStageHandoff.DIRECT;
        private boolean collector;

        @Override
        public TargetStep name(String name) { this.name = name; return this; }

        @Override
        public OptionsStep target(String target) { this.target = target; return this; }

        @Override
        public OptionsStep description(String description) { this.description = description; return this; }

        @Override
        public OptionsStep parameterized() { this.kind = LyshraOpenFlowStageKind.PARAMETERIZED; return this; }

        @Override
        public OptionsStep kind(LyshraOpenFlowStageKind kind) { this.kind = kind; return this; }

        @Override
        public OptionsStep dependsOn(String... stageNames) { return dependsOn(Arrays.asList(stageNames)); }

        @Override
        public OptionsStep dependsOn(List<String> stageNames) { this.dependsOn.addAll(stageNames); return this; }

        @Override
        public OptionsStep resource(String label, double amount) { this.resources.put(label, amount); return this; }

        @Override
        public OptionsStep mapOn(String inputKey) { this.mapOn = inputKey; return this; }

        @Override
        public OptionsStep timeout(Duration timeout) { this.timeout = timeout; return this; }

        @Override
        public OptionsStep handoff(LyshraOpenFlowStageHandoff handoff) { this.handoff = handoff; return this; }

        @Override
        public OptionsStep collector() { this.collector = true; return this; }

        @Override
        public OptionsStep collector(boolean collector) { this.collector = collector; return this; }

        @Override
        public StageDefinition build() {
            return new StageDefinition(
                    name,
                    description,
                    target,
                    kind,
                    Collections.unmodifiableList(new ArrayList<>(dependsOn)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(resources)),
                    mapOn,
                    timeout,
                    handoff,
                    collector
            );
        }
    }
}
