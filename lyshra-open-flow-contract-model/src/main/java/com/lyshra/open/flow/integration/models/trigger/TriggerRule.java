package com.lyshra.open.flow.integration.models.trigger;

import com.lyshra.open.flow.integration.contract.trigger.ConditionNode;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerAction;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowTriggerRuleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

@Data
@Builder(toBuilder = true)
public class TriggerRule implements ITriggerRule {

    @NotBlank
    private final String name;
    private final String description;
    @NotNull
    private final LyshraOpenFlowTriggerRuleType type;
    private final ConditionNode condition;
    @Singular
    private final List<@NotBlank String> schedules;
    @NotNull
    @Valid
    private final ITriggerAction action;

    public static TriggerRule onCondition(String name, ConditionNode condition, ITriggerAction action) {
        return TriggerRule.builder()
                .name(name)
                .type(LyshraOpenFlowTriggerRuleType.CONDITION)
                .condition(condition)
                .action(action)
                .build();
    }

    public static TriggerRule onSchedule(String name, List<String> schedules, ITriggerAction action) {
        return TriggerRule.builder()
                .name(name)
                .type(LyshraOpenFlowTriggerRuleType.SCHEDULE)
                .schedules(schedules)
                .action(action)
                .build();
    }
}
