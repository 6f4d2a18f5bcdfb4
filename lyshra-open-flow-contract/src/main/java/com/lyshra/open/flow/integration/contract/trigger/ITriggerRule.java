package com.lyshra.open.flow.integration.contract.trigger;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowTriggerRuleType;

import java.util.List;

public interface ITriggerRule {

    String getName();

    String getDescription();

    LyshraOpenFlowTriggerRuleType getType();

    /** Body of a condition rule; {@code null} for schedule rules. */
    ConditionNode getCondition();

    /** Cron expressions of a schedule rule; empty for condition rules. */
    List<String> getSchedules();

    ITriggerAction getAction();
}
