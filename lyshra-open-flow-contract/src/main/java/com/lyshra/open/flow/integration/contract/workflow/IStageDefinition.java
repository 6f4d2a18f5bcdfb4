package com.lyshra.open.flow.integration.contract.workflow;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageHandoff;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageKind;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One named step of a workflow.
 */
public interface IStageDefinition {

    /** Unique within the owning workflow. */
    String getName();

    /** Textual reference resolved into a callable before the run starts. */
    String getTarget();

    LyshraOpenFlowStageKind getKind();

    /** Names of sibling stages this stage consumes, in argument order. */
    List<String> getDependsOn();

    /** Resource labels forwarded to the executor, for example {@code cpu -> 2.0}. */
    Map<String, Double> getResources();

    /**
     * Input key holding the list a parameterized stage fans out over. When {@code null} the
     * stage iterates over its predecessor's result.
     */
    String getMapOn();

    /** Per-invocation deadline, {@code null} for the configured default. */
    Duration getTimeout();

    LyshraOpenFlowStageHandoff getHandoff();

    /** Whether this stage's result becomes the run result. */
    boolean isCollector();

    String getDescription();
}
