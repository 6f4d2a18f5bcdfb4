package com.lyshra.open.flow.integration.contract.executor;

import com.lyshra.open.flow.integration.contract.workflow.IRunContext;

import java.util.List;

/**
 * Resolved callable behind a stage's target reference. A returned
 * {@link reactor.core.publisher.Mono} is subscribed to by the executor.
 */
@FunctionalInterface
public interface IStageTarget {

    Object invoke(IRunContext context, List<Object> args) throws Exception;
}
