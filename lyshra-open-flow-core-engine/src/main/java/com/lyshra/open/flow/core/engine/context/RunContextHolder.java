package com.lyshra.open.flow.core.engine.context;

import com.lyshra.open.flow.integration.contract.workflow.IRunContext;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

/**
 * Reactive access to the run context of the stage invocation in progress. The context is
 * carried in the Reactor subscriber context, so it follows the invocation across threads and
 * is never shared between concurrent invocations.
 */
public final class RunContextHolder {

    private static final Class<RunContextHolder> KEY = RunContextHolder.class;

    private RunContextHolder() {}

    /** Empty outside a stage invocation. */
    public static Mono<IRunContext> current() {
        return Mono.deferContextual(view -> Mono.justOrEmpty(view.<IRunContext>getOrEmpty(KEY)));
    }

    public static Context withRunContext(IRunContext runContext) {
        return Context.of(KEY, runContext);
    }
}
