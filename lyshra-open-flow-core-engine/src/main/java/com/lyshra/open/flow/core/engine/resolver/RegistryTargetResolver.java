package com.lyshra.open.flow.core.engine.resolver;

import com.lyshra.open.flow.integration.contract.executor.IStageTarget;
import com.lyshra.open.flow.integration.contract.executor.ITargetResolver;
import com.lyshra.open.flow.integration.exception.TargetResolutionException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves stage targets from an explicit table of registered callables. Targets are plain
 * strings such as {@code models.train}; the table is filled by whoever loads stage code.
 */
@Slf4j
public class RegistryTargetResolver implements ITargetResolver {

    private final Map<String, IStageTarget> targets = new ConcurrentHashMap<>();

    public RegistryTargetResolver register(String target, IStageTarget stageTarget) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
        IStageTarget existing = targets.putIfAbsent(target, stageTarget);
        if (existing != null) {
            throw new IllegalStateException("Target [" + target + "] is already registered");
        }
        log.debug("Registered stage target [{}]", target);
        return this;
    }

    public boolean unregister(String target) {
        return targets.remove(target) != null;
    }

    public Set<String> registeredTargets() {
        return new TreeSet<>(targets.keySet());
    }

    @Override
    public IStageTarget resolve(String target) throws TargetResolutionException {
        if (target == null || target.isBlank()) {
            throw new TargetResolutionException(String.valueOf(target), "target is blank");
        }
        IStageTarget stageTarget = targets.get(target);
        if (stageTarget == null) {
            throw new TargetResolutionException(target, "no callable registered under this name");
        }
        return stageTarget;
    }
}
