package com.lyshra.open.flow.integration.contract.executor;

import com.lyshra.open.flow.integration.exception.TargetResolutionException;

public interface ITargetResolver {

    IStageTarget resolve(String target) throws TargetResolutionException;
}
