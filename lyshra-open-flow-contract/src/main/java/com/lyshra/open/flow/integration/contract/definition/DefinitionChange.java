package com.lyshra.open.flow.integration.contract.definition;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowChangeType;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowResourceKind;

/**
 * Notification that a stored definition was applied or deleted. {@code resource} carries the
 * new definition for {@code APPLIED} and is {@code null} for {@code DELETED}.
 */
public record DefinitionChange(LyshraOpenFlowResourceKind kind, LyshraOpenFlowChangeType changeType,
                               String name, Object resource) {
}
