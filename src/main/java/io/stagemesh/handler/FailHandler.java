package io.stagemesh.handler;

import io.stagemesh.engine.UnitContext;
import io.stagemesh.engine.UnitResult;
import io.stagemesh.error.FailureKind;
import io.stagemesh.model.WorkUnit;

/**
 * Always fails. The unit input may name the failure kind (for example
 * {@code "validation"}); anything else fails as a non-retryable execution error.
 */
public final class FailHandler implements UnitHandler {
    @Override
    public String kind() {
        return "fail";
    }

    @Override
    public UnitResult execute(WorkUnit unit, UnitContext context) {
        FailureKind failureKind = FailureKind.EXECUTION;
        String input = unit.input();
        if (input != null && !input.isBlank()) {
            try {
                failureKind = FailureKind.fromString(input);
            } catch (IllegalArgumentException e) {
                failureKind = FailureKind.EXECUTION;
            }
        }
        return UnitResult.fail(failureKind, "intentional failure from fail handler");
    }
}
