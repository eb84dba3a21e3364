package io.stagemesh.handler;

import io.stagemesh.engine.UnitContext;
import io.stagemesh.engine.UnitResult;
import io.stagemesh.model.WorkUnit;

/**
 * Performs the work for one {@code kind} of unit. Invocations for independent
 * units may run concurrently; implementations should stop promptly once
 * {@code context.token()} is cancelled or the thread is interrupted.
 */
public interface UnitHandler {
    String kind();

    UnitResult execute(WorkUnit unit, UnitContext context) throws Exception;
}
