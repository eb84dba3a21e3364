package io.stagemesh.engine;

import io.stagemesh.model.ProgressEvent;

@FunctionalInterface
public interface ProgressListener {
    void onEvent(ProgressEvent event);
}
