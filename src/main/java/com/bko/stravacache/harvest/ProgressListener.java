package com.bko.stravacache.harvest;

/**
 * Receives batch progress serially, in completion order. Called from worker threads.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = progress -> { };

    void onProgress(BatchProgress progress);
}
