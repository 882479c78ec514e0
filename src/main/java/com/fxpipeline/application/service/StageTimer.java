package com.fxpipeline.application.service;

/**
 * Wall-clock timer for a stage run.
 */
final class StageTimer {

    private final long startNanos;

    private StageTimer(long startNanos) {
        this.startNanos = startNanos;
    }

    static StageTimer start() {
        return new StageTimer(System.nanoTime());
    }

    double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
