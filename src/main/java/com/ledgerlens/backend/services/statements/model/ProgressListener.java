package com.ledgerlens.backend.services.statements.model;

/**
 * Receives coarse progress updates from a pipeline run. Fractions are cumulative in [0, 1].
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = (fraction, message) -> { };

    void onProgress(double fraction, String message);

    /** Returns a listener whose [0, 1] range lands on [from, to] of this one. */
    default ProgressListener scaled(double from, double to) {
        ProgressListener target = this;
        return (fraction, message) -> target.onProgress(from + (to - from) * fraction, message);
    }

    static ProgressListener orNoop(ProgressListener listener) {
        return listener == null ? NOOP : listener;
    }
}
