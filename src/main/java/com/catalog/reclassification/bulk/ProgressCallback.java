package com.catalog.reclassification.bulk;

/**
 * Callback for UI feedback while a batch is processed.
 * It is invoked synchronously and carries no cancellation or backpressure contract.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param fraction completed share of the work, from 0.0 to 1.0
     * @param message  short description of the current step
     */
    void onProgress(double fraction, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (fraction, message) -> {};
}
