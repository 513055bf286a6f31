package io.openaikit.client.retry;

import java.time.Duration;

import io.openaikit.spec.ClassifiedError;

/**
 * Observes the retry loop of one call. Callbacks run on the thread that completed the failed
 * attempt and must not block.
 */
public interface RetryListener {

    /**
     * Called before waiting for the next attempt.
     *
     * @param nextAttempt the 1-based number of the attempt about to be scheduled
     * @param delay how long the controller will wait
     * @param error the failure of the previous attempt
     */
    void onRetry(int nextAttempt, Duration delay, ClassifiedError error);

    /**
     * Called when an attempt after the first one succeeded.
     *
     * @param attempts the total number of attempts made
     */
    default void onRecovered(int attempts) {
    }
}
