package io.openaikit.spec;

import io.openaikit.common.OpenAIKitErrorMessages;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when an operation run under a retry policy did not succeed. Carries the last
 * classified error and the number of attempts made, which is {@code 1} when the first
 * failure was not retryable.
 */
public class RetryFailedException extends OpenAIKitException {

    private final int attempts;

    public RetryFailedException(final ClassifiedError lastError, final int attempts, @Nullable final Throwable cause) {
        super(String.format(OpenAIKitErrorMessages.RETRIES_EXHAUSTED, attempts, lastError.describe()), lastError, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
