package io.openaikit.client.retry;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import io.openaikit.client.error.ErrorClassifier;
import io.openaikit.common.CancellationToken;
import io.openaikit.spec.ClassifiedError;
import io.openaikit.spec.ErrorKind;
import io.openaikit.spec.OpenAIKitException;
import io.openaikit.spec.RetryFailedException;
import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an asynchronous operation under a {@link RetryPolicy}.
 * <p>
 * Attempts are strictly sequential: the next one starts only after the previous one failed
 * and its backoff delay elapsed. Failures are classified with the {@link ErrorClassifier};
 * non-retryable errors end the loop immediately. The result future fails with a
 * {@link RetryFailedException} carrying the last error and the attempt count, or with a plain
 * {@link OpenAIKitException} of kind {@link ErrorKind#CANCELLED} when the token is cancelled.
 * <p>
 * Backoff waits are scheduled rather than slept, so no thread is held during a wait, and a
 * cancellation completes the result immediately.
 */
public class RetryController {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryController.class);

    private static final ScheduledExecutorService DEFAULT_SCHEDULER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "openaikit-retry");
        thread.setDaemon(true);
        return thread;
    });

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final Random random;
    private final ScheduledExecutorService scheduler;

    public RetryController(RetryPolicy policy, ErrorClassifier classifier) {
        this(policy, classifier, new Random(), DEFAULT_SCHEDULER);
    }

    public RetryController(RetryPolicy policy, ErrorClassifier classifier, Random random, ScheduledExecutorService scheduler) {
        this.policy = Assert.checkNotNullParam("policy", policy);
        this.classifier = Assert.checkNotNullParam("classifier", classifier);
        this.random = Assert.checkNotNullParam("random", random);
        this.scheduler = Assert.checkNotNullParam("scheduler", scheduler);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public <T> CompletableFuture<T> perform(Supplier<CompletableFuture<T>> operation, CancellationToken token,
                                            @Nullable RetryListener listener) {
        Assert.checkNotNullParam("operation", operation);
        Assert.checkNotNullParam("token", token);
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, token, listener, 1, result);
        return result;
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> operation, CancellationToken token,
                             @Nullable RetryListener listener, int attempt, CompletableFuture<T> result) {
        if (token.isCancelled()) {
            result.completeExceptionally(new OpenAIKitException(classifier.cancelled()));
            return;
        }

        CompletableFuture<T> future;
        try {
            future = operation.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, failure) -> {
            if (failure == null) {
                if (attempt > 1) {
                    LOGGER.info("Request succeeded after {} attempts", attempt);
                    notifyRecovered(listener, attempt);
                }
                result.complete(value);
                return;
            }

            ClassifiedError error = classifier.classify(failure);
            Throwable cause = unwrap(failure);
            if (error.kind() == ErrorKind.CANCELLED || token.isCancelled()) {
                result.completeExceptionally(new OpenAIKitException(classifier.cancelled(), cause));
                return;
            }
            if (!error.retryable() || attempt >= policy.maxAttempts()) {
                LOGGER.debug("Giving up after attempt {}/{}: {}", attempt, policy.maxAttempts(), error.describe());
                result.completeExceptionally(new RetryFailedException(error, attempt, cause));
                return;
            }

            Duration delay = delayFor(attempt, error);
            LOGGER.warn("Attempt {}/{} failed with {}, retrying in {} ms",
                    attempt, policy.maxAttempts(), error.kind(), delay.toMillis());
            notifyRetry(listener, attempt + 1, delay, error);
            scheduleNext(operation, token, listener, attempt + 1, result, delay);
        });
    }

    private <T> void scheduleNext(Supplier<CompletableFuture<T>> operation, CancellationToken token,
                                  @Nullable RetryListener listener, int nextAttempt, CompletableFuture<T> result,
                                  Duration delay) {
        AtomicBoolean settled = new AtomicBoolean();
        AtomicReference<CancellationToken.Registration> registration = new AtomicReference<>();

        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            if (settled.compareAndSet(false, true)) {
                CancellationToken.Registration r = registration.get();
                if (r != null) {
                    r.close();
                }
                attempt(operation, token, listener, nextAttempt, result);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);

        registration.set(token.onCancel(() -> {
            if (settled.compareAndSet(false, true)) {
                timer.cancel(false);
                LOGGER.debug("Backoff wait cancelled before attempt {}", nextAttempt);
                result.completeExceptionally(new OpenAIKitException(classifier.cancelled()));
            }
        }));
        if (settled.get()) {
            registration.get().close();
        }
    }

    Duration delayFor(int attempt, ClassifiedError error) {
        Duration delay = policy.delayFor(attempt, policy.nextJitter(random));
        Duration retryAfter = error.retryAfter();
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter.compareTo(policy.maxDelay()) > 0 ? policy.maxDelay() : retryAfter;
        }
        return delay;
    }

    private static void notifyRetry(@Nullable RetryListener listener, int nextAttempt, Duration delay, ClassifiedError error) {
        if (listener == null) {
            return;
        }
        try {
            listener.onRetry(nextAttempt, delay, error);
        } catch (RuntimeException e) {
            LOGGER.warn("Retry listener failed", e);
        }
    }

    private static void notifyRecovered(@Nullable RetryListener listener, int attempts) {
        if (listener == null) {
            return;
        }
        try {
            listener.onRecovered(attempts);
        } catch (RuntimeException e) {
            LOGGER.warn("Retry listener failed", e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
