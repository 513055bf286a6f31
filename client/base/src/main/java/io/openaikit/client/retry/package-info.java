/**
 * Jittered exponential backoff around asynchronous operations.
 *
 * <pre>{@code
 * RetryController retries = new RetryController(RetryPolicy.defaults(), new ErrorClassifier());
 * CompletableFuture<String> body = retries.perform(
 *     () -> httpClient.send(envelope).thenCompose(this::readBody),
 *     token,
 *     (next, delay, error) -> log.info("retry {} in {}", next, delay));
 * }</pre>
 */
@NullMarked
package io.openaikit.client.retry;

import org.jspecify.annotations.NullMarked;
