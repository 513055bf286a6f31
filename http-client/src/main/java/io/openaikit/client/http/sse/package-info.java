/**
 * Server-sent events decoding.
 *
 * <p>{@link io.openaikit.client.http.sse.SSEDecoder} splits raw bytes into events and
 * {@link io.openaikit.client.http.sse.FrameDecoder} turns those events into JSON
 * {@link io.openaikit.client.http.sse.Frame}s, one per {@code next()} call.
 */
@NullMarked
package io.openaikit.client.http.sse;

import org.jspecify.annotations.NullMarked;
