/**
 * Reconstruction of streamed responses.
 *
 * <p>Frames are mapped to {@link io.openaikit.client.stream.Delta}s by an endpoint-family
 * {@link io.openaikit.client.stream.DeltaMapping} and folded by the
 * {@link io.openaikit.client.stream.EventReconstructor} into immutable
 * {@link io.openaikit.spec.AccumulatedResult} snapshots, which a
 * {@link io.openaikit.client.stream.ResultStream} hands out lazily.
 */
@NullMarked
package io.openaikit.client.stream;

import org.jspecify.annotations.NullMarked;
