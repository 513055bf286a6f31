package io.openaikit.client.stream;

import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import io.openaikit.client.error.ErrorClassifier;
import io.openaikit.client.http.sse.Frame;
import io.openaikit.client.http.sse.FrameDecoder;
import io.openaikit.common.OpenAIKitErrorMessages;
import io.openaikit.spec.AccumulatedResult;
import io.openaikit.spec.ClassifiedError;
import io.openaikit.spec.ErrorKind;
import io.openaikit.spec.OpenAIKitException;
import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy sequence of progressively more complete {@link AccumulatedResult}s for one streamed
 * response.
 * <p>
 * Frames are read only when the consumer asks for the next result. A result is produced only
 * when a frame changed visible state, and the terminal state is always produced, even when the
 * stream ends without a completion event.
 * <p>
 * Failures surface from {@link #hasNext()} or {@link #next()} as {@link OpenAIKitException}s.
 * Completion, failure, cancellation and {@link #close()} all go through the same idempotent
 * release step, so the connection is always returned, and it is returned before any error
 * reaches the consumer.
 *
 * <pre>{@code
 * try (ResultStream results = client.stream(envelope, ResponsesDeltaMapping.FACTORY, token).join()) {
 *     results.forEachRemaining(result -> render(result.text()));
 * }
 * }</pre>
 */
public class ResultStream implements Iterator<AccumulatedResult>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultStream.class);

    private final FrameDecoder frames;
    private final EventReconstructor reconstructor;
    private final ErrorClassifier classifier;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean();

    private @Nullable AccumulatedResult pending;
    private @Nullable AccumulatedResult lastEmitted;
    private boolean finished;

    public ResultStream(FrameDecoder frames, EventReconstructor reconstructor, ErrorClassifier classifier, Runnable onRelease) {
        this.frames = Assert.checkNotNullParam("frames", frames);
        this.reconstructor = Assert.checkNotNullParam("reconstructor", reconstructor);
        this.classifier = Assert.checkNotNullParam("classifier", classifier);
        this.onRelease = Assert.checkNotNullParam("onRelease", onRelease);
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        pending = advance();
        return pending != null;
    }

    @Override
    public AccumulatedResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        AccumulatedResult result = pending;
        pending = null;
        lastEmitted = result;
        return result;
    }

    /**
     * @return a sequential stream over the remaining results; closing it closes this stream
     */
    public Stream<AccumulatedResult> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    /**
     * Stops reading and releases the connection. Idempotent.
     */
    @Override
    public void close() {
        finished = true;
        pending = null;
        release();
    }

    public boolean isReleased() {
        return released.get();
    }

    private @Nullable AccumulatedResult advance() {
        try {
            while (true) {
                Frame frame = frames.next();
                if (frame == null) {
                    return end();
                }
                if (frame.isMalformed()) {
                    ClassifiedError error = classifier.decodingFailed(frame.decodeError());
                    onDecodeFailure(String.format(OpenAIKitErrorMessages.MALFORMED_FRAME, frame.kind()), error);
                    continue;
                }
                boolean changed;
                try {
                    changed = reconstructor.apply(frame);
                } catch (ProtocolViolationException e) {
                    onDecodeFailure(e.getMessage(), classifier.protocolViolation(e.getMessage()));
                    continue;
                }
                if (changed) {
                    return reconstructor.snapshot();
                }
            }
        } catch (OpenAIKitException e) {
            throw fail(e);
        } catch (IOException | RuntimeException e) {
            throw fail(new OpenAIKitException(classifier.classify(e), e));
        }
    }

    private @Nullable AccumulatedResult end() {
        finished = true;
        AccumulatedResult last = lastEmitted;
        AccumulatedResult result = reconstructor.finish();
        release();
        if (last != null && last.complete() && last.violations().size() == result.violations().size()) {
            return null;
        }
        return result;
    }

    private void onDecodeFailure(String message, ClassifiedError error) {
        if (reconstructor.getPolicy() == DecodeFailurePolicy.FAIL) {
            throw new OpenAIKitException(error);
        }
        LOGGER.warn("Skipping frame: {}", message);
        reconstructor.recordViolation(message);
    }

    private OpenAIKitException fail(OpenAIKitException e) {
        finished = true;
        pending = null;
        release();
        if (e.getKind() == ErrorKind.CANCELLED) {
            LOGGER.debug("Stream cancelled");
        } else {
            LOGGER.debug("Stream failed: {}", e.getError().describe());
        }
        return e;
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            try {
                frames.close();
            } finally {
                onRelease.run();
            }
            LOGGER.debug("Stream released");
        }
    }
}
