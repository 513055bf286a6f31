package io.openaikit.client.http.sse;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.openaikit.common.CancellationToken;
import io.openaikit.common.OpenAIKitErrorMessages;
import io.openaikit.spec.ClassifiedError;
import io.openaikit.spec.ErrorKind;
import io.openaikit.spec.OpenAIKitException;
import io.openaikit.util.Assert;
import io.openaikit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls {@link Frame}s off a server-sent events body.
 * <p>
 * Each call to {@link #next()} reads from the underlying stream only as far as needed to
 * produce one frame. The literal {@code [DONE]} payload ends the sequence without producing a
 * frame. A payload that is not valid JSON still yields a frame, carrying the parse failure,
 * and decoding continues with the following event.
 * <p>
 * The cancellation token is checked before every read. Cancelling it also closes the stream,
 * so a read blocked on the network returns promptly.
 */
public class FrameDecoder implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FrameDecoder.class);

    public static final String DONE_SENTINEL = "[DONE]";

    private static final int READ_BUFFER_SIZE = 8192;

    private final InputStream in;
    private final CancellationToken token;
    private volatile CancellationToken.@Nullable Registration cancelRegistration;
    private final Deque<DataEvent> pending = new ArrayDeque<>();
    private final SSEDecoder sseDecoder;
    private final byte[] buffer = new byte[READ_BUFFER_SIZE];

    private boolean endOfStream;
    private boolean finished;
    private volatile boolean closed;

    public FrameDecoder(InputStream in, CancellationToken token) {
        this.in = Assert.checkNotNullParam("in", in);
        this.token = Assert.checkNotNullParam("token", token);
        this.sseDecoder = new SSEDecoder(this::onEvent);
        this.cancelRegistration = token.onCancel(this::close);
    }

    private void onEvent(Event event) {
        if (event.isData()) {
            pending.add((DataEvent) event);
        } else {
            LOGGER.trace("Skipping comment {}", event);
        }
    }

    /**
     * @return the next frame, or {@code null} once the stream ended or {@code [DONE]} was received
     * @throws OpenAIKitException with kind {@code CANCELLED} if the token was cancelled
     * @throws IOException if reading the stream failed
     */
    public @Nullable Frame next() throws IOException {
        while (true) {
            if (finished) {
                return null;
            }
            checkCancelled();
            if (closed) {
                return null;
            }
            DataEvent event = pending.poll();
            if (event != null) {
                if (DONE_SENTINEL.equals(event.getData().trim())) {
                    LOGGER.debug("Received {} sentinel", DONE_SENTINEL);
                    finished = true;
                    pending.clear();
                    return null;
                }
                return toFrame(event);
            }
            if (endOfStream) {
                finished = true;
                return null;
            }
            readChunk();
        }
    }

    /**
     * @return {@code true} once {@code [DONE]} or the end of the stream was reached
     */
    public boolean isFinished() {
        return finished;
    }

    private void readChunk() throws IOException {
        checkCancelled();
        int read;
        try {
            read = in.read(buffer);
        } catch (IOException e) {
            checkCancelled();
            throw e;
        }
        if (read < 0) {
            endOfStream = true;
            sseDecoder.finish();
        } else if (read > 0) {
            sseDecoder.feed(buffer, 0, read);
        }
    }

    private void checkCancelled() {
        if (token.isCancelled()) {
            throw new OpenAIKitException(ClassifiedError.builder(ErrorKind.CANCELLED)
                    .technicalDetails(OpenAIKitErrorMessages.STREAM_CANCELLED)
                    .build());
        }
    }

    private static Frame toFrame(DataEvent event) {
        JsonNode payload = null;
        JsonProcessingException decodeError = null;
        try {
            payload = Utils.parseJson(event.getData());
        } catch (JsonProcessingException e) {
            LOGGER.debug("Malformed payload in event {}", event.getName(), e);
            decodeError = e;
        }
        Frame frame = new Frame(Frame.kindOf(event.getName(), payload), event.getData(), event.getLastEventId(),
                payload, decodeError);
        LOGGER.debug("Frame {}", frame.kind());
        return frame;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the underlying stream, releasing the connection. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        CancellationToken.Registration registration = cancelRegistration;
        if (registration != null) {
            registration.close();
        }
        try {
            in.close();
        } catch (IOException e) {
            LOGGER.debug("Failed to close event stream", e);
        }
    }
}
