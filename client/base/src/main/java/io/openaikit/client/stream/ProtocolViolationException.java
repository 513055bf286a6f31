package io.openaikit.client.stream;

/**
 * A frame or body broke the streaming protocol: an item was referenced before it was added,
 * added twice, changed after it was done, or a required field was missing.
 * <p>
 * Never reaches callers directly. Depending on the {@link DecodeFailurePolicy} it is either
 * reported as a {@code DECODING_FAILED} error with code {@code protocol_violation} or recorded
 * on the result.
 */
public class ProtocolViolationException extends Exception {

    public ProtocolViolationException(final String msg) {
        super(msg);
    }
}
