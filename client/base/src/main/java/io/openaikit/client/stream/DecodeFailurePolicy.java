package io.openaikit.client.stream;

/**
 * What a stream does with a malformed frame or a protocol violation.
 */
public enum DecodeFailurePolicy {
    /** Release the connection and fail with a {@code DECODING_FAILED} error. */
    FAIL,

    /** Log the problem, record it on the result and keep reading. */
    SKIP
}
