package io.openaikit.common;

/**
 * Technical messages shared by the transport and client modules.
 */
public interface OpenAIKitErrorMessages {

    String AUTHENTICATION_FAILED = "Authentication failed: API key missing, invalid or revoked";
    String RATE_LIMIT_EXCEEDED = "Rate limit exceeded";
    String REQUEST_CANCELLED = "Request cancelled";
    String STREAM_CANCELLED = "Stream cancelled while reading frames";
    String NOT_AN_EVENT_STREAM = "Response is not an event-stream response: Content-Type[%s]";
    String STREAMING_NOT_REQUESTED = "Request envelope is not flagged for streaming";
    String MALFORMED_FRAME = "Malformed JSON payload in frame of kind '%s'";
    String RETRIES_EXHAUSTED = "Request failed after %d attempt(s): %s";
}
