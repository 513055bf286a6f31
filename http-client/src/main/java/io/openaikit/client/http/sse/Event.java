package io.openaikit.client.http.sse;

/**
 * An event dispatched by the {@link SSEDecoder}: either a {@link DataEvent} ending at a blank
 * line, or a {@link CommentEvent} for a line starting with {@code ':'}.
 */
public abstract sealed class Event permits CommentEvent, DataEvent {

    public enum Type {
        COMMENT,
        DATA
    }

    public abstract Type getType();

    public boolean isData() {
        return getType() == Type.DATA;
    }
}
