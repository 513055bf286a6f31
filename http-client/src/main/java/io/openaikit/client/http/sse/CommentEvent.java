package io.openaikit.client.http.sse;

public final class CommentEvent extends Event {

    private final String comment;

    public CommentEvent(String comment) {
        this.comment = comment;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public Type getType() {
        return Type.COMMENT;
    }

    @Override
    public String toString() {
        return "CommentEvent{comment='" + comment + "'}";
    }
}
