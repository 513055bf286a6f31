package io.openaikit.client.http;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import io.openaikit.client.http.sse.FrameDecoder;
import io.openaikit.common.CancellationToken;
import org.jspecify.annotations.Nullable;

public interface HttpResponse extends AutoCloseable {

    String EVENT_STREAM = "text/event-stream";

    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    Map<String, List<String>> headers();

    default @Nullable String header(String name) {
        for (Map.Entry<String, List<String>> entry : headers().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    default @Nullable String contentType() {
        return header("Content-Type");
    }

    default boolean isEventStream() {
        String contentType = contentType();
        return contentType != null && contentType.toLowerCase(java.util.Locale.ROOT).startsWith(EVENT_STREAM);
    }

    /**
     * Reads the whole body as UTF-8. For a streamed response this drains and closes the stream.
     */
    String body() throws IOException;

    /**
     * @throws IllegalStateException if the body was not received as a stream
     */
    InputStream bodyAsStream();

    default FrameDecoder bodyAsFrames(CancellationToken token) {
        return new FrameDecoder(bodyAsStream(), token);
    }

    /**
     * Releases the connection. Idempotent.
     */
    @Override
    void close();
}
