package io.openaikit.client.http.sse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * One decoded event of a stream.
 * <p>
 * The kind is the SSE {@code event} name; when the server did not name the event it is taken
 * from the payload's {@code "type"} member, falling back to {@code "message"}. A frame whose
 * data is not valid JSON has no payload and carries the parse failure instead.
 *
 * @param kind the event kind tag
 * @param data the raw data text
 * @param id the last event id seen on the stream, possibly empty
 * @param payload the parsed JSON payload, {@code null} for a malformed frame
 * @param decodeError the JSON parse failure, {@code null} for a well-formed frame
 */
public record Frame(String kind,
                    String data,
                    String id,
                    @Nullable JsonNode payload,
                    @Nullable JsonProcessingException decodeError) {

    public static final String DEFAULT_KIND = "message";

    public Frame {
        Assert.checkNotNullParam("kind", kind);
        Assert.checkNotNullParam("data", data);
        Assert.checkNotNullParam("id", id);
    }

    public boolean isMalformed() {
        return decodeError != null;
    }

    static String kindOf(String eventName, @Nullable JsonNode payload) {
        if (!DEFAULT_KIND.equals(eventName)) {
            return eventName;
        }
        if (payload != null && payload.isObject()) {
            JsonNode type = payload.get("type");
            if (type != null && type.isTextual()) {
                return type.asText();
            }
        }
        return DEFAULT_KIND;
    }
}
