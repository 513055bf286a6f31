package io.openaikit.client.http;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Everything needed to issue one request against the API, independent of the endpoint.
 * <p>
 * Endpoint facades build envelopes; the runtime adds authentication and client headers
 * before sending. A {@code null} timeout falls back to the client default. The body is sent
 * byte for byte; a {@code Content-Type} header on the envelope is kept, otherwise the runtime
 * sends the body as JSON.
 *
 * @param method the HTTP method
 * @param path the path relative to the client's base URL, for example {@code /responses}
 * @param headers extra request headers
 * @param body the raw request body, if any
 * @param timeout the request timeout, if different from the client default
 * @param streaming whether the caller expects a {@code text/event-stream} response
 */
public record RequestEnvelope(Method method,
                              String path,
                              Map<String, String> headers,
                              byte @Nullable [] body,
                              @Nullable Duration timeout,
                              boolean streaming) {

    public enum Method {
        GET,
        POST,
        DELETE
    }

    public RequestEnvelope {
        Assert.checkNotNullParam("method", method);
        Assert.checkNotNullParam("path", path);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RequestEnvelope get(String path) {
        return new RequestEnvelope(Method.GET, path, Map.of(), null, null, false);
    }

    public static RequestEnvelope delete(String path) {
        return new RequestEnvelope(Method.DELETE, path, Map.of(), null, null, false);
    }

    /**
     * @param body a JSON document, sent as UTF-8
     */
    public static RequestEnvelope post(String path, @Nullable String body) {
        byte[] bytes = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
        return new RequestEnvelope(Method.POST, path, Map.of(), bytes, null, false);
    }

    /**
     * @param body the encoded body, for example a {@code multipart/form-data} upload
     * @param contentType the media type of {@code body}, including any boundary parameter
     */
    public static RequestEnvelope post(String path, byte[] body, String contentType) {
        Assert.checkNotNullParam("body", body);
        Assert.checkNotNullParam("contentType", contentType);
        return new RequestEnvelope(Method.POST, path, Map.of("Content-Type", contentType), body, null, false);
    }

    /**
     * @return whether the envelope carries the named header, ignoring case
     */
    public boolean hasHeader(String name) {
        for (String header : headers.keySet()) {
            if (header.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    public RequestEnvelope withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new RequestEnvelope(method, path, copy, body, timeout, streaming);
    }

    public RequestEnvelope withHeaders(Map<String, String> extra) {
        Map<String, String> copy = new LinkedHashMap<>(extra);
        copy.putAll(headers);
        return new RequestEnvelope(method, path, copy, body, timeout, streaming);
    }

    public RequestEnvelope withTimeout(@Nullable Duration timeout) {
        return new RequestEnvelope(method, path, headers, body, timeout, streaming);
    }

    public RequestEnvelope withStreaming(boolean streaming) {
        return new RequestEnvelope(method, path, headers, body, timeout, streaming);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RequestEnvelope)) {
            return false;
        }
        RequestEnvelope that = (RequestEnvelope) o;
        return streaming == that.streaming
                && method == that.method
                && path.equals(that.path)
                && headers.equals(that.headers)
                && Arrays.equals(body, that.body)
                && Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(method, path, headers, timeout, streaming);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "RequestEnvelope{method=" + method + ", path=" + path + ", headers=" + headers.keySet()
                + ", body=" + (body == null ? "none" : body.length + " bytes")
                + ", timeout=" + timeout + ", streaming=" + streaming + '}';
    }
}
