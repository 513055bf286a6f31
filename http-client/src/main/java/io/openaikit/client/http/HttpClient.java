package io.openaikit.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * Minimal asynchronous HTTP client bound to one base URL. Paths passed to the request builders
 * are appended to that base URL.
 */
public interface HttpClient {

    /**
     * @return a client from the default {@link HttpClientBuilder}
     */
    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    DeleteRequestBuilder delete(String path);

    /**
     * Sends the envelope as-is. Headers already present on the envelope are sent unchanged;
     * a streaming envelope asks for {@code text/event-stream} and gets its body as a stream.
     */
    default CompletableFuture<HttpResponse> send(RequestEnvelope envelope) {
        RequestBuilder<?> builder;
        switch (envelope.method()) {
            case GET:
                builder = get(envelope.path());
                break;
            case DELETE:
                builder = delete(envelope.path());
                break;
            case POST:
            default:
                builder = post(envelope.path()).body(envelope.body());
                break;
        }
        builder.addHeaders(envelope.headers());
        if (envelope.streaming()) {
            builder.addHeader("Accept", HttpResponse.EVENT_STREAM);
        }
        if (envelope.timeout() != null) {
            builder.timeout(envelope.timeout());
        }
        return builder.send();
    }

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);

        T timeout(Duration timeout);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(byte @Nullable [] body);
    }

    interface DeleteRequestBuilder extends RequestBuilder<DeleteRequestBuilder> {

    }
}
