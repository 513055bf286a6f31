package io.openaikit.client.http.jdk;

import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import io.openaikit.client.http.HttpClient;
import io.openaikit.client.http.HttpResponse;
import io.openaikit.client.http.InvalidRequestUrlException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdkHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClient.class);

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, null);
    }

    JdkHttpClient(String baseUrl, @Nullable Duration connectTimeout) {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_2)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        this.httpClient = builder.build();

        URL targetUrl = buildUrl(baseUrl);
        String path = targetUrl.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority() + path;
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        protected URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException e) {
            throw new InvalidRequestUrlException(uri, e);
        }
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new JdkDeleteBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable Duration timeout;

        public JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @Override
        public T timeout(Duration timeout) {
            this.timeout = timeout;
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            String target = path.startsWith("/") ? baseUrl + path : baseUrl + "/" + path;
            URI uri;
            try {
                uri = URI.create(target);
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestUrlException(target, e);
            }
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);
            if (timeout != null) {
                builder.timeout(timeout);
            }
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }

        protected BodyHandler<?> bodyHandler() {
            if (HttpResponse.EVENT_STREAM.equalsIgnoreCase(headers.get("Accept"))) {
                return BodyHandlers.ofInputStream();
            }
            return BodyHandlers.ofString(StandardCharsets.UTF_8);
        }

        protected CompletableFuture<HttpResponse> sendRequest(HttpRequest.Builder requestBuilder) {
            final HttpRequest request;
            try {
                request = requestBuilder.build();
            } catch (IllegalArgumentException | IllegalStateException e) {
                return CompletableFuture.failedFuture(e);
            }
            LOGGER.debug("{} {}", request.method(), request.uri());
            CompletableFuture<? extends java.net.http.HttpResponse<?>> exchange = httpClient.sendAsync(request, bodyHandler());
            CompletableFuture<HttpResponse> result = exchange.thenCompose(RESPONSE_MAPPER);
            result.whenComplete((response, failure) -> {
                if (result.isCancelled()) {
                    abandon(request, exchange);
                }
            });
            return result;
        }

        // Cancelling a dependent stage leaves the exchange running; abort it and close a late response.
        private void abandon(HttpRequest request, CompletableFuture<? extends java.net.http.HttpResponse<?>> exchange) {
            LOGGER.debug("{} {} cancelled", request.method(), request.uri());
            exchange.cancel(true);
            exchange.thenAccept(late -> new JdkHttpResponse(late).close());
        }

        protected CompletableFuture<HttpResponse> dispatch(Function<HttpRequest.Builder, HttpRequest.Builder> method) {
            final HttpRequest.Builder requestBuilder;
            try {
                requestBuilder = createRequestBuilder();
            } catch (IllegalArgumentException e) {
                return CompletableFuture.failedFuture(e);
            }
            return sendRequest(method.apply(requestBuilder));
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        public JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return dispatch(HttpRequest.Builder::GET);
        }
    }

    private class JdkDeleteBuilder extends JdkRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        public JdkDeleteBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return dispatch(HttpRequest.Builder::DELETE);
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        private byte[] body = new byte[0];

        public JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(byte @Nullable [] body) {
            this.body = body == null ? new byte[0] : body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return dispatch(builder -> builder.POST(HttpRequest.BodyPublishers.ofByteArray(body)));
        }
    }

    private static final Function<java.net.http.HttpResponse<?>, CompletionStage<HttpResponse>> RESPONSE_MAPPER = response -> {
        LOGGER.debug("{} {} -> {}", response.request().method(), response.uri(), response.statusCode());
        return CompletableFuture.completedFuture(new JdkHttpResponse(response));
    };

    private record JdkHttpResponse(java.net.http.HttpResponse<?> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Map<String, List<String>> headers() {
            return response.headers().map();
        }

        @Override
        public @Nullable String header(String name) {
            return response.headers().firstValue(name).orElse(null);
        }

        @Override
        public String body() throws IOException {
            Object body = response.body();
            if (body instanceof String) {
                return (String) body;
            }
            try (InputStream in = (InputStream) body) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        @Override
        public InputStream bodyAsStream() {
            if (response.body() instanceof InputStream) {
                return (InputStream) response.body();
            }
            throw new IllegalStateException("Response body was not received as a stream");
        }

        @Override
        public void close() {
            if (response.body() instanceof InputStream) {
                try {
                    ((InputStream) response.body()).close();
                } catch (IOException e) {
                    LOGGER.debug("Failed to close response stream of {}", response.uri(), e);
                }
            }
        }
    }
}
