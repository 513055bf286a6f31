package io.openaikit.client;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.openaikit.client.error.ErrorClassifier;
import io.openaikit.client.http.HttpClient;
import io.openaikit.client.http.HttpResponse;
import io.openaikit.client.http.RequestEnvelope;
import io.openaikit.client.retry.RetryController;
import io.openaikit.client.stream.DeltaMapping;
import io.openaikit.client.stream.EventReconstructor;
import io.openaikit.client.stream.ProtocolViolationException;
import io.openaikit.client.stream.ResultStream;
import io.openaikit.common.CancellationToken;
import io.openaikit.common.OpenAIKitErrorMessages;
import io.openaikit.spec.AccumulatedResult;
import io.openaikit.spec.OpenAIKitException;
import io.openaikit.util.Assert;
import io.openaikit.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the runtime: sends {@link RequestEnvelope}s with authentication and client
 * headers, retries failed attempts under the configured policy, and reconstructs responses.
 * <p>
 * Every method returns a future that fails with an {@link OpenAIKitException}; after retries
 * were attempted it is a {@link io.openaikit.spec.RetryFailedException}. Independent calls
 * share only this client's immutable configuration, so one client may serve many threads.
 * <p>
 * For streams only the setup is retried: sending the request and checking the status and
 * content type. Once a {@link ResultStream} was handed out, failures are reported through it.
 */
public class OpenAIKitClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAIKitClient.class);

    public static final String VERSION = "0.1.0";
    public static final String USER_AGENT = "OpenAIKit-Java/" + VERSION;

    private final ClientConfig config;
    private final HttpClient httpClient;
    private final ErrorClassifier classifier;
    private final RetryController retryController;
    private final Map<String, String> defaultHeaders;

    public OpenAIKitClient(ClientConfig config) {
        this(config, new ErrorClassifier(config.getRetryPolicy().baseDelay()));
    }

    private OpenAIKitClient(ClientConfig config, ErrorClassifier classifier) {
        this(config, classifier, new RetryController(config.getRetryPolicy(), classifier));
    }

    OpenAIKitClient(ClientConfig config, ErrorClassifier classifier, RetryController retryController) {
        this.config = Assert.checkNotNullParam("config", config);
        this.classifier = Assert.checkNotNullParam("classifier", classifier);
        this.retryController = Assert.checkNotNullParam("retryController", retryController);
        this.httpClient = config.getHttpClientBuilder().create(config.getBaseUrl());
        this.defaultHeaders = defaultHeaders(config);
    }

    public ClientConfig getConfig() {
        return config;
    }

    /**
     * Sends a request and returns its raw body.
     */
    public CompletableFuture<String> execute(RequestEnvelope envelope, CancellationToken token) {
        RequestEnvelope prepared = prepare(envelope.withStreaming(false));
        return retry(() -> send(prepared, token).thenApply(this::readBody), token);
    }

    /**
     * Sends a request and parses its body as JSON.
     */
    public CompletableFuture<JsonNode> executeJson(RequestEnvelope envelope, CancellationToken token) {
        RequestEnvelope prepared = prepare(envelope.withStreaming(false));
        return retry(() -> send(prepared, token).thenApply(this::readBody).thenApply(this::parseJson), token);
    }

    /**
     * Sends a non-streaming request and folds the whole body into one complete result.
     */
    public CompletableFuture<AccumulatedResult> create(RequestEnvelope envelope, DeltaMapping.Factory mappingFactory,
                                                       CancellationToken token) {
        Assert.checkNotNullParam("mappingFactory", mappingFactory);
        RequestEnvelope prepared = prepare(envelope.withStreaming(false));
        return retry(() -> send(prepared, token)
                .thenApply(this::readBody)
                .thenApply(this::parseJson)
                .thenApply(body -> reconstruct(body, mappingFactory)), token);
    }

    /**
     * Opens a streamed response. The envelope must be flagged as streaming.
     *
     * @return a future completed once the server accepted the stream; the caller owns the
     *         returned {@link ResultStream} and must close it
     */
    public CompletableFuture<ResultStream> stream(RequestEnvelope envelope, DeltaMapping.Factory mappingFactory,
                                                  CancellationToken token) {
        Assert.checkNotNullParam("mappingFactory", mappingFactory);
        if (!envelope.streaming()) {
            return CompletableFuture.failedFuture(new OpenAIKitException(
                    classifier.streamingUnsupported(OpenAIKitErrorMessages.STREAMING_NOT_REQUESTED)));
        }
        RequestEnvelope prepared = prepare(envelope);
        return retry(() -> send(prepared, token).thenApply(response -> openStream(response, mappingFactory, token)), token);
    }

    private <T> CompletableFuture<T> retry(Supplier<CompletableFuture<T>> operation, CancellationToken token) {
        return retryController.perform(operation, token, config.getRetryListener());
    }

    private CompletableFuture<HttpResponse> send(RequestEnvelope envelope, CancellationToken token) {
        CompletableFuture<HttpResponse> future = httpClient.send(envelope);
        CancellationToken.Registration registration = token.onCancel(() -> future.cancel(true));
        future.whenComplete((response, failure) -> registration.close());
        return future;
    }

    private String readBody(HttpResponse response) {
        try (response) {
            String body = response.body();
            if (!response.success()) {
                throw new OpenAIKitException(classifier.classify(response, body));
            }
            return body;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private JsonNode parseJson(String body) {
        try {
            return Utils.parseJson(body);
        } catch (JsonProcessingException e) {
            throw new OpenAIKitException(classifier.decodingFailed(e), e);
        }
    }

    private AccumulatedResult reconstruct(JsonNode body, DeltaMapping.Factory mappingFactory) {
        EventReconstructor reconstructor = new EventReconstructor(mappingFactory.create(), config.getDecodeFailurePolicy());
        try {
            return reconstructor.reconstructComplete(body);
        } catch (ProtocolViolationException e) {
            throw new OpenAIKitException(classifier.protocolViolation(e.getMessage()), e);
        }
    }

    private ResultStream openStream(HttpResponse response, DeltaMapping.Factory mappingFactory, CancellationToken token) {
        if (!response.success()) {
            // throws the classified HTTP error
            readBody(response);
        }
        if (!response.isEventStream()) {
            response.close();
            throw new OpenAIKitException(classifier.streamingUnsupported(
                    String.format(OpenAIKitErrorMessages.NOT_AN_EVENT_STREAM, response.contentType())));
        }
        LOGGER.debug("Stream opened ({})", response.statusCode());
        EventReconstructor reconstructor = new EventReconstructor(mappingFactory.create(), config.getDecodeFailurePolicy());
        return new ResultStream(response.bodyAsFrames(token), reconstructor, classifier, response::close);
    }

    private RequestEnvelope prepare(RequestEnvelope envelope) {
        Map<String, String> headers = new LinkedHashMap<>(defaultHeaders);
        if (envelope.body() != null && !envelope.hasHeader("Content-Type")) {
            headers.put("Content-Type", "application/json");
        }
        RequestEnvelope prepared = envelope.withHeaders(headers);
        if (prepared.timeout() == null) {
            prepared = prepared.withTimeout(config.getTimeout());
        }
        return prepared;
    }

    private static Map<String, String> defaultHeaders(ClientConfig config) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + config.getApiKey());
        if (config.getOrganization() != null) {
            headers.put("OpenAI-Organization", config.getOrganization());
        }
        if (config.getProject() != null) {
            headers.put("OpenAI-Project", config.getProject());
        }
        headers.put("User-Agent", USER_AGENT);
        return Map.copyOf(headers);
    }
}
