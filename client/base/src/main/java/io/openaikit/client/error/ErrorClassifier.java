package io.openaikit.client.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.openaikit.client.http.HttpResponse;
import io.openaikit.client.http.InvalidRequestUrlException;
import io.openaikit.common.OpenAIKitErrorMessages;
import io.openaikit.spec.ApiErrorDetail;
import io.openaikit.spec.ClassifiedError;
import io.openaikit.spec.ErrorKind;
import io.openaikit.spec.OpenAIKitException;
import io.openaikit.util.Assert;
import io.openaikit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps every failure the runtime can observe to exactly one {@link ClassifiedError}.
 * <p>
 * Classification is pure: the same status, headers and body, or the same exception, always
 * produce the same error. Only {@link ErrorKind#RATE_LIMIT_EXCEEDED},
 * {@link ErrorKind#SERVER_ERROR} and {@link ErrorKind#TIMED_OUT} are retryable.
 *
 * <h2>Status mapping</h2>
 * <ul>
 *   <li>401 - {@link ErrorKind#AUTHENTICATION_FAILED}</li>
 *   <li>429 - {@link ErrorKind#RATE_LIMIT_EXCEEDED}</li>
 *   <li>5xx - {@link ErrorKind#SERVER_ERROR}</li>
 *   <li>any other non-2xx - {@link ErrorKind#CLIENT_ERROR}</li>
 * </ul>
 *
 * <h2>Retry-After</h2>
 * A {@code retry-after-ms} header, or a {@code Retry-After} header holding delta-seconds or an
 * HTTP-date, becomes the server-provided delay. Otherwise retryable errors suggest the
 * configured default delay.
 */
public class ErrorClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorClassifier.class);

    public static final String CONNECTION_FAILED = "connection_failed";
    public static final String UNEXPECTED_FAILURE = "unexpected_failure";
    public static final String PROTOCOL_VIOLATION = "protocol_violation";

    private static final int MAX_DETAIL_LENGTH = 1000;

    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d+(\\.\\d+)?");

    private final Duration defaultRetryDelay;
    private final Clock clock;

    public ErrorClassifier() {
        this(ClassifiedError.DEFAULT_RETRY_DELAY);
    }

    public ErrorClassifier(Duration defaultRetryDelay) {
        this(defaultRetryDelay, Clock.systemUTC());
    }

    public ErrorClassifier(Duration defaultRetryDelay, Clock clock) {
        this.defaultRetryDelay = Assert.checkNotNullParam("defaultRetryDelay", defaultRetryDelay);
        this.clock = Assert.checkNotNullParam("clock", clock);
    }

    public ClassifiedError classify(HttpResponse response, @Nullable String body) {
        return classify(response.statusCode(), response.headers(), body);
    }

    /**
     * Classifies a non-2xx response.
     *
     * @param status the HTTP status
     * @param headers the response headers, names compared case-insensitively
     * @param body the response body, if it could be read
     * @return the classified error
     */
    public ClassifiedError classify(int status, Map<String, List<String>> headers, @Nullable String body) {
        ErrorKind kind;
        if (status == 401) {
            kind = ErrorKind.AUTHENTICATION_FAILED;
        } else if (status == 429) {
            kind = ErrorKind.RATE_LIMIT_EXCEEDED;
        } else if (status >= 500 && status < 600) {
            kind = ErrorKind.SERVER_ERROR;
        } else {
            kind = ErrorKind.CLIENT_ERROR;
        }

        ApiErrorDetail apiError = parseApiError(body);
        Duration retryAfter = kind.isRetryable() ? parseRetryAfter(headers) : null;

        StringBuilder details = new StringBuilder("HTTP ").append(status);
        if (body != null && !body.isBlank()) {
            details.append(": ").append(abbreviate(body.strip()));
        }

        ClassifiedError error = ClassifiedError.builder(kind)
                .statusCode(status)
                .apiError(apiError)
                .retryAfter(retryAfter)
                .suggestedRetryDelay(defaultRetryDelay)
                .technicalDetails(details.toString())
                .build();
        LOGGER.debug("Classified HTTP {} as {}", status, error.kind());
        return error;
    }

    /**
     * Classifies a transport, decoding or cancellation failure. {@link CompletionException} and
     * {@link ExecutionException} wrappers are looked through.
     */
    public ClassifiedError classify(Throwable failure) {
        Throwable cause = unwrap(failure);

        if (cause instanceof OpenAIKitException kitException) {
            return kitException.getError();
        }
        if (cause instanceof HttpTimeoutException) {
            return retryable(ErrorKind.TIMED_OUT, null, cause);
        }
        if (cause instanceof InvalidRequestUrlException || cause instanceof UnknownHostException
                || cause instanceof URISyntaxException) {
            return invalidRequestUrl(cause);
        }
        if (cause instanceof JsonProcessingException) {
            return decodingFailed(cause);
        }
        if (cause instanceof IOException) {
            return retryable(ErrorKind.TIMED_OUT, CONNECTION_FAILED, cause);
        }
        if (cause instanceof CancellationException || cause instanceof InterruptedException) {
            return cancelled();
        }

        LOGGER.debug("Unexpected failure classified as client error", cause);
        return ClassifiedError.builder(ErrorKind.CLIENT_ERROR)
                .code(UNEXPECTED_FAILURE)
                .technicalDetails(describe(cause))
                .build();
    }

    public ClassifiedError invalidPayload(Throwable cause) {
        return ClassifiedError.builder(ErrorKind.INVALID_PAYLOAD)
                .technicalDetails(describe(cause))
                .build();
    }

    public ClassifiedError decodingFailed(Throwable cause) {
        return ClassifiedError.builder(ErrorKind.DECODING_FAILED)
                .technicalDetails(describe(cause))
                .build();
    }

    public ClassifiedError protocolViolation(String message) {
        return ClassifiedError.builder(ErrorKind.DECODING_FAILED)
                .code(PROTOCOL_VIOLATION)
                .technicalDetails(message)
                .build();
    }

    public ClassifiedError streamingUnsupported(String detail) {
        return ClassifiedError.builder(ErrorKind.STREAMING_UNSUPPORTED)
                .technicalDetails(detail)
                .build();
    }

    public ClassifiedError cancelled() {
        return ClassifiedError.builder(ErrorKind.CANCELLED)
                .technicalDetails(OpenAIKitErrorMessages.REQUEST_CANCELLED)
                .build();
    }

    public ClassifiedError invalidRequestUrl(Throwable cause) {
        return ClassifiedError.builder(ErrorKind.INVALID_REQUEST_URL)
                .technicalDetails(describe(cause))
                .build();
    }

    private ClassifiedError retryable(ErrorKind kind, @Nullable String code, Throwable cause) {
        return ClassifiedError.builder(kind)
                .code(code)
                .suggestedRetryDelay(defaultRetryDelay)
                .technicalDetails(describe(cause))
                .build();
    }

    /**
     * Parses {@code {"error": {...}}}; anything else yields {@code null}.
     */
    public @Nullable ApiErrorDetail parseApiError(@Nullable String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = Utils.parseJson(body);
            JsonNode error = root.get("error");
            if (error == null || !error.isObject()) {
                return null;
            }
            return Utils.OBJECT_MAPPER.treeToValue(error, ApiErrorDetail.class);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Error body is not a JSON error object", e);
            return null;
        }
    }

    /**
     * @return the server-requested delay, or {@code null} if none or unparseable
     */
    public @Nullable Duration parseRetryAfter(Map<String, List<String>> headers) {
        String millis = header(headers, "retry-after-ms");
        if (millis != null) {
            try {
                return Duration.ofMillis(Math.max(0L, (long) Double.parseDouble(millis.trim())));
            } catch (NumberFormatException e) {
                LOGGER.debug("Ignoring invalid retry-after-ms header `{}`", millis);
            }
        }
        String value = header(headers, "retry-after");
        if (value == null) {
            return null;
        }
        value = value.trim();
        if (DELTA_SECONDS.matcher(value).matches()) {
            return Duration.ofMillis((long) (Double.parseDouble(value) * 1000));
        }
        try {
            ZonedDateTime date = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration delay = Duration.between(clock.instant(), date.toInstant());
            return delay.isNegative() ? Duration.ZERO : delay;
        } catch (DateTimeParseException e) {
            LOGGER.debug("Ignoring invalid Retry-After header `{}`", value);
            return null;
        }
    }

    private static @Nullable String header(Map<String, List<String>> headers, String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                    && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException
                || current instanceof UncheckedIOException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null ? cause.getClass().getName() : cause.getClass().getSimpleName() + ": " + message;
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_DETAIL_LENGTH ? text : text.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
