package io.openaikit.spec;

import java.time.Duration;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * User-facing wording for each {@link ErrorKind}.
 */
final class ErrorPresentation {

    private static final Duration RATE_LIMIT_WAIT = Duration.ofSeconds(60);
    private static final Duration SERVER_ERROR_WAIT = Duration.ofSeconds(5);

    private ErrorPresentation() {
    }

    static String title(ErrorKind kind, @Nullable ApiErrorDetail apiError) {
        if (apiError != null && apiError.type() != null) {
            switch (apiError.type()) {
                case "invalid_request_error":
                    return "Invalid Request";
                case "authentication_error":
                    return "Authentication Error";
                case "rate_limit_error":
                    return "Rate Limit";
                case "server_error":
                    return "Server Error";
                case "engine_error":
                    return "Model Error";
                default:
                    break;
            }
        }
        return switch (kind) {
            case INVALID_REQUEST_URL -> "Connection Error";
            case AUTHENTICATION_FAILED -> "Authentication Error";
            case RATE_LIMIT_EXCEEDED -> "Rate Limit Exceeded";
            case CLIENT_ERROR -> "Request Error";
            case SERVER_ERROR -> "Server Error";
            case INVALID_PAYLOAD, DECODING_FAILED -> "Data Processing Error";
            case STREAMING_UNSUPPORTED -> "Feature Not Supported";
            case TIMED_OUT -> "Request Timed Out";
            case CANCELLED -> "Request Cancelled";
        };
    }

    static String message(ErrorKind kind, @Nullable Integer statusCode, @Nullable ApiErrorDetail apiError) {
        if (apiError != null && !apiError.message().isEmpty()) {
            return apiError.message();
        }
        return switch (kind) {
            case INVALID_REQUEST_URL -> "Unable to connect to the API. Please check your internet connection.";
            case AUTHENTICATION_FAILED -> "Your API key appears to be invalid. Please check your account settings.";
            case RATE_LIMIT_EXCEEDED -> "You've made too many requests. Please wait a moment before trying again.";
            case CLIENT_ERROR -> clientErrorMessage(statusCode);
            case SERVER_ERROR -> "The service is experiencing issues. Please try again in a few moments.";
            case INVALID_PAYLOAD -> "Unable to process your request. Please check your input and try again.";
            case DECODING_FAILED -> "Unable to process the response. Please try again or contact support if this persists.";
            case STREAMING_UNSUPPORTED -> "This feature doesn't support real-time streaming.";
            case TIMED_OUT -> "The request took too long to complete. Please try again.";
            case CANCELLED -> "The request was cancelled.";
        };
    }

    static List<UserAction> actions(ErrorKind kind, @Nullable Integer statusCode,
                                    @Nullable ApiErrorDetail apiError, @Nullable Duration retryDelay) {
        if (apiError != null && apiError.type() != null) {
            List<UserAction> byType = actionsForApiErrorType(apiError);
            if (byType != null) {
                return byType;
            }
        }
        return switch (kind) {
            case INVALID_REQUEST_URL -> List.of(UserAction.CHECK_INTERNET_CONNECTION, UserAction.RETRY);
            case AUTHENTICATION_FAILED -> List.of(UserAction.CHECK_API_KEY);
            case RATE_LIMIT_EXCEEDED -> List.of(
                    UserAction.waitFor(retryDelay != null ? retryDelay : RATE_LIMIT_WAIT), UserAction.RETRY);
            case CLIENT_ERROR -> clientErrorActions(statusCode);
            case SERVER_ERROR -> List.of(
                    UserAction.waitFor(retryDelay != null ? retryDelay : SERVER_ERROR_WAIT), UserAction.RETRY);
            case INVALID_PAYLOAD, DECODING_FAILED -> List.of(UserAction.RETRY, UserAction.CONTACT_SUPPORT);
            case STREAMING_UNSUPPORTED, CANCELLED -> List.of();
            case TIMED_OUT -> List.of(UserAction.CHECK_INTERNET_CONNECTION, UserAction.RETRY);
        };
    }

    private static @Nullable List<UserAction> actionsForApiErrorType(ApiErrorDetail apiError) {
        String type = apiError.type();
        if (type == null) {
            return null;
        }
        switch (type) {
            case "invalid_request_error":
                return apiError.param() != null
                        ? List.of(UserAction.REDUCE_REQUEST_SIZE, UserAction.RETRY)
                        : List.of(UserAction.RETRY);
            case "authentication_error":
                return List.of(UserAction.CHECK_API_KEY);
            case "rate_limit_error":
                return List.of(UserAction.waitFor(RATE_LIMIT_WAIT), UserAction.RETRY);
            case "server_error":
                return List.of(UserAction.waitFor(SERVER_ERROR_WAIT), UserAction.RETRY);
            case "engine_error":
                return List.of(UserAction.USE_ALTERNATIVE_MODEL, UserAction.RETRY);
            default:
                return null;
        }
    }

    private static String clientErrorMessage(@Nullable Integer statusCode) {
        if (statusCode == null) {
            return "The request failed. Please check your input and try again.";
        }
        return switch (statusCode) {
            case 400 -> "The request was invalid. Please check your parameters and try again.";
            case 403 -> "Access forbidden. You don't have permission to access this resource.";
            case 404 -> "The requested resource was not found.";
            case 413 -> "The request is too large. Please reduce the size and try again.";
            case 422 -> "The request couldn't be processed. Please check your input.";
            default -> "The request failed. Please check your input and try again.";
        };
    }

    private static List<UserAction> clientErrorActions(@Nullable Integer statusCode) {
        if (statusCode == null) {
            return List.of(UserAction.RETRY, UserAction.CONTACT_SUPPORT);
        }
        return switch (statusCode) {
            case 400 -> List.of(UserAction.RETRY);
            case 403 -> List.of(UserAction.CHECK_API_KEY);
            case 404 -> List.of(UserAction.CONTACT_SUPPORT);
            case 413 -> List.of(UserAction.REDUCE_REQUEST_SIZE);
            default -> List.of(UserAction.RETRY, UserAction.CONTACT_SUPPORT);
        };
    }
}
