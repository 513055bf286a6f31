package io.openaikit.spec;

import java.time.Duration;

import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A remediating step suggested to the user for a {@link ClassifiedError}. Advisory metadata only;
 * the runtime never acts on it.
 *
 * @param type the kind of action
 * @param delay how long to wait, only set for {@link Type#WAIT}
 */
public record UserAction(Type type, @Nullable Duration delay) {

    public enum Type {
        RETRY,
        CHECK_API_KEY,
        CHECK_INTERNET_CONNECTION,
        REDUCE_REQUEST_SIZE,
        CONTACT_SUPPORT,
        WAIT,
        CHECK_FILE_FORMAT,
        USE_ALTERNATIVE_MODEL
    }

    public static final UserAction RETRY = new UserAction(Type.RETRY, null);
    public static final UserAction CHECK_API_KEY = new UserAction(Type.CHECK_API_KEY, null);
    public static final UserAction CHECK_INTERNET_CONNECTION = new UserAction(Type.CHECK_INTERNET_CONNECTION, null);
    public static final UserAction REDUCE_REQUEST_SIZE = new UserAction(Type.REDUCE_REQUEST_SIZE, null);
    public static final UserAction CONTACT_SUPPORT = new UserAction(Type.CONTACT_SUPPORT, null);
    public static final UserAction CHECK_FILE_FORMAT = new UserAction(Type.CHECK_FILE_FORMAT, null);
    public static final UserAction USE_ALTERNATIVE_MODEL = new UserAction(Type.USE_ALTERNATIVE_MODEL, null);

    public UserAction {
        Assert.checkNotNullParam("type", type);
        if (type == Type.WAIT && delay == null) {
            throw new IllegalArgumentException("A WAIT action requires a duration");
        }
    }

    public static UserAction waitFor(Duration duration) {
        return new UserAction(Type.WAIT, duration);
    }

    /**
     * @return a short label suitable for a button
     */
    public String buttonTitle() {
        return switch (type) {
            case RETRY -> "Try Again";
            case CHECK_API_KEY -> "Check API Key";
            case CHECK_INTERNET_CONNECTION -> "Check Connection";
            case REDUCE_REQUEST_SIZE -> "Reduce Size";
            case CONTACT_SUPPORT -> "Contact Support";
            case WAIT -> "Wait " + waitSeconds() + "s";
            case CHECK_FILE_FORMAT -> "Check File";
            case USE_ALTERNATIVE_MODEL -> "Try Different Model";
        };
    }

    /**
     * @return a one-sentence description of the action
     */
    public String description() {
        return switch (type) {
            case RETRY -> "Retry the request";
            case CHECK_API_KEY -> "Verify your API key in settings";
            case CHECK_INTERNET_CONNECTION -> "Check your internet connection and try again";
            case REDUCE_REQUEST_SIZE -> "Reduce the size of your request";
            case CONTACT_SUPPORT -> "Contact support for assistance";
            case WAIT -> "Wait " + waitSeconds() + " seconds before retrying";
            case CHECK_FILE_FORMAT -> "Ensure the file format is supported";
            case USE_ALTERNATIVE_MODEL -> "Try using a different model";
        };
    }

    private long waitSeconds() {
        return delay == null ? 0 : Math.max(1, (delay.toMillis() + 999) / 1000);
    }
}
