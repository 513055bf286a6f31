package io.openaikit.spec;

import org.jspecify.annotations.Nullable;

/**
 * Coarse type of an {@link OutputItem}. The server's own type string is kept on the item as
 * {@link OutputItem#rawType()}.
 */
public enum OutputItemType {
    MESSAGE,
    TOOL_CALL,
    REASONING,
    OTHER;

    /**
     * Maps a server item type such as {@code message} or {@code function_call}.
     * Never fails; unrecognised types map to {@link #OTHER}.
     */
    public static OutputItemType fromServerType(@Nullable String type) {
        if (type == null) {
            return OTHER;
        }
        switch (type) {
            case "message":
                return MESSAGE;
            case "reasoning":
                return REASONING;
            case "function_call":
            case "custom_tool_call":
            case "mcp_call":
            case "tool_call":
                return TOOL_CALL;
            default:
                return type.endsWith("_call") ? TOOL_CALL : OTHER;
        }
    }
}
