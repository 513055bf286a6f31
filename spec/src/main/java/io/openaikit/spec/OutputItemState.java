package io.openaikit.spec;

/**
 * Lifecycle of an {@link OutputItem}. Transitions only move forward:
 * {@code PENDING -> STREAMING -> DONE}, and {@code PENDING -> DONE} for items that never
 * received content.
 */
public enum OutputItemState {
    PENDING,
    STREAMING,
    DONE;

    public boolean isFinal() {
        return this == DONE;
    }
}
