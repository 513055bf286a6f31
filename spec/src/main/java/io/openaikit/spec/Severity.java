package io.openaikit.spec;

/**
 * How serious a {@link ClassifiedError} is for the person looking at it. Ordered from least to
 * most severe, so {@code compareTo} can be used to filter.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
