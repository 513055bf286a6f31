package io.openaikit.spec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of a response as reconstructed so far.
 * <p>
 * A streaming call yields a sequence of these, each one at least as complete as the one before;
 * the last has {@link #complete()} set. A non-streaming call yields exactly one, already complete.
 * Items appear in the order the server first announced them.
 *
 * @param responseId the server's response id, once known
 * @param model the model that produced the response, once known
 * @param status the server's response status, for example {@code in_progress} or {@code completed}
 * @param items output items in first-seen order
 * @param usage token usage, once reported
 * @param complete whether this is the terminal snapshot
 * @param violations protocol violations that were skipped rather than failing the stream
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccumulatedResult(@Nullable String responseId,
                                @Nullable String model,
                                @Nullable String status,
                                List<OutputItem> items,
                                @Nullable Usage usage,
                                boolean complete,
                                List<String> violations) {

    public AccumulatedResult {
        Assert.checkNotNullParam("items", items);
        Assert.checkNotNullParam("violations", violations);
        items = List.copyOf(items);
        violations = List.copyOf(violations);
    }

    public @Nullable OutputItem item(String id) {
        for (OutputItem item : items) {
            if (item.id().equals(id)) {
                return item;
            }
        }
        return null;
    }

    /**
     * @return the text of all message items, concatenated in item order
     */
    @JsonIgnore
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (OutputItem item : items) {
            if (item.type() == OutputItemType.MESSAGE) {
                sb.append(item.text());
            }
        }
        return sb.toString();
    }
}
