package io.openaikit.client.stream;

import io.openaikit.spec.OutputItemType;
import io.openaikit.spec.Usage;
import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * One typed change to a response under reconstruction, produced by a {@link DeltaMapping}
 * and applied by the {@link EventReconstructor} in arrival order.
 */
public sealed interface Delta {

    /**
     * The response was created or reported progress. Non-null fields replace the known values.
     */
    record ResponseStarted(@Nullable String responseId, @Nullable String model, @Nullable String status) implements Delta {
    }

    /**
     * A new output item was announced.
     */
    record ItemAdded(String itemId, OutputItemType type, String rawType, @Nullable String name,
                     @Nullable String callId, int outputIndex) implements Delta {
        public ItemAdded {
            Assert.checkNotNullParam("itemId", itemId);
            Assert.checkNotNullParam("type", type);
            Assert.checkNotNullParam("rawType", rawType);
        }
    }

    /**
     * A text fragment for a message or reasoning item.
     */
    record TextDelta(String itemId, String fragment) implements Delta {
        public TextDelta {
            Assert.checkNotNullParam("itemId", itemId);
            Assert.checkNotNullParam("fragment", fragment);
        }
    }

    /**
     * An argument fragment for a tool-call item.
     */
    record ArgumentsDelta(String itemId, String fragment) implements Delta {
        public ArgumentsDelta {
            Assert.checkNotNullParam("itemId", itemId);
            Assert.checkNotNullParam("fragment", fragment);
        }
    }

    /**
     * The server's view of an item's full content, sent when a content part ends. Advisory:
     * compared against the folded content, never applied.
     */
    record ContentDone(String itemId, @Nullable String text, @Nullable String arguments) implements Delta {
        public ContentDone {
            Assert.checkNotNullParam("itemId", itemId);
        }
    }

    /**
     * The item is final. The text and arguments are advisory, as for {@link ContentDone}.
     */
    record ItemDone(String itemId, @Nullable String text, @Nullable String arguments) implements Delta {
        public ItemDone {
            Assert.checkNotNullParam("itemId", itemId);
        }
    }

    /**
     * The response finished. Carries the usage when reported.
     */
    record ResponseCompleted(@Nullable Usage usage, @Nullable String status) implements Delta {
    }

    /**
     * The server reported an error inside the stream.
     */
    record StreamError(@Nullable String code, String message) implements Delta {
        public StreamError {
            Assert.checkNotNullParam("message", message);
        }
    }
}
