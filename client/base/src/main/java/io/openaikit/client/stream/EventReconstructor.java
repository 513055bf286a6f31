package io.openaikit.client.stream;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import io.openaikit.client.http.sse.Frame;
import io.openaikit.spec.AccumulatedResult;
import io.openaikit.spec.ClassifiedError;
import io.openaikit.spec.ErrorKind;
import io.openaikit.spec.OpenAIKitException;
import io.openaikit.spec.OutputItem;
import io.openaikit.spec.OutputItemState;
import io.openaikit.spec.OutputItemType;
import io.openaikit.spec.Usage;
import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds the deltas of one response into {@link AccumulatedResult} snapshots.
 * <p>
 * Deltas are applied in arrival order. Text and argument fragments are appended exactly as
 * received. The deltas produced by one frame are validated together before any of them is
 * applied, so a frame that breaks the protocol leaves the accumulated state untouched.
 * <p>
 * Protocol rules:
 * <ul>
 *   <li>an item id may be added only once</li>
 *   <li>fragments and done markers must reference an added item that is not yet done</li>
 *   <li>nothing may change once the response completed</li>
 * </ul>
 * One instance serves exactly one response and is not thread-safe.
 */
public class EventReconstructor {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventReconstructor.class);

    private final DeltaMapping mapping;
    private final DecodeFailurePolicy policy;

    private final Map<String, ItemState> items = new LinkedHashMap<>();
    private final List<String> violations = new ArrayList<>();
    private @Nullable String responseId;
    private @Nullable String model;
    private @Nullable String status;
    private @Nullable Usage usage;
    private boolean complete;

    public EventReconstructor(DeltaMapping mapping) {
        this(mapping, DecodeFailurePolicy.FAIL);
    }

    public EventReconstructor(DeltaMapping mapping, DecodeFailurePolicy policy) {
        this.mapping = Assert.checkNotNullParam("mapping", mapping);
        this.policy = Assert.checkNotNullParam("policy", policy);
    }

    public DecodeFailurePolicy getPolicy() {
        return policy;
    }

    /**
     * Maps and applies one well-formed frame.
     *
     * @return {@code true} if the frame changed any visible state
     * @throws ProtocolViolationException if the frame breaks the protocol; nothing was applied
     * @throws OpenAIKitException of kind {@code SERVER_ERROR} if the frame reports a server error
     */
    public boolean apply(Frame frame) throws ProtocolViolationException {
        List<Delta> deltas = mapping.map(frame);
        try {
            return apply(deltas);
        } catch (ProtocolViolationException e) {
            mapping.rollback();
            throw e;
        }
    }

    /**
     * Applies the deltas of one frame atomically.
     *
     * @return {@code true} if any visible state changed
     */
    public boolean apply(List<Delta> deltas) throws ProtocolViolationException {
        validate(deltas);
        boolean changed = false;
        for (Delta delta : deltas) {
            changed |= applyValidated(delta);
        }
        return changed;
    }

    /**
     * Records a skipped violation so that it shows up on later snapshots.
     */
    public void recordViolation(String message) {
        violations.add(message);
    }

    public boolean isComplete() {
        return complete;
    }

    public AccumulatedResult snapshot() {
        List<OutputItem> snapshot = new ArrayList<>(items.size());
        for (ItemState item : items.values()) {
            snapshot.add(item.toOutputItem());
        }
        return new AccumulatedResult(responseId, model, status, snapshot, usage, complete, violations);
    }

    /**
     * Marks the response complete and returns the terminal snapshot.
     */
    public AccumulatedResult finish() {
        complete = true;
        return snapshot();
    }

    /**
     * Rebuilds a whole non-streamed response. Each delta is applied on its own, so under
     * {@link DecodeFailurePolicy#SKIP} a violation only drops the offending delta.
     *
     * @throws ProtocolViolationException on the first violation under {@link DecodeFailurePolicy#FAIL}
     */
    public AccumulatedResult reconstructComplete(JsonNode body) throws ProtocolViolationException {
        for (Delta delta : mapping.mapComplete(body)) {
            try {
                apply(List.of(delta));
            } catch (ProtocolViolationException e) {
                if (policy == DecodeFailurePolicy.FAIL) {
                    throw e;
                }
                LOGGER.warn("Skipping protocol violation in response body: {}", e.getMessage());
                recordViolation(e.getMessage());
            }
        }
        return finish();
    }

    private void validate(List<Delta> deltas) throws ProtocolViolationException {
        Set<String> added = new HashSet<>();
        Set<String> done = new HashSet<>();
        boolean completing = complete;

        for (Delta delta : deltas) {
            if (delta instanceof Delta.StreamError error) {
                throw new OpenAIKitException(ClassifiedError.builder(ErrorKind.SERVER_ERROR)
                        .code(error.code() != null ? error.code() : ErrorKind.SERVER_ERROR.defaultCode())
                        .message(error.message())
                        .technicalDetails("Stream error: " + error.message())
                        .build());
            }
            if (completing) {
                throw new ProtocolViolationException("Received " + describe(delta) + " after the response completed");
            }
            if (delta instanceof Delta.ItemAdded itemAdded) {
                if (items.containsKey(itemAdded.itemId()) || !added.add(itemAdded.itemId())) {
                    throw new ProtocolViolationException("Item '" + itemAdded.itemId() + "' was added twice");
                }
            } else if (delta instanceof Delta.ResponseCompleted) {
                completing = true;
            } else {
                String itemId = itemIdOf(delta);
                if (itemId != null) {
                    ItemState item = items.get(itemId);
                    if (item == null && !added.contains(itemId)) {
                        throw new ProtocolViolationException("Unknown item '" + itemId + "' in " + describe(delta));
                    }
                    if (done.contains(itemId) || (item != null && item.state == OutputItemState.DONE)) {
                        throw new ProtocolViolationException("Item '" + itemId + "' is done and cannot receive " + describe(delta));
                    }
                    if (delta instanceof Delta.ItemDone) {
                        done.add(itemId);
                    }
                }
            }
        }
    }

    private boolean applyValidated(Delta delta) {
        if (delta instanceof Delta.ResponseStarted started) {
            boolean changed = false;
            if (started.responseId() != null && !started.responseId().equals(responseId)) {
                responseId = started.responseId();
                changed = true;
            }
            if (started.model() != null && !started.model().equals(model)) {
                model = started.model();
                changed = true;
            }
            if (started.status() != null && !started.status().equals(status)) {
                status = started.status();
                changed = true;
            }
            return changed;
        }
        if (delta instanceof Delta.ItemAdded added) {
            items.put(added.itemId(), new ItemState(added));
            LOGGER.debug("Item {} added ({})", added.itemId(), added.rawType());
            return true;
        }
        if (delta instanceof Delta.TextDelta text) {
            ItemState item = items.get(text.itemId());
            item.text.append(text.fragment());
            item.state = OutputItemState.STREAMING;
            return true;
        }
        if (delta instanceof Delta.ArgumentsDelta arguments) {
            ItemState item = items.get(arguments.itemId());
            item.arguments.append(arguments.fragment());
            item.state = OutputItemState.STREAMING;
            return true;
        }
        if (delta instanceof Delta.ContentDone contentDone) {
            checkAdvisory(items.get(contentDone.itemId()), contentDone.text(), contentDone.arguments());
            return false;
        }
        if (delta instanceof Delta.ItemDone itemDone) {
            ItemState item = items.get(itemDone.itemId());
            checkAdvisory(item, itemDone.text(), itemDone.arguments());
            item.state = OutputItemState.DONE;
            LOGGER.debug("Item {} done", item.id);
            return true;
        }
        if (delta instanceof Delta.ResponseCompleted completed) {
            if (completed.usage() != null) {
                usage = completed.usage();
            }
            if (completed.status() != null) {
                status = completed.status();
            }
            complete = true;
            LOGGER.debug("Response {} completed", responseId);
            return true;
        }
        return false;
    }

    private static void checkAdvisory(ItemState item, @Nullable String text, @Nullable String arguments) {
        if (text != null && !text.contentEquals(item.text)) {
            LOGGER.debug("Advisory text of item {} differs from the streamed text, keeping the streamed text", item.id);
        }
        if (arguments != null && !arguments.contentEquals(item.arguments)) {
            LOGGER.debug("Advisory arguments of item {} differ from the streamed arguments, keeping the streamed arguments", item.id);
        }
    }

    private static @Nullable String itemIdOf(Delta delta) {
        if (delta instanceof Delta.TextDelta text) {
            return text.itemId();
        } else if (delta instanceof Delta.ArgumentsDelta arguments) {
            return arguments.itemId();
        } else if (delta instanceof Delta.ContentDone contentDone) {
            return contentDone.itemId();
        } else if (delta instanceof Delta.ItemDone itemDone) {
            return itemDone.itemId();
        }
        return null;
    }

    private static String describe(Delta delta) {
        return delta.getClass().getSimpleName();
    }

    private static final class ItemState {
        private final String id;
        private final OutputItemType type;
        private final String rawType;
        private final @Nullable String name;
        private final @Nullable String callId;
        private final int outputIndex;
        private final StringBuilder text = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();
        private OutputItemState state = OutputItemState.PENDING;

        private ItemState(Delta.ItemAdded added) {
            this.id = added.itemId();
            this.type = added.type();
            this.rawType = added.rawType();
            this.name = added.name();
            this.callId = added.callId();
            this.outputIndex = added.outputIndex();
        }

        private OutputItem toOutputItem() {
            return new OutputItem(id, type, rawType, state, text.toString(), arguments.toString(), name, callId, outputIndex);
        }
    }
}
