package io.openaikit.client.stream;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.openaikit.client.http.sse.Frame;
import io.openaikit.spec.OutputItemType;
import io.openaikit.spec.Usage;
import io.openaikit.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * {@link DeltaMapping} for chat-completion chunks ({@code /chat/completions}).
 * <p>
 * Every choice becomes one {@code MESSAGE} item with id {@code <chunk id>:choice-<index>}.
 * Tool calls become {@code TOOL_CALL} items keyed by their call id; later fragments, which
 * only carry the tool call index, are resolved through the index seen with the id. A
 * {@code finish_reason} marks the choice and its tool calls done, and a {@code usage} object
 * completes the response.
 */
public class ChatCompletionDeltaMapping implements DeltaMapping {

    public static final Factory FACTORY = ChatCompletionDeltaMapping::new;

    private static final String DEFAULT_ID = "chatcmpl";

    private State state = new State();
    private @Nullable State beforeLastFrame;

    @Override
    public List<Delta> map(Frame frame) throws ProtocolViolationException {
        JsonNode chunk = frame.payload();
        if (chunk == null || !chunk.isObject()) {
            throw new ProtocolViolationException("Chat completion chunk is not a JSON object");
        }
        if (chunk.has("error") && chunk.get("error").isObject()) {
            beforeLastFrame = null;
            return List.of(streamError(chunk.get("error")));
        }

        State before = state.copy();
        try {
            List<Delta> deltas = mapChunk(chunk);
            beforeLastFrame = before;
            return deltas;
        } catch (ProtocolViolationException | RuntimeException e) {
            state = before;
            throw e;
        }
    }

    @Override
    public void rollback() {
        if (beforeLastFrame != null) {
            state = beforeLastFrame;
            beforeLastFrame = null;
        }
    }

    private List<Delta> mapChunk(JsonNode chunk) throws ProtocolViolationException {
        List<Delta> deltas = new ArrayList<>();
        String responseId = state.responseId;
        if (responseId == null) {
            responseId = Utils.defaultIfNull(Utils.text(chunk, "id"), DEFAULT_ID);
            state.responseId = responseId;
            deltas.add(new Delta.ResponseStarted(responseId, Utils.text(chunk, "model"), "in_progress"));
        }

        JsonNode choiceArray = chunk.get("choices");
        if (choiceArray != null && choiceArray.isArray()) {
            for (int position = 0; position < choiceArray.size(); position++) {
                JsonNode choice = choiceArray.get(position);
                Integer index = Utils.integer(choice, "index");
                ChoiceState choiceState = choice(index == null ? position : index, deltas);
                JsonNode delta = choice.get("delta");

                String content = Utils.text(delta, "content");
                if (content != null && !content.isEmpty()) {
                    deltas.add(new Delta.TextDelta(choiceState.itemId, content));
                }
                String refusal = Utils.text(delta, "refusal");
                if (refusal != null && !refusal.isEmpty()) {
                    deltas.add(new Delta.TextDelta(choiceState.itemId, refusal));
                }
                toolCallFragments(choiceState, delta == null ? null : delta.get("tool_calls"), deltas);

                if (Utils.text(choice, "finish_reason") != null && !choiceState.done) {
                    choiceState.done = true;
                    for (String toolId : choiceState.toolIds.values()) {
                        deltas.add(new Delta.ItemDone(toolId, null, null));
                    }
                    deltas.add(new Delta.ItemDone(choiceState.itemId, null, null));
                }
            }
        }

        JsonNode usage = chunk.get("usage");
        if (usage != null && usage.isObject()) {
            deltas.add(new Delta.ResponseCompleted(Usage.fromJson(usage), "completed"));
        }
        return deltas;
    }

    @Override
    public List<Delta> mapComplete(JsonNode body) throws ProtocolViolationException {
        if (body == null || !body.isObject()) {
            throw new ProtocolViolationException("Chat completion body is not a JSON object");
        }
        if (body.has("error") && body.get("error").isObject()) {
            return List.of(streamError(body.get("error")));
        }

        List<Delta> deltas = new ArrayList<>();
        state.responseId = Utils.defaultIfNull(Utils.text(body, "id"), DEFAULT_ID);
        deltas.add(new Delta.ResponseStarted(state.responseId, Utils.text(body, "model"), "in_progress"));

        JsonNode choiceArray = body.get("choices");
        if (choiceArray != null && choiceArray.isArray()) {
            for (int position = 0; position < choiceArray.size(); position++) {
                JsonNode choice = choiceArray.get(position);
                Integer index = Utils.integer(choice, "index");
                ChoiceState choiceState = choice(index == null ? position : index, deltas);
                JsonNode message = choice.get("message");

                String content = Utils.text(message, "content");
                if (content != null && !content.isEmpty()) {
                    deltas.add(new Delta.TextDelta(choiceState.itemId, content));
                }
                toolCallFragments(choiceState, message == null ? null : message.get("tool_calls"), deltas);
                for (String toolId : choiceState.toolIds.values()) {
                    deltas.add(new Delta.ItemDone(toolId, null, null));
                }
                deltas.add(new Delta.ItemDone(choiceState.itemId, null, null));
                choiceState.done = true;
            }
        }

        deltas.add(new Delta.ResponseCompleted(Usage.fromJson(body.get("usage")), "completed"));
        return deltas;
    }

    private ChoiceState choice(int index, List<Delta> deltas) {
        ChoiceState choiceState = state.choices.get(index);
        if (choiceState == null) {
            choiceState = new ChoiceState(state.responseId + ":choice-" + index);
            state.choices.put(index, choiceState);
            deltas.add(new Delta.ItemAdded(choiceState.itemId, OutputItemType.MESSAGE, "message", null, null,
                    state.nextOutputIndex++));
        }
        return choiceState;
    }

    private void toolCallFragments(ChoiceState choiceState, @Nullable JsonNode toolCalls, List<Delta> deltas)
            throws ProtocolViolationException {
        if (toolCalls == null || !toolCalls.isArray()) {
            return;
        }
        for (int position = 0; position < toolCalls.size(); position++) {
            JsonNode toolCall = toolCalls.get(position);
            Integer index = Utils.integer(toolCall, "index");
            int toolIndex = index == null ? position : index;
            JsonNode function = toolCall.get("function");

            String id = Utils.text(toolCall, "id");
            if (id != null && !id.isEmpty() && !id.equals(choiceState.toolIds.get(toolIndex))) {
                choiceState.toolIds.put(toolIndex, id);
                String rawType = Utils.defaultIfNull(Utils.text(toolCall, "type"), "function");
                deltas.add(new Delta.ItemAdded(id, OutputItemType.TOOL_CALL, rawType,
                        Utils.text(function, "name"), id, state.nextOutputIndex++));
            } else {
                id = choiceState.toolIds.get(toolIndex);
                if (id == null) {
                    throw new ProtocolViolationException("Tool call fragment at index " + toolIndex + " has no known id");
                }
            }

            String arguments = Utils.text(function, "arguments");
            if (arguments != null && !arguments.isEmpty()) {
                deltas.add(new Delta.ArgumentsDelta(id, arguments));
            }
        }
    }

    private static Delta.StreamError streamError(JsonNode error) {
        String message = Utils.text(error, "message");
        return new Delta.StreamError(Utils.text(error, "code"), message == null || message.isEmpty() ? "Stream error" : message);
    }

    /**
     * Everything the mapping remembers between chunks; copied before each chunk so that a
     * rejected chunk can be undone.
     */
    private static final class State {
        private final Map<Integer, ChoiceState> choices = new HashMap<>();
        private @Nullable String responseId;
        private int nextOutputIndex;

        private State copy() {
            State copy = new State();
            copy.responseId = responseId;
            copy.nextOutputIndex = nextOutputIndex;
            for (Map.Entry<Integer, ChoiceState> entry : choices.entrySet()) {
                copy.choices.put(entry.getKey(), entry.getValue().copy());
            }
            return copy;
        }
    }

    private static final class ChoiceState {
        private final String itemId;
        private final Map<Integer, String> toolIds = new LinkedHashMap<>();
        private boolean done;

        private ChoiceState(String itemId) {
            this.itemId = itemId;
        }

        private ChoiceState copy() {
            ChoiceState copy = new ChoiceState(itemId);
            copy.toolIds.putAll(toolIds);
            copy.done = done;
            return copy;
        }
    }
}
