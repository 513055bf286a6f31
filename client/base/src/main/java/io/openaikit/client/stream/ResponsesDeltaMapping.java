package io.openaikit.client.stream;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import io.openaikit.client.http.sse.Frame;
import io.openaikit.spec.OutputItemType;
import io.openaikit.spec.StreamEventKind;
import io.openaikit.spec.Usage;
import io.openaikit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeltaMapping} for the Responses API ({@code /responses}).
 * <p>
 * Events are recognised by their kind tag through {@link StreamEventKind}; kinds that carry no
 * visible change, and kinds this mapping does not know, produce no deltas. The {@code .done}
 * events of text and argument streams are advisory.
 */
public class ResponsesDeltaMapping implements DeltaMapping {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponsesDeltaMapping.class);

    public static final Factory FACTORY = ResponsesDeltaMapping::new;

    @Override
    public List<Delta> map(Frame frame) throws ProtocolViolationException {
        JsonNode payload = frame.payload();
        if (payload == null || !payload.isObject()) {
            throw new ProtocolViolationException("Frame of kind '" + frame.kind() + "' has no JSON object payload");
        }

        StreamEventKind kind = StreamEventKind.fromTag(frame.kind());
        switch (kind) {
            case RESPONSE_CREATED:
            case RESPONSE_IN_PROGRESS: {
                JsonNode response = payload.get("response");
                return List.of(new Delta.ResponseStarted(
                        Utils.text(response, "id"), Utils.text(response, "model"), Utils.text(response, "status")));
            }
            case OUTPUT_ITEM_ADDED: {
                JsonNode item = requireObject(payload, "item", frame);
                return itemAdded(item, outputIndex(payload), frame);
            }
            case OUTPUT_TEXT_DELTA:
            case REFUSAL_DELTA:
            case REASONING_TEXT_DELTA:
            case REASONING_SUMMARY_TEXT_DELTA:
                return List.of(new Delta.TextDelta(requireText(payload, "item_id", frame), fragment(payload)));
            case FUNCTION_CALL_ARGUMENTS_DELTA:
                return List.of(new Delta.ArgumentsDelta(requireText(payload, "item_id", frame), fragment(payload)));
            case OUTPUT_TEXT_DONE:
                return List.of(new Delta.ContentDone(requireText(payload, "item_id", frame), Utils.text(payload, "text"), null));
            case FUNCTION_CALL_ARGUMENTS_DONE:
                return List.of(new Delta.ContentDone(requireText(payload, "item_id", frame), null, Utils.text(payload, "arguments")));
            case OUTPUT_ITEM_DONE: {
                JsonNode item = requireObject(payload, "item", frame);
                return List.of(new Delta.ItemDone(requireText(item, "id", frame), itemText(item), Utils.text(item, "arguments")));
            }
            case RESPONSE_COMPLETED:
            case RESPONSE_INCOMPLETE:
            case RESPONSE_DONE: {
                JsonNode response = payload.get("response");
                return List.of(new Delta.ResponseCompleted(
                        Usage.fromJson(response == null ? null : response.get("usage")), Utils.text(response, "status")));
            }
            case RESPONSE_FAILED: {
                JsonNode response = payload.get("response");
                JsonNode error = response == null ? null : response.get("error");
                return List.of(streamError(error, "Response failed"));
            }
            case ERROR:
                return List.of(streamError(payload.has("error") ? payload.get("error") : payload, "Stream error"));
            default:
                LOGGER.trace("No deltas for frame of kind {}", frame.kind());
                return List.of();
        }
    }

    @Override
    public List<Delta> mapComplete(JsonNode body) throws ProtocolViolationException {
        if (body == null || !body.isObject()) {
            throw new ProtocolViolationException("Response body is not a JSON object");
        }
        if (body.has("error") && body.get("error").isObject()) {
            return List.of(streamError(body.get("error"), "Response failed"));
        }

        List<Delta> deltas = new ArrayList<>();
        deltas.add(new Delta.ResponseStarted(Utils.text(body, "id"), Utils.text(body, "model"), Utils.text(body, "status")));

        JsonNode output = body.get("output");
        if (output != null && output.isArray()) {
            for (int i = 0; i < output.size(); i++) {
                JsonNode item = output.get(i);
                String id = Utils.text(item, "id");
                if (id == null) {
                    id = "item-" + i;
                }
                String rawType = Utils.defaultIfNull(Utils.text(item, "type"), "unknown");
                OutputItemType type = OutputItemType.fromServerType(rawType);
                deltas.add(new Delta.ItemAdded(id, type, rawType, Utils.text(item, "name"), Utils.text(item, "call_id"), i));

                String text = itemText(item);
                if (text != null && !text.isEmpty()) {
                    deltas.add(new Delta.TextDelta(id, text));
                }
                String arguments = Utils.text(item, "arguments");
                if (arguments != null && !arguments.isEmpty()) {
                    deltas.add(new Delta.ArgumentsDelta(id, arguments));
                }
                deltas.add(new Delta.ItemDone(id, null, null));
            }
        }

        deltas.add(new Delta.ResponseCompleted(Usage.fromJson(body.get("usage")), Utils.text(body, "status")));
        return deltas;
    }

    private static List<Delta> itemAdded(JsonNode item, int outputIndex, Frame frame) throws ProtocolViolationException {
        String id = requireText(item, "id", frame);
        String rawType = Utils.defaultIfNull(Utils.text(item, "type"), "unknown");
        Delta.ItemAdded added = new Delta.ItemAdded(id, OutputItemType.fromServerType(rawType), rawType,
                Utils.text(item, "name"), Utils.text(item, "call_id"), outputIndex);

        String arguments = Utils.text(item, "arguments");
        if (arguments != null && !arguments.isEmpty()) {
            return List.of(added, new Delta.ArgumentsDelta(id, arguments));
        }
        return List.of(added);
    }

    /**
     * Text carried by an item: message content parts ({@code output_text}, {@code refusal}), or
     * the summary and content of a reasoning item. A plain string content is accepted as well.
     */
    static @Nullable String itemText(JsonNode item) {
        StringBuilder sb = new StringBuilder();
        boolean found = false;
        for (String field : new String[] {"summary", "content"}) {
            JsonNode node = item.get(field);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isTextual()) {
                sb.append(node.asText());
                found = true;
            } else if (node.isArray()) {
                for (JsonNode part : node) {
                    if (part.isTextual()) {
                        sb.append(part.asText());
                        found = true;
                    } else if (part.isObject()) {
                        String text = Utils.text(part, "text");
                        if (text == null) {
                            text = Utils.text(part, "refusal");
                        }
                        if (text != null) {
                            sb.append(text);
                            found = true;
                        }
                    }
                }
            }
        }
        return found ? sb.toString() : null;
    }

    private static Delta.StreamError streamError(@Nullable JsonNode error, String fallback) {
        String message = Utils.text(error, "message");
        return new Delta.StreamError(Utils.text(error, "code"), message == null || message.isEmpty() ? fallback : message);
    }

    private static int outputIndex(JsonNode payload) {
        Integer index = Utils.integer(payload, "output_index");
        return index == null ? 0 : index;
    }

    private static String fragment(JsonNode payload) {
        return Utils.defaultIfNull(Utils.text(payload, "delta"), "");
    }

    private static JsonNode requireObject(JsonNode node, String field, Frame frame) throws ProtocolViolationException {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new ProtocolViolationException("Frame of kind '" + frame.kind() + "' is missing object '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field, Frame frame) throws ProtocolViolationException {
        String value = Utils.text(node, field);
        if (value == null || value.isEmpty()) {
            throw new ProtocolViolationException("Frame of kind '" + frame.kind() + "' is missing '" + field + "'");
        }
        return value;
    }
}
