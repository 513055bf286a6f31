package io.openaikit.client.http.sse;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incremental server-sent events decoder.
 * <p>
 * Bytes are pushed in arbitrary chunks through {@link #feed(byte[], int, int)}; complete events
 * are handed to the consumer as soon as their terminating blank line arrives. Lines are split
 * on raw bytes and only decoded once complete, so a multi-byte UTF-8 sequence or a
 * {@code \r\n} pair split across two chunks decodes the same as if it arrived in one.
 * Not thread-safe.
 */
public class SSEDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(SSEDecoder.class);

    private static final String UTF8_BOM = "\uFEFF";

    private static final String DEFAULT_EVENT_NAME = "message";

    private static final byte LF = '\n';
    private static final byte CR = '\r';

    private final Consumer<Event> eventConsumer;

    private byte[] line = new byte[256];
    private int lineLength;
    private boolean skipNextLineFeed;
    private boolean firstLine = true;

    private String currentEventName = DEFAULT_EVENT_NAME;
    private final StringBuilder dataBuffer = new StringBuilder();
    private boolean hasData;
    private String lastEventId = "";
    private @Nullable Long retry;

    public SSEDecoder(Consumer<Event> eventConsumer) {
        this.eventConsumer = eventConsumer;
    }

    public void feed(byte[] chunk) {
        feed(chunk, 0, chunk.length);
    }

    public void feed(byte[] chunk, int offset, int length) {
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            byte b = chunk[i];
            if (skipNextLineFeed) {
                skipNextLineFeed = false;
                if (b == LF) {
                    continue;
                }
            }
            if (b == LF) {
                processLine();
            } else if (b == CR) {
                processLine();
                skipNextLineFeed = true;
            } else {
                append(b);
            }
        }
    }

    /**
     * Signals end of input. A trailing line without terminator is processed, and data still
     * pending without its blank line is dispatched.
     */
    public void finish() {
        if (lineLength > 0) {
            processLine();
        }
        dispatch();
        skipNextLineFeed = false;
    }

    public String getLastEventId() {
        return lastEventId;
    }

    private void append(byte b) {
        if (lineLength == line.length) {
            line = Arrays.copyOf(line, line.length * 2);
        }
        line[lineLength++] = b;
    }

    private void processLine() {
        String text = new String(line, 0, lineLength, StandardCharsets.UTF_8);
        lineLength = 0;
        if (firstLine) {
            firstLine = false;
            if (text.startsWith(UTF8_BOM)) {
                text = text.substring(UTF8_BOM.length());
            }
        }
        LOG.trace("got line `{}`", text);

        if (text.isEmpty()) {
            dispatch();
        } else if (text.charAt(0) == ':') {
            eventConsumer.accept(new CommentEvent(text.substring(1).trim()));
        } else {
            int colon = text.indexOf(':');
            if (colon >= 0) {
                handleFieldValue(text.substring(0, colon), stripLeadingSpaceIfPresent(text.substring(colon + 1)));
            } else {
                handleFieldValue(text, "");
            }
        }
    }

    private void handleFieldValue(String fieldName, String value) {
        switch (fieldName) {
            case "event":
                currentEventName = value.isEmpty() ? DEFAULT_EVENT_NAME : value;
                break;
            case "data":
                dataBuffer.append(value).append('\n');
                hasData = true;
                break;
            case "id":
                if (!value.contains("\0")) {
                    lastEventId = value;
                }
                break;
            case "retry":
                if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
                    try {
                        retry = Long.parseLong(value);
                    } catch (NumberFormatException e) {
                        LOG.debug("ignoring out of range retry field `{}`", value);
                    }
                }
                break;
            default:
                LOG.trace("ignoring unknown field `{}`", fieldName);
                break;
        }
    }

    private void dispatch() {
        if (hasData) {
            // drop the newline appended after the last data line
            dataBuffer.setLength(dataBuffer.length() - 1);
            LOG.debug("broadcasting new event named {} lastEventId is {}", currentEventName, lastEventId);
            eventConsumer.accept(new DataEvent(currentEventName, dataBuffer.toString(), lastEventId, retry));
        }
        dataBuffer.setLength(0);
        hasData = false;
        currentEventName = DEFAULT_EVENT_NAME;
    }

    private static String stripLeadingSpaceIfPresent(String field) {
        if (!field.isEmpty() && field.charAt(0) == ' ') {
            return field.substring(1);
        }
        return field;
    }
}
