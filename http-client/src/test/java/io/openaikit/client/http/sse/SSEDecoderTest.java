package io.openaikit.client.http.sse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class SSEDecoderTest {

    private static List<Event> decode(byte[] bytes, int... splits) {
        List<Event> events = new ArrayList<>();
        SSEDecoder decoder = new SSEDecoder(events::add);
        int start = 0;
        for (int split : splits) {
            decoder.feed(bytes, start, split - start);
            start = split;
        }
        decoder.feed(bytes, start, bytes.length - start);
        decoder.finish();
        return events;
    }

    private static List<DataEvent> dataEvents(List<Event> events) {
        List<DataEvent> result = new ArrayList<>();
        for (Event event : events) {
            if (event instanceof DataEvent) {
                result.add((DataEvent) event);
            }
        }
        return result;
    }

    @Test
    public void testMultipleDataLinesAreJoined() {
        byte[] bytes = "event: delta\ndata: first\ndata:second\nid: 7\n\n".getBytes(StandardCharsets.UTF_8);

        List<DataEvent> events = dataEvents(decode(bytes));

        assertEquals(1, events.size());
        assertEquals(new DataEvent("delta", "first\nsecond", "7"), events.get(0));
    }

    @Test
    public void testAllLineEndingsAreAccepted() {
        byte[] lf = "data: a\n\ndata: b\n\n".getBytes(StandardCharsets.UTF_8);
        byte[] crlf = "data: a\r\n\r\ndata: b\r\n\r\n".getBytes(StandardCharsets.UTF_8);
        byte[] cr = "data: a\r\rdata: b\r\r".getBytes(StandardCharsets.UTF_8);

        List<DataEvent> expected = dataEvents(decode(lf));
        assertEquals(2, expected.size());
        assertEquals(expected, dataEvents(decode(crlf)));
        assertEquals(expected, dataEvents(decode(cr)));
    }

    @Test
    public void testEverySplitYieldsTheSameEvents() {
        // "é" and "€" are multi-byte, the stream mixes \r\n and \n
        byte[] bytes = ("\uFEFF: keep-alive\r\n\r\nevent: response.output_text.delta\r\n"
                + "data: {\"delta\":\"café €\"}\r\n\r\n"
                + "data: {\"n\":2}\n\n").getBytes(StandardCharsets.UTF_8);

        List<Event> whole = decode(bytes);
        List<DataEvent> expected = dataEvents(whole);
        assertEquals(2, expected.size());
        assertEquals("{\"delta\":\"café €\"}", expected.get(0).getData());

        for (int i = 1; i < bytes.length; i++) {
            assertEquals(expected, dataEvents(decode(bytes, i)), "split at " + i);
        }
        for (int i = 1; i < bytes.length - 1; i++) {
            assertEquals(expected, dataEvents(decode(bytes, i, i + 1)), "split at " + i + " and " + (i + 1));
        }
    }

    @Test
    public void testLeadingBomAndCommentsAreHandled() {
        byte[] bytes = "\uFEFF: ping\n\ndata: x\n\n".getBytes(StandardCharsets.UTF_8);

        List<Event> events = decode(bytes);

        assertEquals(2, events.size());
        CommentEvent comment = assertInstanceOf(CommentEvent.class, events.get(0));
        assertEquals("ping", comment.getComment());
        assertEquals("x", assertInstanceOf(DataEvent.class, events.get(1)).getData());
    }

    @Test
    public void testUnknownFieldsAndEmptyEventsAreIgnored() {
        byte[] bytes = "foo: bar\n\nevent: ignored\n\nretry: 1500\ndata: y\n\n".getBytes(StandardCharsets.UTF_8);

        List<DataEvent> events = dataEvents(decode(bytes));

        assertEquals(1, events.size());
        assertEquals("message", events.get(0).getName());
        assertEquals(Long.valueOf(1500L), events.get(0).getRetry());
    }

    @Test
    public void testPendingDataIsDispatchedAtEndOfInput() {
        List<Event> events = new ArrayList<>();
        SSEDecoder decoder = new SSEDecoder(events::add);

        decoder.feed("data: tail".getBytes(StandardCharsets.UTF_8));
        assertTrue(events.isEmpty());

        decoder.finish();
        assertEquals("tail", assertInstanceOf(DataEvent.class, events.get(0)).getData());
    }
}
