package io.openaikit.client.stream;

import static io.openaikit.client.stream.EventReconstructorTest.frame;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import io.openaikit.client.error.ErrorClassifier;
import io.openaikit.client.http.sse.FrameDecoder;
import io.openaikit.common.CancellationToken;
import io.openaikit.spec.AccumulatedResult;
import io.openaikit.spec.OutputItem;
import io.openaikit.spec.OutputItemState;
import io.openaikit.spec.OutputItemType;
import io.openaikit.util.Utils;
import org.junit.jupiter.api.Test;

public class ChatCompletionDeltaMappingTest {

    @Test
    public void testContentChunks() throws Exception {
        EventReconstructor reconstructor = new EventReconstructor(ChatCompletionDeltaMapping.FACTORY.create());

        reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-1","model":"gpt-4o-mini",
                 "choices":[{"index":0,"delta":{"role":"assistant","content":"Hel"}}]}"""));
        reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-1","choices":[{"index":0,"delta":{"content":"lo"}}]}"""));
        reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-1","choices":[{"index":0,"delta":{},"finish_reason":"stop"}]}"""));
        reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-1","choices":[],
                 "usage":{"prompt_tokens":4,"completion_tokens":2,"total_tokens":6}}"""));

        AccumulatedResult result = reconstructor.snapshot();
        assertEquals("chatcmpl-1", result.responseId());
        assertEquals("gpt-4o-mini", result.model());
        assertEquals("Hello", result.text());
        assertEquals(OutputItemState.DONE, result.item("chatcmpl-1:choice-0").state());
        assertTrue(result.complete());
        assertEquals(4, result.usage().inputTokens());
    }

    @Test
    public void testToolCallFragmentsResolvedByIndex() throws Exception {
        // Given
        EventReconstructor reconstructor = new EventReconstructor(ChatCompletionDeltaMapping.FACTORY.create());

        // When the id and name arrive once, followed by index-only fragments
        reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-2","choices":[{"index":0,"delta":{"tool_calls":[
                  {"index":0,"id":"call_a","type":"function","function":{"name":"get_weather","arguments":""}},
                  {"index":1,"id":"call_b","type":"function","function":{"name":"get_time","arguments":"{"}}]}}]}"""));
        reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-2","choices":[{"index":0,"delta":{"tool_calls":[
                  {"index":0,"function":{"arguments":"{\\"city\\":"}},
                  {"index":1,"function":{"arguments":"}"}}]}}]}"""));
        reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-2","choices":[{"index":0,"delta":{"tool_calls":[
                  {"index":0,"function":{"arguments":"\\"Oslo\\"}"}}]},"finish_reason":"tool_calls"}]}"""));

        // Then
        AccumulatedResult result = reconstructor.snapshot();
        OutputItem weather = result.item("call_a");
        assertEquals(OutputItemType.TOOL_CALL, weather.type());
        assertEquals("get_weather", weather.name());
        assertEquals("call_a", weather.callId());
        assertEquals("{\"city\":\"Oslo\"}", weather.arguments());
        assertEquals(OutputItemState.DONE, weather.state());
        assertEquals("{}", result.item("call_b").arguments());
        assertEquals(3, result.items().size());
    }

    @Test
    public void testFragmentForUnknownToolIndexIsViolation() throws Exception {
        ChatCompletionDeltaMapping mapping = new ChatCompletionDeltaMapping();

        assertThrows(ProtocolViolationException.class, () -> mapping.map(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-3","choices":[{"index":0,"delta":{"tool_calls":[
                  {"index":4,"function":{"arguments":"{}"}}]}}]}""")));
    }

    @Test
    public void testErrorChunk() throws Exception {
        List<Delta> deltas = new ChatCompletionDeltaMapping().map(frame("""
                {"type":"error","error":{"message":"overloaded","code":"server_busy"}}"""));

        Delta.StreamError error = assertInstanceOf(Delta.StreamError.class, deltas.get(0));
        assertEquals("server_busy", error.code());
        assertEquals("overloaded", error.message());
    }

    @Test
    public void testReconstructCompleteChatBody() throws Exception {
        EventReconstructor reconstructor = new EventReconstructor(ChatCompletionDeltaMapping.FACTORY.create());

        AccumulatedResult result = reconstructor.reconstructComplete(Utils.parseJson("""
                {"id":"chatcmpl-4","model":"gpt-4o","choices":[
                  {"index":0,"message":{"role":"assistant","content":"Done.",
                   "tool_calls":[{"id":"call_x","type":"function","function":{"name":"save","arguments":"{}"}}]},
                   "finish_reason":"tool_calls"}],
                 "usage":{"prompt_tokens":1,"completion_tokens":2,"total_tokens":3}}"""));

        assertTrue(result.complete());
        assertEquals("Done.", result.text());
        assertEquals("save", result.item("call_x").name());
        assertEquals(3, result.usage().totalTokens());
    }

    @Test
    public void testSkippedChunkLeavesNoPartialState() {
        // Given a chunk whose tool fragment has no id, so the whole chunk is rejected
        String body = """
                data: {"id":"chatcmpl-5","object":"chat.completion.chunk","choices":[{"index":0,"delta":{"content":"Hi","tool_calls":[{"index":0,"function":{"arguments":"{}"}}]}}]}

                data: {"id":"chatcmpl-5","object":"chat.completion.chunk","choices":[{"index":0,"delta":{"content":" there"}}]}

                data: {"id":"chatcmpl-5","object":"chat.completion.chunk","choices":[{"index":0,"delta":{},"finish_reason":"stop"}]}

                data: [DONE]

                """;
        FrameDecoder frames = new FrameDecoder(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)),
                CancellationToken.none());
        EventReconstructor reconstructor = new EventReconstructor(ChatCompletionDeltaMapping.FACTORY.create(),
                DecodeFailurePolicy.SKIP);

        // When
        AccumulatedResult last = null;
        try (ResultStream results = new ResultStream(frames, reconstructor, new ErrorClassifier(), () -> { })) {
            while (results.hasNext()) {
                last = results.next();
            }
        }

        // Then the later chunks build the message from scratch
        assertEquals(" there", last.text());
        assertEquals(1, last.items().size());
        assertEquals(OutputItemState.DONE, last.item("chatcmpl-5:choice-0").state());
        assertEquals(1, last.violations().size());
    }

    @Test
    public void testChunkRejectedByValidationIsRolledBack() throws Exception {
        // Given
        EventReconstructor reconstructor = new EventReconstructor(ChatCompletionDeltaMapping.FACTORY.create(),
                DecodeFailurePolicy.SKIP);
        reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-6","choices":[{"index":0,"delta":{"tool_calls":[
                  {"index":0,"id":"call_a","type":"function","function":{"name":"lookup","arguments":""}}]}}]}"""));

        // When a second choice reuses an existing call id
        assertThrows(ProtocolViolationException.class, () -> reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-6","choices":[{"index":1,"delta":{"tool_calls":[
                  {"index":0,"id":"call_a","type":"function","function":{"name":"lookup","arguments":""}}]}}]}""")));

        // Then the second choice is unknown to the mapping and starts over on its next chunk
        assertTrue(reconstructor.apply(frame("""
                {"type":"chat.completion.chunk","id":"chatcmpl-6","choices":[{"index":1,"delta":{"content":"ok"}}]}""")));
        AccumulatedResult result = reconstructor.snapshot();
        assertEquals("ok", result.item("chatcmpl-6:choice-1").text());
        assertFalse(result.complete());
    }
}
