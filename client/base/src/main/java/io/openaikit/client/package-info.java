/**
 * OpenAIKit client runtime.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * OpenAIKitClient client = new OpenAIKitClient(ClientConfig.builder()
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .build());
 *
 * RequestEnvelope envelope = RequestEnvelope.post("/responses",
 *         "{\"model\":\"gpt-4o\",\"input\":\"Say hello\",\"stream\":true}")
 *     .withStreaming(true);
 *
 * CancellationToken token = CancellationToken.none();
 * try (ResultStream results = client.stream(envelope, ResponsesDeltaMapping.FACTORY, token).join()) {
 *     results.forEachRemaining(result -> System.out.println(result.text()));
 * }
 * }</pre>
 *
 * @see io.openaikit.client.OpenAIKitClient
 * @see io.openaikit.client.ClientConfig
 */
@NullMarked
package io.openaikit.client;

import org.jspecify.annotations.NullMarked;
