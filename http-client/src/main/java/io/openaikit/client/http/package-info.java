/**
 * Pluggable HTTP transport for the OpenAIKit runtime.
 *
 * <p>{@link io.openaikit.client.http.HttpClient} issues requests relative to a base URL and
 * returns {@link io.openaikit.client.http.HttpResponse} values that expose either a complete
 * body or a readable stream. Streamed responses are split into frames by the
 * {@link io.openaikit.client.http.sse} package.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("https://api.openai.com/v1");
 * RequestEnvelope envelope = RequestEnvelope.post("/responses", body)
 *     .withHeader("Authorization", "Bearer " + apiKey)
 *     .withStreaming(true);
 *
 * try (HttpResponse response = client.send(envelope).join();
 *      FrameDecoder frames = response.bodyAsFrames(CancellationToken.none())) {
 *     Frame frame;
 *     while ((frame = frames.next()) != null) {
 *         System.out.println(frame.kind());
 *     }
 * }
 * }</pre>
 *
 * <p>The default implementation is backed by the JDK {@link java.net.http.HttpClient}; other
 * implementations can be plugged in through {@link io.openaikit.client.http.HttpClientBuilder}.
 */
@NullMarked
package io.openaikit.client.http;

import org.jspecify.annotations.NullMarked;
