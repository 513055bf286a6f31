package io.openaikit.client.stream;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import io.openaikit.client.http.sse.Frame;

/**
 * Translates the wire events of one endpoint family into {@link Delta}s.
 * <p>
 * A mapping belongs to a single response and may keep state across frames, for example to
 * resolve tool-call fragments that only carry an index. Obtain a fresh instance per call from
 * a {@link Factory}.
 */
public interface DeltaMapping {

    /**
     * @param frame a well-formed frame
     * @return the deltas it carries, empty for frames with no visible effect or of unknown kind
     * @throws ProtocolViolationException if the frame lacks fields its kind requires
     */
    List<Delta> map(Frame frame) throws ProtocolViolationException;

    /**
     * @param body a complete, non-streamed response body
     * @return the deltas that rebuild the whole response
     * @throws ProtocolViolationException if the body is not a response of this family
     */
    List<Delta> mapComplete(JsonNode body) throws ProtocolViolationException;

    /**
     * Forgets the state changes made by the last successful {@link #map(Frame)}, because its
     * deltas were rejected. A {@code map} call that throws leaves the state untouched itself.
     * Stateless mappings need not override this.
     */
    default void rollback() {
    }

    @FunctionalInterface
    interface Factory {
        DeltaMapping create();
    }
}
