package io.openaikit.client.http.sse;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * One dispatched server-sent event: the event name, the joined {@code data} lines and the
 * last event id seen on the stream.
 */
public final class DataEvent extends Event {

    private final String name;
    private final String data;
    private final String lastEventId;
    private final @Nullable Long retry;

    public DataEvent(String name, String data, String lastEventId) {
        this(name, data, lastEventId, null);
    }

    public DataEvent(String name, String data, String lastEventId, @Nullable Long retry) {
        this.name = name;
        this.data = data;
        this.lastEventId = lastEventId;
        this.retry = retry;
    }

    public String getName() {
        return name;
    }

    public String getData() {
        return data;
    }

    public String getLastEventId() {
        return lastEventId;
    }

    /**
     * @return the reconnection time in milliseconds last announced by the server, if any
     */
    public @Nullable Long getRetry() {
        return retry;
    }

    @Override
    public Type getType() {
        return Type.DATA;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataEvent)) {
            return false;
        }
        DataEvent that = (DataEvent) o;
        return name.equals(that.name) && data.equals(that.data)
                && lastEventId.equals(that.lastEventId) && Objects.equals(retry, that.retry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, data, lastEventId, retry);
    }

    @Override
    public String toString() {
        return "DataEvent{name='" + name + "', data='" + data + "', lastEventId='" + lastEventId + "'}";
    }
}
