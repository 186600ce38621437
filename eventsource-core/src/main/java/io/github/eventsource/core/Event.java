package io.github.eventsource.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A single dispatched event of an event stream.
 *
 * <p>{@code data} holds the payload of all {@code data} lines of the event joined with
 * {@code '\n'}, without a trailing separator. {@code retry} is present only when the event itself
 * carried a valid {@code retry} directive.
 *
 * @param id the event id, inherited from the previous event when the wire omitted it
 * @param name the event name, empty when unset
 * @param data the raw payload bytes
 * @param retry the reconnection delay requested by the server
 */
public record Event(String id, String name, byte[] data, Optional<Duration> retry) {

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        data = Objects.requireNonNull(data, "data").clone();
        retry = (retry == null) ? Optional.empty() : retry;
    }

    public Event(String id, String name, byte[] data) {
        this(id, name, data, Optional.empty());
    }

    public Event(String id, String name, String data) {
        this(id, name, data.getBytes(StandardCharsets.UTF_8), Optional.empty());
    }

    /**
     * Returns a copy of the payload bytes.
     *
     * @return the payload
     */
    @Override
    public byte[] data() {
        return data.clone();
    }

    /**
     * Returns a copy of this event carrying the given retry directive.
     *
     * @param retry the reconnection delay
     * @return a new event
     */
    public Event withRetry(Duration retry) {
        return new Event(id, name, data, Optional.of(retry));
    }

    /**
     * Decodes {@link #data()} as UTF-8.
     *
     * @return the payload as text
     */
    public String dataAsString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    /**
     * Encodes this event in its wire form.
     *
     * @return the encoded event, terminated by a blank line
     */
    public String encode() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + 32);
        try {
            writeTo(out);
        } catch (IOException e) {
            throw new IllegalStateException("in-memory write failed", e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Writes the wire form of this event to {@code destination}.
     *
     * <p>Each {@code '\n'}-separated fragment of the payload goes on its own {@code data} line;
     * empty fragments are written as a bare {@code data} token.
     *
     * @param destination the stream to write to
     * @throws IOException if the destination fails
     */
    public void writeTo(OutputStream destination) throws IOException {
        writeField(destination, Protocol.F_ID, id.getBytes(StandardCharsets.UTF_8));
        writeField(destination, Protocol.F_EVENT, name.getBytes(StandardCharsets.UTF_8));
        if (retry.isPresent()) {
            String millis = Long.toString(retry.get().toMillis());
            writeField(destination, Protocol.F_RETRY, millis.getBytes(StandardCharsets.US_ASCII));
        }

        int start = 0;
        for (int i = 0; i <= data.length; i++) {
            if (i == data.length || data[i] == Protocol.LF) {
                byte[] fragment = Arrays.copyOfRange(data, start, i);
                if (fragment.length == 0) {
                    destination.write(Protocol.F_DATA.getBytes(StandardCharsets.US_ASCII));
                    destination.write(Protocol.LF);
                } else {
                    writeField(destination, Protocol.F_DATA, fragment);
                }
                start = i + 1;
            }
        }

        destination.write(Protocol.LF);
    }

    private static void writeField(OutputStream out, String field, byte[] value) throws IOException {
        out.write(field.getBytes(StandardCharsets.US_ASCII));
        out.write(Protocol.COLON);
        out.write(' ');
        out.write(value);
        out.write(Protocol.LF);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event other = (Event) o;
        return id.equals(other.id)
                && name.equals(other.name)
                && Arrays.equals(data, other.data)
                && retry.equals(other.retry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, Arrays.hashCode(data), retry);
    }

    @Override
    public String toString() {
        return "Event{id='" + id + "', name='" + name + "', data='" + dataAsString() + "'"
                + retry.map(r -> ", retry=" + r.toMillis() + "ms").orElse("") + "}";
    }
}
