package io.github.eventsource.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Incremental event stream parser.
 *
 * <p>Each call to {@link #next()} consumes lines until a blank line dispatches an event. The parser
 * keeps only the event being assembled and the id of the last event that carried one; it does not
 * own the underlying stream and never closes it.
 *
 * <p>Lines are terminated by {@code '\n'}; a {@code '\r'} right before it is part of the
 * terminator. Field names and the {@code id} and {@code event} values are decoded as UTF-8,
 * {@code data} values are kept as raw bytes.
 *
 * <p>Instances are not thread-safe.
 */
public final class EventParser {

    private static final int BUFFER_SIZE = 8192;

    /** Longest digit run that always fits in a {@code long}. */
    private static final int MAX_RETRY_DIGITS = 18;

    private final InputStream in;
    private final byte[] buf = new byte[BUFFER_SIZE];
    private int pos;
    private int limit;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(128);

    private String lastId;

    /**
     * Creates a new parser reading from the given input stream.
     *
     * @param is the input stream to read from
     */
    public EventParser(InputStream is) {
        this(is, "");
    }

    /**
     * Creates a new parser whose events inherit {@code lastId} until the stream sets one.
     *
     * @param is the input stream to read from
     * @param lastId the id given to events that omit the {@code id} field
     */
    public EventParser(InputStream is, String lastId) {
        this.in = Objects.requireNonNull(is, "is");
        this.lastId = Objects.requireNonNull(lastId, "lastId");
    }

    /**
     * Reads the next event from the stream.
     *
     * <p>Events without data are dropped. An event that is still being assembled when the stream
     * ends is discarded.
     *
     * @return the next event, or {@code null} if EOF is reached
     * @throws IOException if reading the stream fails
     */
    public Event next() throws IOException {
        String id = null;
        boolean idPresent = false;
        String name = "";
        Duration retry = null;
        ByteArrayOutputStream data = new ByteArrayOutputStream();

        byte[] l;
        while ((l = readLine()) != null) {
            if (l.length == 0) {
                if (data.size() == 0) {
                    id = null;
                    idPresent = false;
                    name = "";
                    retry = null;
                    continue;
                }

                if (idPresent) {
                    lastId = id;
                }
                byte[] payload = data.toByteArray();
                return new Event(
                        lastId,
                        name,
                        Arrays.copyOf(payload, payload.length - 1),
                        Optional.ofNullable(retry));
            }

            if (l[0] == Protocol.COLON) {
                continue;
            }

            int colon = indexOf(l, Protocol.COLON);
            String field;
            int valueStart;
            if (colon < 0) {
                field = new String(l, StandardCharsets.UTF_8);
                valueStart = l.length;
            } else {
                field = new String(l, 0, colon, StandardCharsets.UTF_8);
                valueStart = colon + 1;
                // only a single leading space is part of the separator
                if (valueStart < l.length && l[valueStart] == ' ') {
                    valueStart++;
                }
            }

            switch (field) {
                case Protocol.F_ID -> {
                    idPresent = true;
                    id = new String(l, valueStart, l.length - valueStart, StandardCharsets.UTF_8);
                }
                case Protocol.F_EVENT -> name = new String(l, valueStart, l.length - valueStart, StandardCharsets.UTF_8);
                case Protocol.F_DATA -> {
                    data.write(l, valueStart, l.length - valueStart);
                    data.write(Protocol.LF);
                }
                case Protocol.F_RETRY -> {
                    Duration parsed = parseRetry(l, valueStart);
                    if (parsed != null) {
                        retry = parsed;
                    }
                }
                default -> {
                    // unknown fields are ignored
                }
            }
        }
        return null;
    }

    /**
     * Returns the id that the next event inherits when it has no {@code id} field.
     *
     * @return the last seen event id, possibly empty
     */
    public String lastId() {
        return lastId;
    }

    private byte[] readLine() throws IOException {
        line.reset();
        while (true) {
            if (pos == limit) {
                int n = in.read(buf);
                if (n < 0) {
                    return null;
                }
                pos = 0;
                limit = n;
                continue;
            }

            int start = pos;
            while (pos < limit && buf[pos] != Protocol.LF) {
                pos++;
            }
            line.write(buf, start, pos - start);
            if (pos < limit) {
                pos++;
                byte[] out = line.toByteArray();
                if (out.length > 0 && out[out.length - 1] == Protocol.CR) {
                    return Arrays.copyOf(out, out.length - 1);
                }
                return out;
            }
        }
    }

    private static Duration parseRetry(byte[] l, int from) {
        int digits = l.length - from;
        if (digits == 0 || digits > MAX_RETRY_DIGITS) {
            return null;
        }
        long millis = 0;
        for (int i = from; i < l.length; i++) {
            if (l[i] < '0' || l[i] > '9') {
                return null;
            }
            millis = millis * 10 + (l[i] - '0');
        }
        return Duration.ofMillis(millis);
    }

    private static int indexOf(byte[] l, char c) {
        for (int i = 0; i < l.length; i++) {
            if (l[i] == c) {
                return i;
            }
        }
        return -1;
    }
}
