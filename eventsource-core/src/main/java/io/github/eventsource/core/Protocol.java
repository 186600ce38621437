package io.github.eventsource.core;

import java.time.Duration;

/**
 * Event stream protocol constants (field names, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings. It only models protocol-level
 * concerns shared by the parser, the encoder and the reconnecting client.
 */
public final class Protocol {
    private Protocol() {}

    // Field names
    public static final String F_ID = "id";
    public static final String F_EVENT = "event";
    public static final String F_DATA = "data";
    public static final String F_RETRY = "retry";

    // HTTP headers
    public static final String H_LAST_EVENT_ID = "Last-Event-ID";
    public static final String H_ACCEPT = "Accept";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONTENT_TYPE = "Content-Type";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";

    public static final String NO_CACHE = "no-cache";

    /** Line separator used on the wire and inside multi-line event data. */
    public static final char LF = '\n';

    /** Optional carriage return preceding {@link #LF} in a line terminator. */
    public static final char CR = '\r';

    /** Separates a field name from its value; starts a comment when it opens the line. */
    public static final char COLON = ':';

    /** Reconnect delay used when neither the stream nor the caller configured one. */
    public static final Duration FALLBACK_RETRY_INTERVAL = Duration.ofSeconds(1);
}
