package io.github.eventsource.core;

/**
 * Base class for event source related exceptions.
 *
 * <p>Only terminal conditions are modelled here. Transient transport failures are retried by the
 * client and never reach the caller.
 */
public abstract class EventSourceException extends RuntimeException {

    protected EventSourceException(String message) {
        super(message);
    }

    protected EventSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when reading from a source that has been closed, either explicitly or because the
     * remote side ended the stream. A new {@code connect()} is required before reading again.
     */
    public static class ClosedSource extends EventSourceException {
        public ClosedSource() {
            super("read from closed event source");
        }

        public ClosedSource(Throwable cause) {
            super("read from closed event source", cause);
        }
    }
}
