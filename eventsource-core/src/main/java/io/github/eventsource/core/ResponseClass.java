package io.github.eventsource.core;

/**
 * How a client treats the status code of an event stream response.
 */
public enum ResponseClass {
    /** The stream is open; start parsing the body. */
    SUCCESS,

    /** Server-side failure; discard the body and reconnect after the retry interval. */
    RETRYABLE,

    /** Anything else; fail the connection without retrying. */
    TERMINAL;

    /**
     * Classifies an HTTP status code.
     *
     * @param statusCode the response status
     * @return the class of the status
     */
    public static ResponseClass of(int statusCode) {
        return switch (statusCode) {
            case 200 -> SUCCESS;
            case 500, 502, 503, 504 -> RETRYABLE;
            default -> TERMINAL;
        };
    }
}
