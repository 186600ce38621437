package io.github.eventsource.http.spi;

/**
 * Exception thrown when an HTTP exchange cannot be started, for instance because the endpoint is
 * unreachable. Wraps underlying implementation-specific exceptions.
 *
 * <p>Event source clients treat this as a transient failure and reconnect.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
