package io.github.eventsource.http.spi;

/**
 * Exception thrown when an HTTP request times out before the response headers arrived.
 * Allows callers to distinguish timeout errors from other failures.
 */
public class HttpTimeoutException extends HttpClientException {

    public HttpTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
