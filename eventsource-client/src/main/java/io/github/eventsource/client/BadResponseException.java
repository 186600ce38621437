package io.github.eventsource.client;

import io.github.eventsource.core.EventSourceException;
import io.github.eventsource.http.spi.HttpClientResponse;

import java.util.Objects;

/**
 * Raised when the server answers a connection attempt with a status that is neither 200 nor one
 * of the retried server errors. The connection is not retried.
 *
 * <p>The response body has already been released; status and headers remain available.
 */
public class BadResponseException extends EventSourceException {

    private final transient HttpClientResponse response;

    public BadResponseException(HttpClientResponse response) {
        super("bad response from event source: " + response.statusCode());
        this.response = Objects.requireNonNull(response, "response");
    }

    public HttpClientResponse response() {
        return response;
    }

    public int statusCode() {
        return response.statusCode();
    }
}
