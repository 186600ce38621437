package io.github.eventsource.client;

import io.github.eventsource.http.spi.HttpClientRequest;

/**
 * Produces the request for each connection attempt.
 *
 * <p>Called once per attempt, retries included, so values such as auth tokens can be refreshed.
 * The event source overwrites the {@code Last-Event-ID} header of the returned request.
 */
@FunctionalInterface
public interface RequestFactory {

    HttpClientRequest create();
}
