/**
 * Reconnecting event stream client.
 *
 * <p>{@link io.github.eventsource.client.EventSource} pulls events one at a time and resumes
 * with {@code Last-Event-ID} after a broken connection;
 * {@link io.github.eventsource.client.EventSourcePublisher} adapts it to
 * {@link java.util.concurrent.Flow}.
 */
package io.github.eventsource.client;
