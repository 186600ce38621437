package io.github.eventsource.client;

import io.github.eventsource.core.Event;
import io.github.eventsource.core.EventParser;
import io.github.eventsource.core.EventSourceException;
import io.github.eventsource.core.Protocol;
import io.github.eventsource.core.ResponseClass;
import io.github.eventsource.http.spi.HttpClientAdapter;
import io.github.eventsource.http.spi.HttpClientException;
import io.github.eventsource.http.spi.HttpClientRequest;
import io.github.eventsource.http.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reconnecting event stream reader.
 *
 * <p>Call {@link #next()} in a loop, optionally after an explicit {@link #connect()}. When the
 * connection breaks, the source reconnects after the retry interval and sends the id of the last
 * event it returned in the {@code Last-Event-ID} header, so the server can resume the stream.
 * Connection failures and the statuses 500, 502, 503 and 504 are retried forever at a constant
 * interval; any other non-200 status fails with {@link BadResponseException}.
 *
 * <p>{@link #next()} blocks on the network. It is meant to be called from one thread while
 * another thread may call {@link #close()} to stop it: the blocked call then fails with
 * {@link EventSourceException.ClosedSource}, as does every later call until {@link #connect()}
 * succeeds again. The same holds after the server ended the stream, which {@link #next()} reports
 * by returning {@code null}.
 *
 * <p>Unblocking a read from another thread relies on the transport: closing the response must
 * abort a read in progress. {@link io.github.eventsource.http.spi.OkHttpClientAdapter} and
 * {@link io.github.eventsource.http.spi.ApacheHttpClientAdapter} do; the default
 * {@link io.github.eventsource.http.spi.JdkHttpClientAdapter} may only notice the close once more
 * data or the end of the stream arrives. Configure one of the former through
 * {@link EventSourceBuilder#httpClient} when {@link #close()} is used to stop a blocked reader.
 *
 * <pre>{@code
 * try (EventSource source = EventSource.builder().url(uri).build()) {
 *     Event event;
 *     while ((event = source.next()) != null) {
 *         handle(event);
 *     }
 * }
 * }</pre>
 */
public final class EventSource implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(EventSource.class);

    private final HttpClientAdapter httpClient;
    private final RequestFactory requestFactory;
    private final Duration defaultRetryInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition closing = lock.newCondition();

    // guarded by lock
    private Connection current;
    private String lastEventId;
    private Duration retryInterval;
    private boolean closed;
    private long closeCount;

    EventSource(HttpClientAdapter httpClient, RequestFactory requestFactory, Duration defaultRetryInterval, String lastEventId) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestFactory = Objects.requireNonNull(requestFactory, "requestFactory");
        this.defaultRetryInterval = defaultRetryInterval;
        this.lastEventId = Objects.requireNonNull(lastEventId, "lastEventId");
    }

    public static EventSourceBuilder builder() {
        return new EventSourceBuilder();
    }

    /**
     * Opens the stream unless one is already open, retrying until the server accepts.
     *
     * <p>This is also the way to resume reading after {@link #close()} or the end of the stream.
     *
     * @throws BadResponseException if the server answered with a status that is not retried
     * @throws EventSourceException.ClosedSource if {@link #close()} was called meanwhile
     * @throws InterruptedException if interrupted while waiting to retry
     */
    public void connect() throws InterruptedException {
        long closes;
        lock.lock();
        try {
            if (current != null) {
                return;
            }
            closes = closeCount;
        } finally {
            lock.unlock();
        }
        connect(closes);
    }

    /**
     * Returns the next event, connecting or reconnecting as needed.
     *
     * @return the next event, or {@code null} once the server ended the stream
     * @throws BadResponseException if a (re)connection got a status that is not retried
     * @throws EventSourceException.ClosedSource if the source is closed, or was closed while
     *     this call was blocked
     * @throws InterruptedException if interrupted while waiting to reconnect
     */
    public Event next() throws InterruptedException {
        long closes;
        lock.lock();
        try {
            if (closed) {
                throw new EventSourceException.ClosedSource();
            }
            closes = closeCount;
        } finally {
            lock.unlock();
        }

        while (true) {
            connect(closes);

            Connection connection;
            lock.lock();
            try {
                if (closeCount != closes) {
                    throw new EventSourceException.ClosedSource();
                }
                connection = current;
            } finally {
                lock.unlock();
            }
            if (connection == null) {
                continue;
            }

            Event event;
            try {
                event = connection.parser().next();
            } catch (IOException | UncheckedIOException | IllegalStateException e) {
                boolean closedMeanwhile;
                lock.lock();
                try {
                    closedMeanwhile = closeCount != closes;
                    if (!closedMeanwhile && current == connection) {
                        current = null;
                    }
                } finally {
                    lock.unlock();
                }
                if (closedMeanwhile) {
                    throw new EventSourceException.ClosedSource(e);
                }
                logger.debug("Event stream broke, reconnecting from Last-Event-ID '{}'", lastEventId(), e);
                discard(connection.response());
                awaitRetry(closes);
                continue;
            }

            if (event == null) {
                logger.debug("Event stream ended by the server");
                try {
                    close();
                } catch (IOException e) {
                    logger.debug("Failed to release finished event stream", e);
                }
                return null;
            }

            lock.lock();
            try {
                lastEventId = event.id();
                // a zero directive would turn the backoff into a busy loop
                if (event.retry().isPresent() && !event.retry().get().isZero()) {
                    retryInterval = event.retry().get();
                }
            } finally {
                lock.unlock();
            }
            return event;
        }
    }

    /**
     * Closes the current stream and stops any reconnection in progress. Idempotent.
     *
     * @throws IOException if releasing the open response fails
     */
    @Override
    public void close() throws IOException {
        Connection connection;
        lock.lock();
        try {
            closed = true;
            closeCount++;
            connection = current;
            current = null;
            closing.signalAll();
        } finally {
            lock.unlock();
        }
        if (connection != null) {
            connection.response().close();
        }
    }

    /**
     * Returns the id sent as {@code Last-Event-ID} on the next connection attempt.
     *
     * @return the id of the last returned event, or the configured initial id
     */
    public String lastEventId() {
        lock.lock();
        try {
            return lastEventId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the delay applied before the next reconnection attempt: the last {@code retry}
     * directive received, else the configured default, else {@link Protocol#FALLBACK_RETRY_INTERVAL}.
     *
     * @return the current retry interval
     */
    public Duration retryInterval() {
        lock.lock();
        try {
            if (retryInterval != null) {
                return retryInterval;
            }
            return defaultRetryInterval != null ? defaultRetryInterval : Protocol.FALLBACK_RETRY_INTERVAL;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether reading requires a new {@link #connect()}.
     *
     * @return {@code true} after {@link #close()} or the end of the stream
     */
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a publisher that reads this source on a background thread once subscribed.
     *
     * @return a new publisher over this source
     */
    public EventSourcePublisher publisher() {
        return new EventSourcePublisher(this);
    }

    private void connect(long closes) throws InterruptedException {
        while (true) {
            String resumeFrom;
            lock.lock();
            try {
                if (closeCount != closes) {
                    throw new EventSourceException.ClosedSource();
                }
                if (current != null) {
                    return;
                }
                resumeFrom = lastEventId;
            } finally {
                lock.unlock();
            }

            HttpClientRequest request = requestFactory.create().withHeader(Protocol.H_LAST_EVENT_ID, resumeFrom);
            logger.debug("Connecting to {} with Last-Event-ID '{}'", request.uri(), resumeFrom);

            HttpClientResponse response;
            try {
                response = httpClient.sendStreaming(request);
            } catch (HttpClientException e) {
                logger.debug("Connection to {} failed, retrying", request.uri(), e);
                awaitRetry(closes);
                continue;
            }

            switch (ResponseClass.of(response.statusCode())) {
                case SUCCESS -> {
                    InputStream body;
                    try {
                        body = response.bodyAsStream();
                    } catch (UncheckedIOException | IllegalStateException e) {
                        logger.debug("Body of {} unavailable, retrying", request.uri(), e);
                        discard(response);
                        awaitRetry(closes);
                        continue;
                    }
                    adopt(response, body, closes);
                    return;
                }
                case RETRYABLE -> {
                    logger.debug("{} answered {}, retrying", request.uri(), response.statusCode());
                    discard(response);
                    awaitRetry(closes);
                }
                case TERMINAL -> {
                    discard(response);
                    throw new BadResponseException(response);
                }
            }
        }
    }

    private void adopt(HttpClientResponse response, InputStream body, long closes) {
        boolean closedMeanwhile;
        lock.lock();
        try {
            closedMeanwhile = closeCount != closes;
            if (!closedMeanwhile && current == null) {
                current = new Connection(response, new EventParser(body, lastEventId));
                closed = false;
                return;
            }
        } finally {
            lock.unlock();
        }

        // another connect() won the race, or close() ran while the request was in flight
        discard(response);
        if (closedMeanwhile) {
            throw new EventSourceException.ClosedSource();
        }
    }

    private void awaitRetry(long closes) throws InterruptedException {
        lock.lock();
        try {
            long nanos = retryInterval().toNanos();
            while (nanos > 0 && closeCount == closes) {
                nanos = closing.awaitNanos(nanos);
            }
            if (closeCount != closes) {
                throw new EventSourceException.ClosedSource();
            }
        } finally {
            lock.unlock();
        }
    }

    private static void discard(HttpClientResponse response) {
        try {
            response.close();
        } catch (IOException e) {
            logger.debug("Failed to close discarded response", e);
        }
    }

    private record Connection(HttpClientResponse response, EventParser parser) {}
}
