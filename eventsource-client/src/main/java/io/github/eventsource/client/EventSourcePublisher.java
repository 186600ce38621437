package io.github.eventsource.client;

import io.github.eventsource.core.Event;
import io.github.eventsource.core.EventSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Push-style view of an {@link EventSource}.
 *
 * <p>The first subscription starts a daemon thread that calls {@link EventSource#next()} in a
 * loop and submits every event. The publisher completes when the server ends the stream or the
 * source is closed, and completes exceptionally on {@link BadResponseException}.
 */
public final class EventSourcePublisher implements Flow.Publisher<Event>, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(EventSourcePublisher.class);

    private final EventSource source;
    private final SubmissionPublisher<Event> pub = new SubmissionPublisher<>();
    private final AtomicBoolean started = new AtomicBoolean();

    EventSourcePublisher(EventSource source) {
        this.source = source;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super Event> subscriber) {
        pub.subscribe(subscriber);
        if (started.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, "eventsource-reader");
            t.setDaemon(true);
            t.start();
        }
    }

    /**
     * Closes the underlying source, which completes the publisher.
     *
     * @throws IOException if releasing the open response fails
     */
    @Override
    public void close() throws IOException {
        pub.close();
        source.close();
    }

    private void run() {
        try {
            Event event;
            while (!pub.isClosed() && (event = source.next()) != null) {
                pub.submit(event);
            }
            pub.close();
        } catch (EventSourceException.ClosedSource e) {
            logger.debug("Event source closed, completing publisher");
            pub.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pub.closeExceptionally(e);
        } catch (RuntimeException e) {
            pub.closeExceptionally(e);
        }
    }
}
