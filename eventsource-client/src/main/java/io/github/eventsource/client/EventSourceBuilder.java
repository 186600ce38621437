package io.github.eventsource.client;

import io.github.eventsource.core.Protocol;
import io.github.eventsource.http.spi.HttpClientAdapter;
import io.github.eventsource.http.spi.HttpClientRequest;
import io.github.eventsource.http.spi.JdkHttpClientAdapter;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class EventSourceBuilder {
    private HttpClientAdapter httpClient;
    private RequestFactory requestFactory;
    private URI url;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private Duration defaultRetryInterval;
    private String lastEventId = "";

    EventSourceBuilder() {}

    /**
     * Streams from {@code url} with a {@code GET} that accepts {@code text/event-stream}.
     */
    public EventSourceBuilder url(URI url) {
        this.url = Objects.requireNonNull(url, "url");
        return this;
    }

    /**
     * Adds a header to the requests built for {@link #url(URI)}.
     */
    public EventSourceBuilder header(String name, String value) {
        headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return this;
    }

    /**
     * Uses a custom request for every connection attempt instead of {@link #url(URI)}.
     */
    public EventSourceBuilder requestFactory(RequestFactory requestFactory) {
        this.requestFactory = Objects.requireNonNull(requestFactory, "requestFactory");
        return this;
    }

    /**
     * Transport for the connection attempts. Defaults to {@link JdkHttpClientAdapter}, which may
     * not abort a read already blocked on the body when the source is closed; use
     * {@code OkHttpClientAdapter} or {@code ApacheHttpClientAdapter} if another thread stops the
     * reader with {@link EventSource#close()}.
     */
    public EventSourceBuilder httpClient(HttpClientAdapter httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    public EventSourceBuilder jdkHttpClient(HttpClient httpClient) {
        this.httpClient = new JdkHttpClientAdapter(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    /**
     * Delay between reconnection attempts until the server sends a {@code retry} directive.
     * Defaults to {@link Protocol#FALLBACK_RETRY_INTERVAL}.
     */
    public EventSourceBuilder defaultRetryInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("retry interval must be positive: " + interval);
        }
        this.defaultRetryInterval = interval;
        return this;
    }

    /**
     * Id sent as {@code Last-Event-ID} on the first connection, e.g. one saved by the caller.
     */
    public EventSourceBuilder lastEventId(String lastEventId) {
        this.lastEventId = Objects.requireNonNull(lastEventId, "lastEventId");
        return this;
    }

    public EventSource build() {
        RequestFactory factory = requestFactory;
        if (factory == null) {
            if (url == null) {
                throw new IllegalStateException("either url or requestFactory is required");
            }
            URI target = url;
            Map<String, String> extra = new LinkedHashMap<>(headers);
            factory = () -> HttpClientRequest.get(target)
                    .header(Protocol.H_ACCEPT, Protocol.CT_EVENT_STREAM)
                    .header(Protocol.H_CACHE_CONTROL, Protocol.NO_CACHE)
                    .headers(extra)
                    .build();
        } else if (url != null || !headers.isEmpty()) {
            throw new IllegalStateException("url and headers cannot be combined with a requestFactory");
        }

        HttpClientAdapter resolved = httpClient;
        if (resolved == null) {
            resolved = JdkHttpClientAdapter.create();
        }
        return new EventSource(resolved, factory, defaultRetryInterval, lastEventId);
    }
}
