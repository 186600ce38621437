package io.github.eventsource.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents an HTTP request to be sent by an {@link HttpClientAdapter}.
 * This is an immutable value type with a fluent builder API.
 *
 * <p>Header names are unique ignoring case; setting a header replaces any previous value
 * under the same name.
 */
public final class HttpClientRequest {

    private final URI uri;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(URI uri, String method, Map<String, String> headers, byte[] body, Duration timeout) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.method = Objects.requireNonNull(method, "method");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
        this.timeout = timeout;
    }

    public URI uri() { return uri; }
    public String method() { return method; }
    public Map<String, String> headers() { return headers; }
    public byte[] body() { return body; }

    /**
     * Time allowed until the response headers arrive; {@code null} for the client default.
     * Adapters also use it as the idle read timeout of a streaming body where the library
     * supports one.
     *
     * @return the timeout, or {@code null}
     */
    public Duration timeout() { return timeout; }

    /**
     * Returns the value of a header, ignoring case in the name.
     *
     * @param name the header name
     * @return the value, or {@code null} if absent
     */
    public String header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    /**
     * Returns a copy of this request with {@code name} set to {@code value}, replacing any
     * existing header of that name regardless of case.
     *
     * @param name the header name
     * @param value the header value
     * @return a new request
     */
    public HttpClientRequest withHeader(String name, String value) {
        return toBuilder().header(name, value).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(uri, method).body(body).timeout(timeout);
        b.headers.putAll(headers);
        return b;
    }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    public static Builder get(URI uri) { return new Builder(uri, "GET"); }
    public static Builder post(URI uri) { return new Builder(uri, "POST"); }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(uri, method, headers, body, timeout);
        }
    }
}
