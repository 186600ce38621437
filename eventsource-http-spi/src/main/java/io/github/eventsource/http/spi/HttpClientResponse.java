package io.github.eventsource.http.spi;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * A streaming HTTP response from an {@link HttpClientAdapter}.
 *
 * <p>The response owns the underlying exchange. {@link #close()} may be called from a different
 * thread than the one reading {@link #bodyAsStream()}; implementations should make that read fail
 * promptly instead of waiting for more data.
 */
public interface HttpClientResponse extends Closeable {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body as an input stream.
     * @return the body stream, never null
     */
    InputStream bodyAsStream();

    /**
     * Releases the exchange, aborting the body if it was not fully read.
     * @throws IOException if releasing the connection fails
     */
    @Override
    void close() throws IOException;
}
