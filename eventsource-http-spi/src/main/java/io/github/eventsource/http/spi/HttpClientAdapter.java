package io.github.eventsource.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the event source to work with different HTTP client libraries
 * (JDK HttpClient, Apache HttpClient, OkHttp, etc.) without direct dependency on any specific
 * implementation.
 *
 * <p>Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = OkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com/events")).build();
 * try (HttpClientResponse response = adapter.sendStreaming(request)) {
 *     InputStream body = response.bodyAsStream();
 * }
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns as soon as the response headers arrived, with the body
     * left on the wire to be read incrementally.
     *
     * <p>The caller is responsible for closing the returned response.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as InputStream
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException;
}
