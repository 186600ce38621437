package io.github.eventsource.http.spi;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 * This is the default implementation when no other HTTP client library is configured.
 *
 * <p>Closing a response closes the body subscriber. Whether a read already blocked on that body
 * returns right away depends on the JDK; prefer {@link OkHttpClientAdapter} or
 * {@link ApacheHttpClientAdapter} when another thread must be able to cancel a reader promptly.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        try {
            HttpRequest jdkRequest = toJdkRequest(request);
            HttpResponse<InputStream> response = httpClient.send(jdkRequest, HttpResponse.BodyHandlers.ofInputStream());
            return new StreamingResponse(response);
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(describe(request) + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException(describe(request) + " interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new HttpClientException(describe(request) + " failed", e);
        }
    }

    private static String describe(HttpClientRequest request) {
        return request.method() + " " + request.uri();
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());

        HttpRequest.BodyPublisher bodyPublisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        builder.method(request.method(), bodyPublisher);
        request.headers().forEach(builder::header);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        return builder.build();
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final HttpResponse<InputStream> response;

        StreamingResponse(HttpResponse<InputStream> response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public InputStream bodyAsStream() {
            return response.body();
        }

        @Override
        public void close() throws IOException {
            response.body().close();
        }
    }
}
