package io.github.eventsource.http.spi;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using Apache HttpClient 5.
 *
 * <p>Requires {@code org.apache.httpcomponents.client5:httpclient5} on the classpath.
 *
 * <p>The response is opened with {@link CloseableHttpClient#executeOpen} so the body is consumed
 * as it arrives. Closing a response cancels the request first, which shuts the connection down
 * and unblocks a concurrent reader instead of draining the rest of the stream.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter {

    private final CloseableHttpClient httpClient;

    public ApacheHttpClientAdapter(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static ApacheHttpClientAdapter create() {
        return new ApacheHttpClientAdapter(HttpClients.createDefault());
    }

    public static ApacheHttpClientAdapter create(CloseableHttpClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        HttpUriRequestBase apacheRequest = toApacheRequest(request);
        try {
            ClassicHttpResponse response = httpClient.executeOpen(HttpHost.create(request.uri()), apacheRequest, null);
            return new StreamingResponse(apacheRequest, response);
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(request.method() + " " + request.uri() + " timed out", e);
        } catch (IOException e) {
            throw new HttpClientException(request.method() + " " + request.uri() + " failed", e);
        }
    }

    private static HttpUriRequestBase toApacheRequest(HttpClientRequest request) {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        if (request.body() != null) {
            String contentType = request.header("Content-Type");
            apacheRequest.setEntity(new ByteArrayEntity(request.body(),
                    contentType != null ? ContentType.parse(contentType) : ContentType.APPLICATION_OCTET_STREAM));
        }

        request.headers().forEach(apacheRequest::setHeader);

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .setConnectionRequestTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final HttpUriRequestBase request;
        private final ClassicHttpResponse response;

        StreamingResponse(HttpUriRequestBase request, ClassicHttpResponse response) {
            this.request = request;
            this.response = response;
        }

        @Override public int statusCode() { return response.getCode(); }

        @Override
        public Optional<String> header(String name) {
            Header h = response.getFirstHeader(name);
            return h != null ? Optional.ofNullable(h.getValue()) : Optional.empty();
        }

        @Override
        public InputStream bodyAsStream() {
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                return InputStream.nullInputStream();
            }
            try {
                return entity.getContent();
            } catch (IOException e) {
                throw new IllegalStateException("response body unavailable", e);
            }
        }

        @Override
        public void close() throws IOException {
            request.cancel();
            response.close();
        }
    }
}
