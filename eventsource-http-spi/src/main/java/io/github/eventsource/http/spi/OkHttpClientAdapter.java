package io.github.eventsource.http.spi;

import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 *
 * <p>Closing a response cancels its {@link Call}, which closes the socket and makes a concurrent
 * read of the body fail immediately. A request timeout is applied as the read timeout only, so
 * that a long-lived stream is not cut by a call timeout.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        Call call = clientWithTimeout(request).newCall(toOkHttpRequest(request));
        try {
            return new StreamingResponse(call, call.execute());
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(request.method() + " " + request.uri() + " timed out", e);
        } catch (IOException e) {
            throw new HttpClientException(request.method() + " " + request.uri() + " failed", e);
        }
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.body() != null) {
            String contentType = request.header("Content-Type");
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final Call call;
        private final Response response;

        StreamingResponse(Call call, Response response) {
            this.call = call;
            this.response = response;
        }

        @Override public int statusCode() { return response.code(); }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(response.header(name)); }

        @Override
        public InputStream bodyAsStream() {
            ResponseBody body = response.body();
            return body != null ? body.byteStream() : InputStream.nullInputStream();
        }

        @Override
        public void close() {
            call.cancel();
            response.close();
        }
    }
}
