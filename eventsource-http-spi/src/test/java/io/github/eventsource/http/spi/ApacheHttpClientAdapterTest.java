package io.github.eventsource.http.spi;

class ApacheHttpClientAdapterTest extends HttpClientAdapterContract {

    @Override
    protected HttpClientAdapter createAdapter() {
        return ApacheHttpClientAdapter.create();
    }
}
