/**
 * HTTP transport SPI used by the event source client.
 *
 * <p>The SPI is blocking and minimal: one streaming send, and a response whose
 * {@link io.github.eventsource.http.spi.HttpClientResponse#close()} releases the exchange from
 * any thread. Adapters for the JDK client, OkHttp and Apache HttpClient 5 are provided; the
 * latter two need their library on the classpath.
 */
package io.github.eventsource.http.spi;
