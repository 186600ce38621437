package io.github.eventsource.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventTest {

    @Test
    void encodesToDispatchableEvent() {
        Event event = new Event("some-id", "some-name", "some-data");

        assertThat(event.encode()).isEqualTo("id: some-id\nevent: some-name\ndata: some-data\n\n");
    }

    @Test
    void splitsLinesAcrossMultipleDataSegments() {
        Event event = new Event("some-id", "some-name", "some-data\nsome-more-data\n");

        assertThat(event.encode())
                .isEqualTo("id: some-id\nevent: some-name\ndata: some-data\ndata: some-more-data\ndata\n\n");
    }

    @Test
    void encodesRetryDirectiveBeforeData() {
        Event event = new Event("1", "tick", "x").withRetry(Duration.ofMillis(200));

        assertThat(event.encode()).isEqualTo("id: 1\nevent: tick\nretry: 200\ndata: x\n\n");
    }

    @Test
    void writeToProducesEncodedBytes() throws Exception {
        Event event = new Event("some-id", "some-name", "some-data\nsome-more-data\n");
        ByteArrayOutputStream destination = new ByteArrayOutputStream();

        event.writeTo(destination);

        assertThat(destination.toString(StandardCharsets.UTF_8)).isEqualTo(event.encode());
    }

    @Test
    void writeToPropagatesDestinationFailure() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("broken pipe");
            }
        };

        assertThatThrownBy(() -> new Event("1", "", "x").writeTo(broken))
                .isInstanceOf(IOException.class)
                .hasMessage("broken pipe");
    }

    @Test
    void equalityComparesDataContent() {
        Event a = new Event("1", "n", "payload");
        Event b = new Event("1", "n", "payload".getBytes(StandardCharsets.UTF_8));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(a.withRetry(Duration.ofSeconds(1)));
    }

    @Test
    void payloadCannotBeChangedFromOutside() {
        byte[] source = "hello".getBytes(StandardCharsets.UTF_8);
        Event event = new Event("1", "", source);
        int hash = event.hashCode();

        source[0] = 'J';
        event.data()[0] = 'J';

        assertThat(event.dataAsString()).isEqualTo("hello");
        assertThat(event.hashCode()).isEqualTo(hash);
        assertThat(event).isEqualTo(new Event("1", "", "hello"));
    }
}
