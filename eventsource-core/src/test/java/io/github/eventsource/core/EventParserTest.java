package io.github.eventsource.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventParserTest {

    @Test
    void commentFollowedByEndOfStreamYieldsEndOfData() throws Exception {
        EventParser parser = parser(":foo bar baz\n");

        assertThat(parser.next()).isNull();
    }

    @Test
    void commentIsSkippedBeforeEvent() throws Exception {
        EventParser parser = parser(":foo bar baz\ndata: hello\n\n");

        assertThat(parser.next()).isEqualTo(new Event("", "", "hello"));
    }

    @Test
    void readsLargeDataLineInFull() throws Exception {
        String big = "x".repeat(20_000);
        EventParser parser = parser("data: " + big + "\n\n");

        assertThat(parser.next().dataAsString()).isEqualTo(big);
    }

    @Test
    void crlfTerminatorIsStrippedFromValues() throws Exception {
        EventParser parser = parser(":foo bar baz\r\nid: 123\r\nevent: some-event\r\ndata: hello\r\n\r\n");

        assertThat(parser.next()).isEqualTo(new Event("123", "some-event", "hello"));
    }

    @Test
    void loneCarriageReturnStaysInValue() throws Exception {
        EventParser parser = parser("data: a\rb\n\n");

        assertThat(parser.next().dataAsString()).isEqualTo("a\rb");
    }

    @Test
    void decodesIdNameAndData() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\ndata: hello\n\n");

        assertThat(parser.next()).isEqualTo(new Event("12", "some-event", "hello"));
        assertThat(parser.lastId()).isEqualTo("12");
    }

    @Test
    void secondEventWithNewIdReplacesIt() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\ndata: hello\n\n"
                + "id: 13\nevent: some-other-event\ndata: hello again\n\n");

        parser.next();

        assertThat(parser.next()).isEqualTo(new Event("13", "some-other-event", "hello again"));
    }

    @Test
    void omittedIdInheritsPreviousId() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\ndata: hello\n\n"
                + "event: some-other-event\ndata: hello again\n\n");

        parser.next();

        assertThat(parser.next()).isEqualTo(new Event("12", "some-other-event", "hello again"));
    }

    @Test
    void explicitEmptyIdResetsId() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\ndata: hello\n\n"
                + "event: some-other-event\ndata: hello again\nid\n\n"
                + "data: third\n\n");

        parser.next();

        assertThat(parser.next()).isEqualTo(new Event("", "some-other-event", "hello again"));
        assertThat(parser.next().id()).isEmpty();
    }

    @Test
    void omittedIdInheritsSeededId() throws Exception {
        EventParser parser = new EventParser(stream("data: resumed\n\n"), "41");

        assertThat(parser.next().id()).isEqualTo("41");
    }

    @Test
    void unterminatedEventIsNotDispatched() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\ndata: some-valuable-data\n");

        assertThat(parser.next()).isNull();
    }

    @Test
    void eventWithoutDataIsDroppedAndParsingContinues() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\n\ndata: next\n\n");

        Event event = parser.next();

        assertThat(event).isEqualTo(new Event("", "", "next"));
        assertThat(parser.lastId()).isEmpty();
    }

    @Test
    void eventWithoutDataAtEndOfStreamYieldsEndOfData() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\n\n");

        assertThat(parser.next()).isNull();
    }

    @Test
    void joinsMultipleDataFieldsWithLinebreak() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\ndata: some-valuable-data\ndata: some-more-data\n\n");

        assertThat(parser.next()).isEqualTo(new Event("12", "some-event", "some-valuable-data\nsome-more-data"));
    }

    @Test
    void parsesFieldsWithoutSpaceAfterColon() throws Exception {
        EventParser parser = parser("id:12\nevent:some-event\ndata:some-valuable-data\n\n");

        assertThat(parser.next()).isEqualTo(new Event("12", "some-event", "some-valuable-data"));
    }

    @Test
    void removesOnlyTheFirstLeadingSpace() throws Exception {
        EventParser parser = parser("id:  12\nevent:   some-event\ndata:    some-valuable-data\n\n");

        assertThat(parser.next()).isEqualTo(new Event(" 12", "  some-event", "   some-valuable-data"));
    }

    @Test
    void lineWithoutColonIsFieldWithEmptyValue() throws Exception {
        EventParser parser = parser("id: 12\nevent: some-event\ndata\ndata\n\n");

        assertThat(parser.next()).isEqualTo(new Event("12", "some-event", "\n"));
    }

    @Test
    void lastEventFieldWins() throws Exception {
        EventParser parser = parser("event: first\nevent: second\ndata: x\n\n");

        assertThat(parser.next().name()).isEqualTo("second");
    }

    @Test
    void unknownFieldsAreIgnored() throws Exception {
        EventParser parser = parser("foo: bar\ndata: x\nbaz\n\n");

        assertThat(parser.next()).isEqualTo(new Event("", "", "x"));
    }

    @Test
    void valueKeepsColonsAfterTheFirst() throws Exception {
        EventParser parser = parser("data: a:b: c\n\n");

        assertThat(parser.next().dataAsString()).isEqualTo("a:b: c");
    }

    @Test
    void parsesRetryDirectiveInMilliseconds() throws Exception {
        EventParser parser = parser("retry: 200\ndata: x\n\ndata: y\n\n");

        assertThat(parser.next().retry()).contains(Duration.ofMillis(200));
        assertThat(parser.next().retry()).isEmpty();
    }

    @Test
    void ignoresMalformedRetryDirective() throws Exception {
        EventParser parser = parser("retry: 2s\nretry\nretry: -5\ndata: x\n\n");

        assertThat(parser.next().retry()).isEmpty();
    }

    @Test
    void keepsDataBytesVerbatim() throws Exception {
        byte[] payload = {'d', 'a', 't', 'a', ':', ' ', (byte) 0xff, (byte) 0xfe, '\n', '\n'};
        EventParser parser = new EventParser(new ByteArrayInputStream(payload));

        assertThat(parser.next().data()).containsExactly((byte) 0xff, (byte) 0xfe);
    }

    @Test
    void eventSplitAcrossReadsIsAssembled() throws Exception {
        InputStream in = new SequenceInputStream(stream("id: 7\nda"), stream("ta: hel"));
        in = new SequenceInputStream(in, stream("lo\n\n"));
        EventParser parser = new EventParser(in);

        assertThat(parser.next()).isEqualTo(new Event("7", "", "hello"));
    }

    @Test
    void readFailurePropagates() {
        InputStream failing = new SequenceInputStream(stream("data: partial\n"), new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        });
        EventParser parser = new EventParser(failing);

        assertThatThrownBy(parser::next)
                .isInstanceOf(IOException.class)
                .hasMessage("connection reset");
    }

    @Test
    void parsesEncodedEvents() throws Exception {
        Event first = new Event("some-id", "some-name", "some-data\nsome-more-data\n");
        Event second = new Event("other", "", "").withRetry(Duration.ofMillis(1500));
        EventParser parser = parser(first.encode() + second.encode());

        assertThat(parser.next()).isEqualTo(first);
        assertThat(parser.next()).isEqualTo(second);
        assertThat(parser.next()).isNull();
    }

    private static EventParser parser(String wire) {
        return new EventParser(stream(wire));
    }

    private static InputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
