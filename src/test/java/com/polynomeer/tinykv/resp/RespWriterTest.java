package com.polynomeer.tinykv.resp;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RespWriterTest {

    private static String wire(RespValue v) {
        return new String(RespWriter.encode(v), StandardCharsets.UTF_8);
    }

    @Test
    void shouldEncodeScalars() {
        assertThat(wire(RespValue.BulkString.of("bar"))).isEqualTo("$3\r\nbar\r\n");
        assertThat(wire(new RespValue.RespInteger(-12))).isEqualTo(":-12\r\n");
        assertThat(wire(new RespValue.ErrorReply("nope"))).isEqualTo("-nope\r\n");
        assertThat(wire(RespValue.BulkString.NULL)).isEqualTo("$-1\r\n");
        assertThat(wire(RespValue.SimpleString.of("OK"))).isEqualTo("$2\r\nOK\r\n");
    }

    @Test
    void shouldEncodeArrayElementsInOrder() {
        RespValue v = RespValue.Array.of(
                RespValue.BulkString.of("a"), RespValue.BulkString.NULL, new RespValue.RespInteger(1));

        assertThat(wire(v)).isEqualTo("*3\r\n$1\r\na\r\n$-1\r\n:1\r\n");
    }

    @Test
    void shouldEncodeMapInIterationOrder() {
        Map<RespValue, RespValue> m = new LinkedHashMap<>();
        m.put(RespValue.BulkString.of("k1"), new RespValue.RespInteger(1));
        m.put(RespValue.BulkString.of("k2"), RespValue.BulkString.of("v"));

        assertThat(wire(new RespValue.RespMap(m))).isEqualTo("%2\r\n$2\r\nk1\r\n:1\r\n$2\r\nk2\r\n$1\r\nv\r\n");
    }

    @Test
    void shouldReplaceLineBreaksInErrorMessages() {
        assertThat(wire(new RespValue.ErrorReply("line1\r\nline2"))).isEqualTo("-line1  line2\r\n");
    }

    @Test
    void shouldEncodeSimpleStringWithBareCrAsBulk() {
        assertThat(wire(RespValue.SimpleString.of("a\rb"))).isEqualTo("$3\r\na\rb\r\n");
    }

    @Test
    void shouldWriteErrorBytesVerbatim() {
        byte[] frame = RespWriter.encode(new RespValue.ErrorReply(new byte[]{'E', (byte) 0xff, (byte) 0xfe}));

        assertThat(frame).containsExactly('-', 'E', 0xff, 0xfe, '\r', '\n');
    }

    @Test
    void shouldLiftPlainJavaValues() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("n", 5);
        RespValue v = RespValue.of(List.of("x", "y".getBytes(StandardCharsets.UTF_8), 7L, m));

        assertThat(wire(v)).isEqualTo("*4\r\n$1\r\nx\r\n$1\r\ny\r\n:7\r\n%1\r\n$1\r\nn\r\n:5\r\n");
        assertThat(RespValue.of(null)).isEqualTo(RespValue.BulkString.NULL);
    }

    @Test
    void shouldRejectUnrecognizedType() {
        assertThatThrownBy(() -> RespValue.of(3.14))
                .isInstanceOf(CommandError.class)
                .hasMessageContaining("unrecognized type");
    }

    @Test
    void shouldRoundTripEveryVariant() throws IOException {
        Map<RespValue, RespValue> m = new LinkedHashMap<>();
        m.put(RespValue.BulkString.of("key"), RespValue.Array.of(new RespValue.RespInteger(Long.MIN_VALUE)));
        m.put(new RespValue.RespInteger(2), RespValue.BulkString.NULL);
        RespValue original = RespValue.Array.of(
                new RespValue.ErrorReply("ERR something"),
                new RespValue.ErrorReply(new byte[]{(byte) 0xff, (byte) 0xfe, 'x'}),
                new RespValue.RespInteger(Long.MAX_VALUE),
                new RespValue.BulkString(new byte[]{0, '\r', '\n', (byte) 0xff}),
                new RespValue.BulkString(new byte[0]),
                RespValue.BulkString.NULL,
                new RespValue.Array(List.of()),
                new RespValue.RespMap(m));

        RespValue decoded = new RespReader(new ByteArrayInputStream(RespWriter.encode(original))).read();

        assertThat(decoded).isEqualTo(original);
    }

    @Test
    void shouldRoundTripSimpleStringPayloadAsBulk() throws IOException {
        byte[] payload = {'a', '\r', 'b'};

        RespValue decoded = new RespReader(new ByteArrayInputStream(
                RespWriter.encode(new RespValue.SimpleString(payload)))).read();

        assertThat(decoded).isEqualTo(new RespValue.BulkString(payload));
    }
}
