package com.polynomeer.tinykv.resp;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Serializes {@link RespValue}s onto an output stream.
 * Nothing is flushed implicitly; callers flush once per reply.
 */
public class RespWriter {
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = {'$', '-', '1', '\r', '\n'};

    private final OutputStream out;

    public RespWriter(OutputStream out) {
        this.out = out;
    }

    /**
     * Encode a single value into a fresh byte array.
     */
    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try {
            new RespWriter(buf).write(value);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return buf.toByteArray();
    }

    public void write(RespValue value) throws IOException {
        value.writeTo(this);
    }

    public void flush() throws IOException {
        out.flush();
    }

    // ---------- per-variant encodings ----------

    /**
     * -message\r\n ; CR and LF inside the message are replaced by spaces.
     */
    void writeError(byte[] message) throws IOException {
        byte[] line = message.clone();
        for (int i = 0; i < line.length; i++) {
            if (line[i] == '\r' || line[i] == '\n') line[i] = ' ';
        }
        out.write(RespType.ERROR.tag());
        out.write(line);
        out.write(CRLF);
    }

    void writeInteger(long value) throws IOException {
        writeHeader(RespType.INTEGER, value);
    }

    void writeBulkString(byte[] value) throws IOException {
        writeHeader(RespType.BULK_STRING, value.length);
        out.write(value);
        out.write(CRLF);
    }

    void writeNull() throws IOException {
        out.write(NULL_BULK);
    }

    void writeArray(List<RespValue> elements) throws IOException {
        writeHeader(RespType.ARRAY, elements.size());
        for (RespValue e : elements) {
            write(e);
        }
    }

    void writeMap(Map<RespValue, RespValue> entries) throws IOException {
        writeHeader(RespType.MAP, entries.size());
        for (Map.Entry<RespValue, RespValue> e : entries.entrySet()) {
            write(e.getKey());
            write(e.getValue());
        }
    }

    // ---------- helpers ----------

    private void writeHeader(RespType type, long n) throws IOException {
        out.write(type.tag());
        out.write(Long.toString(n).getBytes(StandardCharsets.US_ASCII));
        out.write(CRLF);
    }
}
