package com.polynomeer.tinykv.resp;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocking RESP reader over an input stream.
 * Each {@link #read()} consumes exactly one complete value, starting at its tag byte.
 * The stream should be buffered; bytes are pulled one at a time for line headers.
 */
public class RespReader {
    /** Deepest array/map nesting accepted; the outermost aggregate is level 0. */
    static final int MAX_NESTING = 512;

    private final InputStream in;

    public RespReader(InputStream in) {
        this.in = in;
    }

    /**
     * Read the next value.
     *
     * @throws DisconnectException if the stream ends, cleanly before the tag or mid-frame
     * @throws CommandError        if the leading byte is not a known tag
     * @throws RespError           on malformed framing
     */
    public RespValue read() throws IOException {
        int b = in.read();
        if (b == -1) throw DisconnectException.clean();
        return readTagged(b, 0);
    }

    private RespValue readNested(int depth) throws IOException {
        int b = in.read();
        if (b == -1) throw DisconnectException.truncated("nested value");
        return readTagged(b, depth);
    }

    private RespValue readTagged(int b, int depth) throws IOException {
        RespType type = RespType.fromTag(b);
        if (type == null) {
            throw new CommandError("bad request");
        }
        switch (type) {
            case SIMPLE_STRING:
                return new RespValue.SimpleString(readLine());
            case ERROR:
                return new RespValue.ErrorReply(readLine());
            case INTEGER:
                return new RespValue.RespInteger(readLong());
            case BULK_STRING:
                return readBulkString();
            case ARRAY:
                return readArray(depth);
            case MAP:
                return readMap(depth);
            default:
                throw new CommandError("bad request");
        }
    }

    /**
     * "$<len>\r\n<bytes>\r\n" ; len == -1 is the null bulk string.
     */
    private RespValue readBulkString() throws IOException {
        long len = readLong();
        if (len == -1) return RespValue.BulkString.NULL;
        if (len < 0 || len > Integer.MAX_VALUE - 2) {
            throw new RespError("Invalid bulk length: " + len);
        }
        byte[] data = in.readNBytes((int) len);
        if (data.length < len) throw DisconnectException.truncated("bulk string payload");
        expectCRLF();
        return new RespValue.BulkString(data);
    }

    private RespValue readArray(int depth) throws IOException {
        int count = readCount("array");
        checkDepth(depth);
        List<RespValue> elements = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            elements.add(readNested(depth + 1));
        }
        return new RespValue.Array(elements);
    }

    /**
     * Reads 2N values and pairs them up in order; a repeated key keeps its last value.
     */
    private RespValue readMap(int depth) throws IOException {
        int pairs = readCount("map");
        checkDepth(depth);
        Map<RespValue, RespValue> entries = new LinkedHashMap<>();
        for (int i = 0; i < pairs; i++) {
            RespValue key = readNested(depth + 1);
            RespValue value = readNested(depth + 1);
            entries.put(key, value);
        }
        return new RespValue.RespMap(entries);
    }

    /**
     * Called after the header line, so the stream is left at the next tag byte.
     */
    private static void checkDepth(int depth) {
        if (depth >= MAX_NESTING) {
            throw new RespError("Protocol error: nesting too deep");
        }
    }

    // ---------- line level ----------

    private int readCount(String what) throws IOException {
        long n = readLong();
        if (n < 0 || n > Integer.MAX_VALUE) {
            throw new RespError("Invalid " + what + " length: " + n);
        }
        return (int) n;
    }

    private long readLong() throws IOException {
        String line = new String(readLine(), StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespError("Invalid integer: " + line, e);
        }
    }

    /**
     * Read up to and including LF; returns the line without its terminator.
     */
    private byte[] readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        while (true) {
            int b = in.read();
            if (b == -1) throw DisconnectException.truncated("line");
            if (b == '\n') break;
            line.write(b);
        }
        byte[] bytes = line.toByteArray();
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == '\r') {
            byte[] trimmed = new byte[len - 1];
            System.arraycopy(bytes, 0, trimmed, 0, len - 1);
            return trimmed;
        }
        return bytes;
    }

    private void expectCRLF() throws IOException {
        int c1 = in.read();
        int c2 = in.read();
        if (c1 == -1 || c2 == -1) throw DisconnectException.truncated("bulk string terminator");
        if (c1 != '\r' || c2 != '\n') {
            throw new RespError("Bulk string missing CRLF tail");
        }
    }
}
