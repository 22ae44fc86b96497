package com.polynomeer.tinykv.resp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A value crossing the wire, in either direction.
 * Each variant knows which {@link RespWriter} call serializes it, so encoding
 * is resolved by the variant itself and every permitted type must provide one.
 */
public sealed interface RespValue
        permits RespValue.SimpleString, RespValue.ErrorReply, RespValue.RespInteger,
        RespValue.BulkString, RespValue.Array, RespValue.RespMap {

    RespType type();

    void writeTo(RespWriter out) throws IOException;

    // ---------- variants ----------

    /**
     * +bytes\r\n on input. Replies carry the same bytes as a bulk string.
     */
    record SimpleString(byte[] value) implements RespValue {
        public SimpleString {
            Objects.requireNonNull(value, "value");
        }

        public static SimpleString of(String s) {
            return new SimpleString(s.getBytes(StandardCharsets.UTF_8));
        }

        public String asString() {
            return new String(value, StandardCharsets.UTF_8);
        }

        @Override
        public RespType type() {
            return RespType.SIMPLE_STRING;
        }

        @Override
        public void writeTo(RespWriter out) throws IOException {
            out.writeBulkString(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SimpleString && Arrays.equals(value, ((SimpleString) o).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "SimpleString[" + asString() + "]";
        }
    }

    /**
     * Error message as raw bytes; decoded to text only for display.
     */
    record ErrorReply(byte[] message) implements RespValue {
        public ErrorReply {
            Objects.requireNonNull(message, "message");
        }

        public ErrorReply(String message) {
            this(message.getBytes(StandardCharsets.UTF_8));
        }

        public String asString() {
            return new String(message, StandardCharsets.UTF_8);
        }

        @Override
        public RespType type() {
            return RespType.ERROR;
        }

        @Override
        public void writeTo(RespWriter out) throws IOException {
            out.writeError(message);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ErrorReply && Arrays.equals(message, ((ErrorReply) o).message);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(message);
        }

        @Override
        public String toString() {
            return "ErrorReply[" + asString() + "]";
        }
    }

    record RespInteger(long value) implements RespValue {
        @Override
        public RespType type() {
            return RespType.INTEGER;
        }

        @Override
        public void writeTo(RespWriter out) throws IOException {
            out.writeInteger(value);
        }
    }

    /**
     * Length-prefixed blob. A null payload is the RESP null ($-1).
     */
    record BulkString(byte[] value) implements RespValue {
        public static final BulkString NULL = new BulkString(null);

        public static BulkString of(String s) {
            return s == null ? NULL : new BulkString(s.getBytes(StandardCharsets.UTF_8));
        }

        public boolean isNull() {
            return value == null;
        }

        public String asString() {
            return value == null ? null : new String(value, StandardCharsets.UTF_8);
        }

        @Override
        public RespType type() {
            return RespType.BULK_STRING;
        }

        @Override
        public void writeTo(RespWriter out) throws IOException {
            if (value == null) {
                out.writeNull();
            } else {
                out.writeBulkString(value);
            }
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BulkString && Arrays.equals(value, ((BulkString) o).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return value == null ? "BulkString[null]" : "BulkString[" + asString() + "]";
        }
    }

    record Array(List<RespValue> elements) implements RespValue {
        public Array {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public static Array of(RespValue... elements) {
            return new Array(Arrays.asList(elements));
        }

        @Override
        public RespType type() {
            return RespType.ARRAY;
        }

        @Override
        public void writeTo(RespWriter out) throws IOException {
            out.writeArray(elements);
        }
    }

    /**
     * Keys are unique; iteration follows insertion order.
     */
    record RespMap(Map<RespValue, RespValue> entries) implements RespValue {
        public RespMap {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public RespType type() {
            return RespType.MAP;
        }

        @Override
        public void writeTo(RespWriter out) throws IOException {
            out.writeMap(entries);
        }
    }

    // ---------- conversion from plain Java values ----------

    /**
     * Lift a plain Java value into the wire model.
     * Strings and byte arrays become bulk strings, integral numbers become integers,
     * lists and arrays become arrays, maps become maps and null becomes the null bulk string.
     *
     * @throws CommandError for any other type
     */
    static RespValue of(Object o) {
        if (o == null) return BulkString.NULL;
        if (o instanceof RespValue) return (RespValue) o;
        if (o instanceof String) return BulkString.of((String) o);
        if (o instanceof byte[]) return new BulkString(((byte[]) o).clone());
        if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
            return new RespInteger(((Number) o).longValue());
        }
        if (o instanceof List) {
            List<RespValue> out = new ArrayList<>();
            for (Object e : (List<?>) o) out.add(of(e));
            return new Array(out);
        }
        if (o instanceof Object[]) {
            return of(Arrays.asList((Object[]) o));
        }
        if (o instanceof Map) {
            Map<RespValue, RespValue> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
                out.put(of(e.getKey()), of(e.getValue()));
            }
            return new RespMap(out);
        }
        throw new CommandError("unrecognized type: " + o.getClass().getName());
    }
}
