package com.polynomeer.tinykv.resp;

/**
 * Wire tags understood by the codec, one per {@link RespValue} variant.
 */
public enum RespType {
    SIMPLE_STRING('+'),  // +OK\r\n
    ERROR('-'),          // -message\r\n
    INTEGER(':'),        // :123\r\n
    BULK_STRING('$'),    // $3\r\nfoo\r\n  or  $-1\r\n
    ARRAY('*'),          // *2\r\n$3\r\nGET\r\n$3\r\nkey\r\n
    MAP('%');            // %1\r\n<key><value>

    private final byte tag;

    RespType(char tag) {
        this.tag = (byte) tag;
    }

    public byte tag() {
        return tag;
    }

    /**
     * Resolve a leading byte; returns null for anything that is not a known tag.
     */
    public static RespType fromTag(int b) {
        for (RespType t : values()) {
            if (t.tag == b) return t;
        }
        return null;
    }
}
