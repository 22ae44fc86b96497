package com.polynomeer.tinykv.resp;

/**
 * Malformed framing on the wire: bad length, bad integer, missing CRLF.
 * Recoverable; the connection answers with an error reply and keeps going.
 */
public class RespError extends RuntimeException {
    public RespError(String msg) {
        super(msg);
    }

    public RespError(String msg, Throwable cause) {
        super(msg, cause);
    }
}
