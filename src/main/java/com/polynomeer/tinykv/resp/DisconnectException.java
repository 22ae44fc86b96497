package com.polynomeer.tinykv.resp;

import java.io.IOException;

/**
 * The peer closed its side of the stream.
 */
public class DisconnectException extends IOException {
    private final boolean midFrame;

    private DisconnectException(String msg, boolean midFrame) {
        super(msg);
        this.midFrame = midFrame;
    }

    /**
     * End of stream where the next request would have started.
     */
    public static DisconnectException clean() {
        return new DisconnectException("connection closed", false);
    }

    /**
     * End of stream after part of a frame was already consumed.
     */
    public static DisconnectException truncated(String where) {
        return new DisconnectException("connection closed mid-frame while reading " + where, true);
    }

    public boolean isMidFrame() {
        return midFrame;
    }
}
