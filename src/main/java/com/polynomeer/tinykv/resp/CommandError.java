package com.polynomeer.tinykv.resp;

/**
 * Request-level failure: unknown command, bad request shape, wrong arity,
 * or a value the codec has no encoding for. Always answered with an error reply.
 */
public class CommandError extends RuntimeException {
    public CommandError(String msg) {
        super(msg);
    }
}
