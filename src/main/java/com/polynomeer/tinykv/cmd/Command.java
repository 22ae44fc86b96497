package com.polynomeer.tinykv.cmd;

import com.polynomeer.tinykv.resp.RespValue;

import java.util.List;

/**
 * A command handler. Receives the arguments after the command name and checks
 * its own arity, raising {@link com.polynomeer.tinykv.resp.CommandError} on misuse.
 */
@FunctionalInterface
public interface Command {
    RespValue execute(List<RespValue> args);
}
