package com.polynomeer.tinykv.cmd;

import com.polynomeer.tinykv.db.Db;
import com.polynomeer.tinykv.resp.CommandError;
import com.polynomeer.tinykv.resp.RespValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command name to handler table, fixed once the server starts, plus request dispatch.
 */
public final class CommandRegistry {
    private final Map<String, Command> cmds = new HashMap<>();

    public CommandRegistry() {
    }

    /**
     * Registry with GET/SET/DELETE/FLUSH/MGET/MSET bound to the given store.
     */
    public static CommandRegistry withDefaults(Db db) {
        CommandRegistry registry = new CommandRegistry();
        StoreCommands.register(registry, db);
        return registry;
    }

    public void register(String name, Command c) {
        cmds.put(name.toUpperCase(Locale.ROOT), c);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(cmds.keySet());
    }

    /**
     * Resolve and run a decoded request.
     * Accepts an array (name then arguments) or a simple string split on whitespace.
     *
     * @throws CommandError on a bad request shape, unknown command or handler-level misuse
     */
    public RespValue dispatch(RespValue request) {
        List<RespValue> argv;
        if (request instanceof RespValue.Array) {
            argv = ((RespValue.Array) request).elements();
        } else if (request instanceof RespValue.SimpleString) {
            argv = split(((RespValue.SimpleString) request).value());
        } else {
            throw new CommandError("Request must be list or simple string");
        }
        if (argv.isEmpty()) {
            throw new CommandError("Missing command");
        }

        String name = commandName(argv.get(0));
        Command c = cmds.get(name);
        if (c == null) {
            throw new CommandError("Unrecognized command: " + name);
        }
        return c.execute(argv.subList(1, argv.size()));
    }

    /**
     * Like {@link #dispatch} but turns a {@link CommandError} into an error reply.
     */
    public RespValue respond(RespValue request) {
        try {
            return dispatch(request);
        } catch (CommandError e) {
            return new RespValue.ErrorReply(e.getMessage());
        }
    }

    // ---------- helpers ----------

    private static String commandName(RespValue v) {
        byte[] raw = null;
        if (v instanceof RespValue.BulkString) {
            raw = ((RespValue.BulkString) v).value();
        } else if (v instanceof RespValue.SimpleString) {
            raw = ((RespValue.SimpleString) v).value();
        }
        if (raw == null) {
            throw new CommandError("Command name must be a string");
        }
        return new String(raw, StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
    }

    /**
     * Split on ASCII whitespace; every token becomes a bulk string.
     */
    static List<RespValue> split(byte[] line) {
        List<RespValue> tokens = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= line.length; i++) {
            boolean ws = i == line.length || isWhitespace(line[i]);
            if (!ws && start < 0) {
                start = i;
            } else if (ws && start >= 0) {
                byte[] tok = new byte[i - start];
                System.arraycopy(line, start, tok, 0, tok.length);
                tokens.add(new RespValue.BulkString(tok));
                start = -1;
            }
        }
        return tokens;
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0x0b || b == '\f';
    }
}
