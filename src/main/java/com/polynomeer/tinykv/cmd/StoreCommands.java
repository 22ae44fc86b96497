package com.polynomeer.tinykv.cmd;

import com.polynomeer.tinykv.db.Db;
import com.polynomeer.tinykv.db.Key;
import com.polynomeer.tinykv.resp.CommandError;
import com.polynomeer.tinykv.resp.RespValue;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Key-value commands:
 * - GET key            -> value or $-1
 * - SET key value      -> :1
 * - DELETE key         -> :1 if removed, :0 if absent
 * - FLUSH              -> number of entries removed
 * - MGET [key ...]     -> array, $-1 for each missing key
 * - MSET [k v ...]     -> number of pairs applied
 */
public final class StoreCommands {
    private StoreCommands() {
    }

    public static void register(CommandRegistry reg, Db db) {
        reg.register("GET", args -> get(db, args));
        reg.register("SET", args -> set(db, args));
        reg.register("DELETE", args -> delete(db, args));
        reg.register("FLUSH", args -> flush(db, args));
        reg.register("MGET", args -> mget(db, args));
        reg.register("MSET", args -> mset(db, args));
    }

    private static RespValue get(Db db, List<RespValue> args) {
        arity("GET", args, 1);
        return orNull(db.get(key(args.get(0))));
    }

    private static RespValue set(Db db, List<RespValue> args) {
        arity("SET", args, 2);
        db.set(key(args.get(0)), args.get(1));
        return new RespValue.RespInteger(1);
    }

    private static RespValue delete(Db db, List<RespValue> args) {
        arity("DELETE", args, 1);
        return new RespValue.RespInteger(db.delete(key(args.get(0))) ? 1 : 0);
    }

    private static RespValue flush(Db db, List<RespValue> args) {
        arity("FLUSH", args, 0);
        return new RespValue.RespInteger(db.flush());
    }

    private static RespValue mget(Db db, List<RespValue> args) {
        List<Key> keys = new ArrayList<>(args.size());
        for (RespValue a : args) keys.add(key(a));

        List<RespValue> out = new ArrayList<>(keys.size());
        for (RespValue v : db.mget(keys)) out.add(orNull(v));
        return new RespValue.Array(out);
    }

    /**
     * All keys are validated before the store is touched, so a rejected MSET changes nothing.
     */
    private static RespValue mset(Db db, List<RespValue> args) {
        if (args.size() % 2 != 0) {
            throw new CommandError("MSET requires an even number of arguments");
        }
        List<Map.Entry<Key, RespValue>> pairs = new ArrayList<>(args.size() / 2);
        for (int i = 0; i < args.size(); i += 2) {
            pairs.add(new AbstractMap.SimpleImmutableEntry<>(key(args.get(i)), args.get(i + 1)));
        }
        return new RespValue.RespInteger(db.mset(pairs));
    }

    // ---------- helpers ----------

    private static void arity(String name, List<RespValue> args, int expected) {
        if (args.size() != expected) throw wrongArity(name);
    }

    private static CommandError wrongArity(String name) {
        return new CommandError("wrong number of arguments for '" + name + "'");
    }

    private static Key key(RespValue v) {
        if (v instanceof RespValue.BulkString && !((RespValue.BulkString) v).isNull()) {
            return Key.of(((RespValue.BulkString) v).value());
        }
        if (v instanceof RespValue.SimpleString) {
            return Key.of(((RespValue.SimpleString) v).value());
        }
        throw new CommandError("key must be a string");
    }

    private static RespValue orNull(RespValue v) {
        return v == null ? RespValue.BulkString.NULL : v;
    }
}
