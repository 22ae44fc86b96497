package com.polynomeer.tinykv.client;

import com.polynomeer.tinykv.resp.CommandError;
import com.polynomeer.tinykv.resp.RespReader;
import com.polynomeer.tinykv.resp.RespValue;
import com.polynomeer.tinykv.resp.RespWriter;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Blocking client speaking the same codec as the server.
 * One request in flight at a time; not thread-safe.
 */
public class KvClient implements Closeable {

    private final Socket socket;
    private final RespReader reader;
    private final RespWriter writer;

    public KvClient(String host, int port) throws IOException {
        this.socket = new Socket();
        socket.connect(new InetSocketAddress(host, port));
        socket.setTcpNoDelay(true);
        this.reader = new RespReader(new BufferedInputStream(socket.getInputStream()));
        this.writer = new RespWriter(new BufferedOutputStream(socket.getOutputStream()));
    }

    /**
     * Send {@code args} as an array request and return the decoded reply.
     *
     * @throws CommandError if the server answers with an error reply,
     *                      or an argument has no wire encoding
     */
    public RespValue execute(Object... args) throws IOException {
        RespValue request = RespValue.of(Arrays.asList(args));
        writer.write(request);
        writer.flush();
        RespValue reply = reader.read();
        if (reply instanceof RespValue.ErrorReply) {
            throw new CommandError(((RespValue.ErrorReply) reply).asString());
        }
        return reply;
    }

    /**
     * Send a raw, already encoded frame and read one reply without interpreting it.
     */
    public RespValue sendRaw(byte[] frame) throws IOException {
        socket.getOutputStream().write(frame);
        socket.getOutputStream().flush();
        return reader.read();
    }

    public String get(String key) throws IOException {
        return asString(execute("GET", key));
    }

    public long set(String key, String value) throws IOException {
        return asLong(execute("SET", key, value));
    }

    public long delete(String key) throws IOException {
        return asLong(execute("DELETE", key));
    }

    public long flush() throws IOException {
        return asLong(execute("FLUSH"));
    }

    public List<String> mget(String... keys) throws IOException {
        Object[] args = new Object[keys.length + 1];
        args[0] = "MGET";
        System.arraycopy(keys, 0, args, 1, keys.length);
        RespValue reply = execute(args);
        if (!(reply instanceof RespValue.Array)) {
            throw new CommandError("unexpected reply to MGET: " + reply);
        }
        List<String> out = new ArrayList<>();
        for (RespValue v : ((RespValue.Array) reply).elements()) {
            out.add(asString(v));
        }
        return out;
    }

    public long mset(String... keysAndValues) throws IOException {
        Object[] args = new Object[keysAndValues.length + 1];
        args[0] = "MSET";
        System.arraycopy(keysAndValues, 0, args, 1, keysAndValues.length);
        return asLong(execute(args));
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    // ---------- reply conversion ----------

    private static String asString(RespValue v) {
        if (v instanceof RespValue.BulkString) return ((RespValue.BulkString) v).asString();
        if (v instanceof RespValue.SimpleString) return ((RespValue.SimpleString) v).asString();
        if (v instanceof RespValue.RespInteger) return Long.toString(((RespValue.RespInteger) v).value());
        throw new CommandError("unexpected reply: " + v);
    }

    private static long asLong(RespValue v) {
        if (v instanceof RespValue.RespInteger) return ((RespValue.RespInteger) v).value();
        throw new CommandError("unexpected reply: " + v);
    }
}
