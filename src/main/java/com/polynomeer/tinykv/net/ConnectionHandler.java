package com.polynomeer.tinykv.net;

import com.polynomeer.tinykv.cmd.CommandRegistry;
import com.polynomeer.tinykv.resp.DisconnectException;
import com.polynomeer.tinykv.resp.RespReader;
import com.polynomeer.tinykv.resp.RespValue;
import com.polynomeer.tinykv.resp.RespWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * Per-connection request loop:
 * await request → decode → dispatch → encode reply → await request, until the peer disconnects.
 * <p>
 * Exactly one reply is written per decoded request, in arrival order.
 * Decode errors (bad tag, bad length, bad integer) and command errors are answered with an
 * error reply and the loop continues; only a disconnect or a transport fault ends it.
 */
public class ConnectionHandler implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    private final RespReader reader;
    private final OutputStream out;
    private final CommandRegistry registry;
    private final String peer;

    public ConnectionHandler(InputStream in, OutputStream out, CommandRegistry registry, String peer) {
        this.reader = new RespReader(in);
        this.out = out;
        this.registry = registry;
        this.peer = peer;
    }

    public static ConnectionHandler forSocket(Socket socket, CommandRegistry registry) throws IOException {
        return new ConnectionHandler(
                new BufferedInputStream(socket.getInputStream()),
                new BufferedOutputStream(socket.getOutputStream()),
                registry,
                String.valueOf(socket.getRemoteSocketAddress()));
    }

    @Override
    public void run() {
        try {
            serve();
        } catch (IOException e) {
            log.warn("Connection {} closed on I/O error: {}", peer, e.toString());
        }
    }

    /**
     * Runs until the peer disconnects; returns normally on disconnect.
     *
     * @throws IOException on a transport fault while reading or writing
     */
    public void serve() throws IOException {
        while (true) {
            RespValue request;
            try {
                request = reader.read();
            } catch (DisconnectException e) {
                if (e.isMidFrame()) {
                    log.warn("Client {} disconnected: {}", peer, e.getMessage());
                } else {
                    log.info("Client disconnected: {}", peer);
                }
                return;
            } catch (RuntimeException e) {
                log.warn("Request error from {}: {}", peer, e.getMessage());
                log.debug("Request error detail", e);
                reply(new RespValue.ErrorReply(messageOf(e)));
                continue;
            }

            reply(registry.respond(request));
        }
    }

    // ---------- helpers ----------

    private void reply(RespValue value) throws IOException {
        out.write(RespWriter.encode(value));
        out.flush();
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
