package com.polynomeer.tinykv.net;

import com.polynomeer.tinykv.cmd.CommandRegistry;
import com.polynomeer.tinykv.db.Db;
import com.polynomeer.tinykv.db.MemoryDb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking TCP listener with a bounded worker pool.
 * <p>
 * One acceptor thread takes a connection slot before each accept, so once
 * {@code maxClients} connections are being served further clients wait in the
 * listen backlog. Each accepted socket runs a {@link ConnectionHandler} on the pool
 * and gives its slot back when the handler returns. There is no read timeout:
 * an idle client keeps its slot until it disconnects.
 */
public class Server implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private final ServerConfig config;
    private final Db db;
    private final CommandRegistry registry;
    private final Semaphore slots;
    private final Set<Socket> live = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private ExecutorService pool;
    private Thread acceptor;
    private volatile boolean closed;

    public Server(ServerConfig config, Db db, CommandRegistry registry) {
        this.config = config;
        this.db = db;
        this.registry = registry;
        this.slots = new Semaphore(config.maxClients());
    }

    /**
     * Server over a fresh in-memory store with the default command table.
     */
    public static Server create(ServerConfig config) {
        Db db = new MemoryDb();
        return new Server(config, db, CommandRegistry.withDefaults(db));
    }

    /**
     * Bind and start accepting in the background.
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null) throw new IllegalStateException("already started");

        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(config.host(), config.port()));

        pool = Executors.newFixedThreadPool(config.maxClients(), workerThreads());
        acceptor = new Thread(this::acceptLoop, "tinykv-acceptor");
        acceptor.start();

        log.info("Listening on {}:{} (max {} clients)", config.host(), localPort(), config.maxClients());
    }

    public int localPort() {
        return serverSocket.getLocalPort();
    }

    public Db db() {
        return db;
    }

    /**
     * Block until the acceptor stops, i.e. until {@link #close()} is called.
     */
    public void awaitTermination() throws InterruptedException {
        acceptor.join();
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) return;
        closed = true;
        if (serverSocket != null) serverSocket.close();
        if (acceptor != null) acceptor.interrupt();
        for (Socket s : live) {
            closeQuietly(s);
        }
        if (pool != null) pool.shutdownNow();
        log.info("Server stopped");
    }

    // ---------- accept loop ----------

    private void acceptLoop() {
        while (!closed) {
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                slots.release();
                if (closed) return;
                log.warn("Accept failed: {}", e.toString());
                continue;
            }

            live.add(socket);
            log.info("Connection received: {}", socket.getRemoteSocketAddress());
            try {
                pool.execute(() -> serve(socket));
            } catch (RuntimeException e) {
                // pool already shut down
                live.remove(socket);
                closeQuietly(socket);
                slots.release();
            }
        }
    }

    private void serve(Socket socket) {
        try (socket) {
            socket.setTcpNoDelay(true);
            ConnectionHandler.forSocket(socket, registry).run();
        } catch (IOException e) {
            log.warn("Connection {} failed: {}", socket.getRemoteSocketAddress(), e.toString());
        } finally {
            live.remove(socket);
            slots.release();
        }
    }

    // ---------- helpers ----------

    private static ThreadFactory workerThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "tinykv-conn-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            log.debug("Ignoring error closing {}: {}", s, e.toString());
        }
    }
}
