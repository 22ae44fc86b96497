package com.polynomeer.tinykv.net;

/**
 * Listener settings: bind address and the ceiling on concurrently served connections.
 * Port 0 binds an ephemeral port.
 */
public record ServerConfig(String host, int port, int maxClients) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 31337;
    public static final int DEFAULT_MAX_CLIENTS = 64;

    public ServerConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxClients < 1) {
            throw new IllegalArgumentException("maxClients must be at least 1: " + maxClients);
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_MAX_CLIENTS);
    }
}
