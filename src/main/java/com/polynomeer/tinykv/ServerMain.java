package com.polynomeer.tinykv;

import com.polynomeer.tinykv.net.Server;
import com.polynomeer.tinykv.net.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(name = "tinykv-server",
         mixinStandardHelpOptions = true,
         version = "tinykv 0.1.0",
         description = "In-memory key-value server speaking a RESP-like protocol")
public class ServerMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ServerMain.class);

    @Option(names = {"-H", "--host"},
            description = "Bind address (default: ${DEFAULT-VALUE})",
            defaultValue = ServerConfig.DEFAULT_HOST)
    String host;

    @Option(names = {"-p", "--port"},
            description = "Bind port, 0 for ephemeral (default: ${DEFAULT-VALUE})",
            defaultValue = "" + ServerConfig.DEFAULT_PORT)
    int port;

    @Option(names = {"-m", "--max-clients"},
            description = "Maximum concurrently served connections (default: ${DEFAULT-VALUE})",
            defaultValue = "" + ServerConfig.DEFAULT_MAX_CLIENTS)
    int maxClients;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ServerMain()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        Server server = Server.create(config());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                log.warn("Error during shutdown: {}", e.toString());
            }
        }, "tinykv-shutdown"));

        server.start();
        server.awaitTermination(); // blocking until shutdown
        return 0;
    }

    ServerConfig config() {
        return new ServerConfig(host, port, maxClients);
    }
}
