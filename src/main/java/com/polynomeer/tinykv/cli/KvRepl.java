package com.polynomeer.tinykv.cli;

import com.polynomeer.tinykv.client.KvClient;
import com.polynomeer.tinykv.net.ServerConfig;
import com.polynomeer.tinykv.resp.CommandError;
import com.polynomeer.tinykv.resp.RespValue;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Interactive shell against a running server.
 *
 * <pre>
 * tinykv-cli --host 127.0.0.1 --port 31337
 * &gt; set foo bar
 * 1
 * &gt; mget foo nope
 * 0) bar
 * 1) (nil)
 * &gt; quit
 * </pre>
 */
@Command(name = "tinykv-cli",
         mixinStandardHelpOptions = true,
         version = "tinykv 0.1.0",
         description = "Interactive client for a tinykv server")
public class KvRepl implements Callable<Integer> {

    @Option(names = {"-H", "--host"},
            description = "Server host (default: ${DEFAULT-VALUE})",
            defaultValue = ServerConfig.DEFAULT_HOST)
    String host;

    @Option(names = {"-p", "--port"},
            description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = "" + ServerConfig.DEFAULT_PORT)
    int port;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new KvRepl()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        try (KvClient client = new KvClient(host, port);
             BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            runRepl(client, in, System.out);
        }
        return 0;
    }

    /**
     * Read-eval-print until "exit", "quit" or end of input.
     * A failed round trip is reported and the loop carries on.
     */
    static void runRepl(KvClient client, BufferedReader in, PrintStream out) throws IOException {
        out.println("Welcome to tinykv. Type 'exit' or 'quit' to quit.");
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                out.println("Goodbye!");
                return;
            }
            line = line.trim();
            if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) {
                out.println("Goodbye!");
                return;
            }
            if (line.isEmpty()) continue;

            String[] parts = line.split("\\s+");
            try {
                out.println(evaluate(client, parts));
            } catch (CommandError e) {
                out.println("(error) " + e.getMessage());
            } catch (IOException e) {
                out.println("Unexpected error: " + e.getMessage());
            }
        }
    }

    private static String evaluate(KvClient client, String[] parts) throws IOException {
        String[] args = Arrays.copyOfRange(parts, 1, parts.length);
        switch (parts[0].toLowerCase(Locale.ROOT)) {
            case "get":
                requireArgs(parts[0], args, 1);
                return orNil(client.get(args[0]));
            case "set":
                requireArgs(parts[0], args, 2);
                return Long.toString(client.set(args[0], args[1]));
            case "delete":
                requireArgs(parts[0], args, 1);
                return Long.toString(client.delete(args[0]));
            case "flush":
                requireArgs(parts[0], args, 0);
                return Long.toString(client.flush());
            case "mget":
                return numbered(client.mget(args));
            case "mset":
                return Long.toString(client.mset(args));
            default:
                // not a known helper: send as-is and let the server decide
                return format(client.execute((Object[]) parts));
        }
    }

    // ---------- formatting ----------

    private static void requireArgs(String name, String[] args, int n) {
        if (args.length != n) {
            throw new CommandError("wrong number of arguments for '" + name.toUpperCase(Locale.ROOT) + "'");
        }
    }

    private static String numbered(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(System.lineSeparator());
            sb.append(i).append(") ").append(orNil(values.get(i)));
        }
        return values.isEmpty() ? "(empty list)" : sb.toString();
    }

    private static String orNil(String s) {
        return s == null ? "(nil)" : s;
    }

    static String format(RespValue v) {
        if (v instanceof RespValue.BulkString) return orNil(((RespValue.BulkString) v).asString());
        if (v instanceof RespValue.SimpleString) return ((RespValue.SimpleString) v).asString();
        if (v instanceof RespValue.RespInteger) return Long.toString(((RespValue.RespInteger) v).value());
        if (v instanceof RespValue.ErrorReply) return "(error) " + ((RespValue.ErrorReply) v).asString();
        if (v instanceof RespValue.Array) {
            List<RespValue> elements = ((RespValue.Array) v).elements();
            if (elements.isEmpty()) return "(empty list)";
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) sb.append(System.lineSeparator());
                sb.append(i).append(") ").append(format(elements.get(i)));
            }
            return sb.toString();
        }
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<RespValue, RespValue> e : ((RespValue.RespMap) v).entries().entrySet()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(format(e.getKey())).append(": ").append(format(e.getValue()));
        }
        return sb.append('}').toString();
    }
}
