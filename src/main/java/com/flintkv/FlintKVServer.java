package com.flintkv;

import com.flintkv.command.CommandDispatcher;
import com.flintkv.config.ServerConfig;
import com.flintkv.core.InMemoryStore;
import com.flintkv.network.TcpServer;
import com.flintkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * FlintKV Server entry point.
 * Wires the keyspace, config and dispatcher together and serves RESP over TCP.
 */
public class FlintKVServer {

    private static final Logger logger = LoggerFactory.getLogger(FlintKVServer.class);

    private static final String VERSION = "1.0.0";

    private final ServerConfig config;
    private final InMemoryStore store;
    private final MetricsCollector metrics;
    private final CommandDispatcher dispatcher;
    private final TcpServer tcpServer;
    private final CountDownLatch shutdownLatch;

    /**
     * Create a server with default settings on the given port.
     *
     * @param port the port to listen on
     */
    public FlintKVServer(int port) {
        this(ServerConfig.builder().port(port).build());
    }

    /**
     * Create a new FlintKV server.
     *
     * @param config the startup configuration
     */
    public FlintKVServer(ServerConfig config) {
        this(config, new InMemoryStore(), new MetricsCollector());
    }

    /**
     * Create a server with custom store and metrics.
     *
     * @param config  the startup configuration
     * @param store   the keyspace to serve
     * @param metrics the metrics collector to use
     */
    public FlintKVServer(ServerConfig config, InMemoryStore store, MetricsCollector metrics) {
        this.config = config;
        this.store = store;
        this.metrics = metrics;
        this.shutdownLatch = new CountDownLatch(1);
        this.dispatcher = new CommandDispatcher(store, config);
        this.tcpServer = new TcpServer(config, dispatcher, metrics);
        metrics.bindStore(store);
    }

    /**
     * Start the server.
     */
    public void start() throws IOException {
        logger.info("Starting FlintKV Server v{}", VERSION);
        logger.info("Config: {}", config);

        tcpServer.start();

        logger.info("FlintKV Server started successfully");
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }, "flintkv-shutdown"));

        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (shutdownLatch.getCount() == 0) {
            return;
        }
        logger.info("Stopping FlintKV Server");

        tcpServer.stop();

        logger.info("Keyspace held {} live keys at shutdown", store.size());
        logger.info("{}", metrics.summary());

        shutdownLatch.countDown();
        logger.info("FlintKV Server stopped");
    }

    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    public InMemoryStore getStore() {
        return store;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        ServerConfig.Builder builder = ServerConfig.builder();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                case "-p":
                    String portValue = requireValue(args, i++, "--port");
                    try {
                        builder.port(Integer.parseInt(portValue));
                    } catch (NumberFormatException e) {
                        exitWithError("Invalid port number: " + portValue);
                    } catch (IllegalArgumentException e) {
                        exitWithError(e.getMessage());
                    }
                    break;
                case "--dir":
                    builder.dir(requireValue(args, i++, "--dir"));
                    break;
                case "--dbfilename":
                    builder.dbFilename(requireValue(args, i++, "--dbfilename"));
                    break;
                case "--help":
                case "-h":
                    printHelp();
                    return;
                case "--version":
                case "-v":
                    System.out.println("FlintKV Server v" + VERSION);
                    return;
                default:
                    exitWithError("Unknown option: " + args[i]);
            }
        }

        FlintKVServer server = new FlintKVServer(builder.build());
        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index + 1 >= args.length) {
            exitWithError(option + " requires a value");
        }
        return args[index + 1];
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("FlintKV Server - in-memory key-value store speaking RESP");
        System.out.println();
        System.out.println("Usage: flintkv [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -p, --port <port>            Port to listen on (default: " + ServerConfig.DEFAULT_PORT + ")");
        System.out.println("      --dir <path>             Directory reported by CONFIG GET dir (default: "
                + ServerConfig.DEFAULT_DIR + ")");
        System.out.println("      --dbfilename <name>      File name reported by CONFIG GET dbfilename (default: "
                + ServerConfig.DEFAULT_DB_FILENAME + ")");
        System.out.println("  -h, --help                   Show this help message");
        System.out.println("  -v, --version                Show version");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  FLINTKV_PORT, FLINTKV_DIR, FLINTKV_DBFILENAME");
        System.out.println("  FLINTKV_WORKER_THREADS     Command worker threads (default: "
                + ServerConfig.DEFAULT_WORKER_THREADS + ")");
        System.out.println("  FLINTKV_FRAME_TIMEOUT_MS   Drop clients holding a partial command this long (default: "
                + ServerConfig.DEFAULT_FRAME_TIMEOUT_MS + ")");
        System.out.println();
    }
}
