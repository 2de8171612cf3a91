package com.flintkv.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Startup configuration for a FlintKV server.
 *
 * Values are resolved once, in this order: built-in defaults, environment
 * variables ({@code FLINTKV_PORT}, {@code FLINTKV_DIR}, {@code FLINTKV_DBFILENAME},
 * {@code FLINTKV_WORKER_THREADS}, {@code FLINTKV_FRAME_TIMEOUT_MS}), system
 * properties ({@code flintkv.port}, {@code flintkv.dir}, {@code flintkv.dbfilename},
 * {@code flintkv.worker.threads}, {@code flintkv.frame.timeout.ms}), then explicit
 * builder calls (command-line flags). The result is read-only.
 *
 * The {@code dir} and {@code dbfilename} settings are reported through
 * {@code CONFIG GET} only; no file is read or written at that location.
 */
public final class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_DIR = "/default/path";
    public static final String DEFAULT_DB_FILENAME = "dump.rdb";
    public static final int DEFAULT_WORKER_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());
    public static final long DEFAULT_FRAME_TIMEOUT_MS = 30_000;

    public static final String DIR = "dir";
    public static final String DB_FILENAME = "dbfilename";

    private final int port;
    private final int workerThreads;
    private final long frameTimeoutMillis;
    // Settings visible to CONFIG GET
    private final Map<String, String> parameters;

    private ServerConfig(Builder builder) {
        this.port = builder.port;
        this.workerThreads = builder.workerThreads;
        this.frameTimeoutMillis = builder.frameTimeoutMillis;
        this.parameters = Map.of(DIR, builder.dir, DB_FILENAME, builder.dbFilename);
    }

    /**
     * Create a config builder seeded from defaults, environment and system properties.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a config from defaults only, ignoring environment and system properties.
     */
    public static ServerConfig defaults() {
        return new ServerConfig(new Builder(false));
    }

    public int getPort() {
        return port;
    }

    /**
     * Threads executing commands; connections share this pool.
     */
    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * How long a connection may hold a partial command before it is dropped.
     */
    public long getFrameTimeoutMillis() {
        return frameTimeoutMillis;
    }

    public String getDir() {
        return parameters.get(DIR);
    }

    public String getDbFilename() {
        return parameters.get(DB_FILENAME);
    }

    /**
     * Look up a parameter visible to {@code CONFIG GET}.
     *
     * @param name the parameter name, matched exactly
     * @return the value, or empty if there is no such parameter
     */
    public Optional<String> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(parameters.get(name));
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
               "port=" + port +
               ", workerThreads=" + workerThreads +
               ", frameTimeoutMillis=" + frameTimeoutMillis +
               ", dir='" + getDir() + '\'' +
               ", dbfilename='" + getDbFilename() + '\'' +
               '}';
    }

    private static String readSetting(String envKey, String propKey) {
        String value = System.getProperty(propKey);
        if (value == null || value.isEmpty()) {
            value = System.getenv(envKey);
        }
        return value != null && !value.isEmpty() ? value : null;
    }

    /**
     * Builder for ServerConfig.
     */
    public static class Builder {
        private int port = DEFAULT_PORT;
        private String dir = DEFAULT_DIR;
        private String dbFilename = DEFAULT_DB_FILENAME;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private long frameTimeoutMillis = DEFAULT_FRAME_TIMEOUT_MS;

        Builder() {
            this(true);
        }

        private Builder(boolean readEnvironment) {
            if (!readEnvironment) {
                return;
            }
            String portValue = readSetting("FLINTKV_PORT", "flintkv.port");
            if (portValue != null) {
                try {
                    port(Integer.parseInt(portValue.trim()));
                    logger.info("Using configured port {}", port);
                } catch (IllegalArgumentException e) {
                    logger.warn("Invalid port setting: {}, using default {}", portValue, DEFAULT_PORT);
                }
            }
            String dirValue = readSetting("FLINTKV_DIR", "flintkv.dir");
            if (dirValue != null) {
                dir = dirValue;
            }
            String fileValue = readSetting("FLINTKV_DBFILENAME", "flintkv.dbfilename");
            if (fileValue != null) {
                dbFilename = fileValue;
            }
            String threadsValue = readSetting("FLINTKV_WORKER_THREADS", "flintkv.worker.threads");
            if (threadsValue != null) {
                try {
                    workerThreads(Integer.parseInt(threadsValue.trim()));
                } catch (IllegalArgumentException e) {
                    logger.warn("Invalid worker thread setting: {}, using default {}",
                            threadsValue, DEFAULT_WORKER_THREADS);
                }
            }
            String timeoutValue = readSetting("FLINTKV_FRAME_TIMEOUT_MS", "flintkv.frame.timeout.ms");
            if (timeoutValue != null) {
                try {
                    frameTimeoutMillis(Long.parseLong(timeoutValue.trim()));
                } catch (IllegalArgumentException e) {
                    logger.warn("Invalid frame timeout setting: {}, using default {}",
                            timeoutValue, DEFAULT_FRAME_TIMEOUT_MS);
                }
            }
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Port must be between 1 and 65535, got: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder dir(String dir) {
            if (dir == null) {
                throw new IllegalArgumentException("dir cannot be null");
            }
            this.dir = dir;
            return this;
        }

        public Builder dbFilename(String dbFilename) {
            if (dbFilename == null) {
                throw new IllegalArgumentException("dbfilename cannot be null");
            }
            this.dbFilename = dbFilename;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive, got: " + workerThreads);
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder frameTimeoutMillis(long frameTimeoutMillis) {
            if (frameTimeoutMillis <= 0) {
                throw new IllegalArgumentException("frameTimeoutMillis must be positive, got: " + frameTimeoutMillis);
            }
            this.frameTimeoutMillis = frameTimeoutMillis;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
