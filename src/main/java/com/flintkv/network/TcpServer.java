package com.flintkv.network;

import com.flintkv.command.CommandDispatcher;
import com.flintkv.config.ServerConfig;
import com.flintkv.util.ByteBufferPool;
import com.flintkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RESP listener. A single selector thread accepts connections, moves bytes and
 * drops connections whose partial frames have gone stale; commands run on a
 * shared worker pool sized by {@link ServerConfig#getWorkerThreads()}.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);
    // Upper bound on how late a stale connection is noticed
    private static final long SWEEP_INTERVAL_MS = 250;

    private final ServerConfig config;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final ByteBufferPool bufferPool;
    private final ExecutorService workerPool;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<SocketChannel, ConnectionHandler> connections = new ConcurrentHashMap<>();

    private Selector selector;
    private ServerSocketChannel serverChannel;
    private Thread eventLoopThread;

    public TcpServer(ServerConfig config, CommandDispatcher dispatcher, MetricsCollector metrics) {
        this(config, dispatcher, metrics, new ByteBufferPool());
    }

    /**
     * Create a server with a custom read buffer pool.
     *
     * @param config     port, worker count and frame timeout
     * @param dispatcher executes decoded commands
     * @param metrics    the metrics collector
     * @param bufferPool pool that per-connection read buffers are checked out of
     */
    public TcpServer(ServerConfig config, CommandDispatcher dispatcher, MetricsCollector metrics,
            ByteBufferPool bufferPool) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.bufferPool = bufferPool;
        this.workerPool = newWorkerPool(config.getWorkerThreads());
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger threadIds = new AtomicInteger();
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(threads * 1000),
                r -> {
                    Thread t = new Thread(r, "flintkv-worker-" + threadIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Bind the listening socket and start the selector thread.
     *
     * @throws IOException if the port cannot be bound
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }

        try {
            selector = Selector.open();
            serverChannel = ServerSocketChannel.open();
            serverChannel.configureBlocking(false);
            serverChannel.socket().setReuseAddress(true);
            serverChannel.bind(new InetSocketAddress(config.getPort()));
            serverChannel.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException e) {
            running.set(false);
            releaseResources();
            throw e;
        }

        eventLoopThread = new Thread(this::runEventLoop, "flintkv-server-" + config.getPort());
        eventLoopThread.start();

        logger.info("Listening on port {} with {} worker threads", config.getPort(), config.getWorkerThreads());
    }

    private void runEventLoop() {
        long lastSweep = System.currentTimeMillis();
        try {
            while (running.get()) {
                try {
                    selector.select(SWEEP_INTERVAL_MS);
                } catch (IOException e) {
                    logger.error("Selector error: {}", e.getMessage());
                    continue;
                }

                Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
                while (keys.hasNext()) {
                    SelectionKey key = keys.next();
                    keys.remove();
                    if (key.isValid()) {
                        handleKey(key);
                    }
                }

                long now = System.currentTimeMillis();
                if (now - lastSweep >= SWEEP_INTERVAL_MS) {
                    closeStaleConnections(now);
                    lastSweep = now;
                }
            }
        } finally {
            releaseResources();
        }
    }

    private void handleKey(SelectionKey key) {
        if (key.isAcceptable()) {
            acceptConnection();
            return;
        }

        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        try {
            boolean open = !key.isReadable() || handler.handleRead();
            if (open && key.isValid() && key.isWritable()) {
                open = handler.handleWrite();
            }
            if (!open) {
                handler.close();
            }
        } catch (CancelledKeyException e) {
            logger.trace("Key cancelled for {}", handler.getRemoteAddress());
        } catch (RuntimeException e) {
            logger.error("Unexpected error on connection {}: {}", handler.getRemoteAddress(), e.getMessage(), e);
            handler.close();
        }
    }

    private void acceptConnection() {
        SocketChannel client = null;
        try {
            client = serverChannel.accept();
            if (client == null) {
                return;
            }
            client.configureBlocking(false);
            client.socket().setTcpNoDelay(true);
            client.socket().setKeepAlive(true);

            SelectionKey key = client.register(selector, SelectionKey.OP_READ);
            ConnectionHandler handler = new ConnectionHandler(key, dispatcher, metrics, this,
                    workerPool, bufferPool, config.getFrameTimeoutMillis());
            key.attach(handler);
            connections.put(client, handler);

            logger.debug("Accepted connection from {}", handler.getRemoteAddress());
        } catch (IOException e) {
            logger.warn("Failed to accept connection: {}", e.getMessage());
            if (client != null) {
                try {
                    client.close();
                } catch (IOException closeError) {
                    logger.debug("Error closing rejected channel: {}", closeError.getMessage());
                }
            }
        }
    }

    private void closeStaleConnections(long now) {
        for (ConnectionHandler handler : connections.values()) {
            if (handler.hasStaleFrame(now)) {
                logger.warn("Closing {}: partial command pending for more than {}ms",
                        handler.getRemoteAddress(), config.getFrameTimeoutMillis());
                handler.close();
            }
        }
    }

    /**
     * Stop accepting, close every connection and wait for the selector thread to exit.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping server on port {}", config.getPort());
        selector.wakeup();

        if (eventLoopThread != Thread.currentThread()) {
            try {
                eventLoopThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void releaseResources() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        for (ConnectionHandler handler : connections.values()) {
            handler.close();
        }
        connections.clear();

        if (serverChannel != null) {
            try {
                serverChannel.close();
            } catch (IOException e) {
                logger.debug("Error closing server channel: {}", e.getMessage());
            }
        }
        if (selector != null) {
            try {
                selector.close();
            } catch (IOException e) {
                logger.debug("Error closing selector: {}", e.getMessage());
            }
        }

        logger.info("Server on port {} stopped", config.getPort());
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Forget a connection. Called by ConnectionHandler when it closes.
     */
    void removeConnection(SocketChannel channel) {
        connections.remove(channel);
    }
}
