package com.flintkv.network;

import com.flintkv.command.CommandDispatcher;
import com.flintkv.network.protocol.Command;
import com.flintkv.network.protocol.ProtocolException;
import com.flintkv.network.protocol.Reply;
import com.flintkv.network.protocol.RespDecoder;
import com.flintkv.network.protocol.RespEncoder;
import com.flintkv.util.ByteBufferPool;
import com.flintkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.ExecutorService;

/**
 * Handles an individual client connection.
 *
 * Reads and writes happen on the selector thread; commands run one at a time
 * on the worker pool so replies leave in request order. Once {@link #MAX_PENDING}
 * commands and replies are in flight the handler stops reading from the socket.
 * Undecoded bytes stay in the read buffer and reading resumes as replies are
 * flushed.
 */
public class ConnectionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);
    private static final int WRITE_BUFFER_SIZE = 64 * 1024;
    // Commands queued or running plus replies not yet copied to the write buffer
    static final int MAX_PENDING = 128;
    // Largest single frame: maximum argument plus generous room for headers
    static final int MAX_READ_BUFFER_SIZE = RespDecoder.MAX_BULK_LENGTH + 64 * 1024;

    private final SelectionKey key;
    private final SocketChannel channel;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private final ExecutorService workerPool;
    private final ByteBufferPool bufferPool;
    private final long frameTimeoutMillis;
    private final String clientAddress;

    private final Object readLock = new Object();
    private ByteBuffer readBuffer; // Replaced when grown, returned to the pool on close
    private boolean readSuspended;
    private long incompleteFrameSince; // 0 while no partial frame is buffered

    // Guarded by this
    private final Queue<Command> pendingCommands = new ArrayDeque<>();
    private final Queue<ByteBuffer> pendingResponses = new ArrayDeque<>();
    private final ByteBuffer writeBuffer;
    private ByteBuffer currentResponse;
    private boolean commandInProgress;
    private boolean writeInProgress;
    private boolean closed;

    private final Object interestOpsLock = new Object();

    /**
     * Create a handler for a freshly registered client channel.
     *
     * @param key                the channel's selection key, registered for reads
     * @param dispatcher         executes decoded commands
     * @param metrics            the metrics collector
     * @param server             the owning server, told when the connection closes
     * @param workerPool         pool that runs commands
     * @param bufferPool         pool the read buffer is checked out of
     * @param frameTimeoutMillis how long a partial frame may sit in the read buffer
     */
    public ConnectionHandler(SelectionKey key, CommandDispatcher dispatcher, MetricsCollector metrics,
            TcpServer server, ExecutorService workerPool, ByteBufferPool bufferPool, long frameTimeoutMillis) {
        this.key = key;
        this.channel = (SocketChannel) key.channel();
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.server = server;
        this.workerPool = workerPool;
        this.bufferPool = bufferPool;
        this.frameTimeoutMillis = frameTimeoutMillis;
        this.readBuffer = bufferPool.acquire();
        this.writeBuffer = ByteBuffer.allocateDirect(WRITE_BUFFER_SIZE);
        this.clientAddress = describeRemote(channel);
        metrics.connectionOpened();
    }

    private static String describeRemote(SocketChannel channel) {
        try {
            return String.valueOf(channel.getRemoteAddress());
        } catch (IOException e) {
            return "unknown";
        }
    }

    /**
     * Handle a read event from the selector.
     *
     * @return true if the connection should stay open
     */
    public boolean handleRead() {
        synchronized (readLock) {
            if (readBuffer == null) {
                return false;
            }
            if (readSuspended) {
                return true;
            }
            try {
                int bytesRead = channel.read(readBuffer);
                if (bytesRead == -1) {
                    logger.debug("Client {} disconnected", clientAddress);
                    return false;
                }
                if (bytesRead > 0) {
                    decodeBufferedCommands();
                }
                return true;
            } catch (ProtocolException e) {
                onProtocolViolation(e);
                return false;
            } catch (IOException e) {
                logger.warn("Read error from {}: {}", clientAddress, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Queue every complete frame in the read buffer, stopping early when the
     * pending limit is reached. Caller holds readLock; the buffer is in write mode
     * before and after.
     */
    private void decodeBufferedCommands() {
        boolean full = false;
        int decoded = 0;
        readBuffer.flip();
        try {
            while (RespDecoder.hasCompleteCommand(readBuffer)) {
                if (!hasCapacity()) {
                    full = true;
                    break;
                }
                enqueue(RespDecoder.decodeCommand(readBuffer));
                decoded++;
            }
        } finally {
            readBuffer.compact();
        }

        setReadSuspended(full);
        if (full || readBuffer.position() == 0) {
            incompleteFrameSince = 0;
            return;
        }

        // The clock restarts whenever a new partial frame begins
        if (incompleteFrameSince == 0 || decoded > 0) {
            incompleteFrameSince = System.currentTimeMillis();
        }
        // Every complete frame was consumed, so a full buffer holds the start of
        // a frame that does not fit yet
        if (readBuffer.position() == readBuffer.capacity()) {
            growReadBuffer();
        }
    }

    private void setReadSuspended(boolean suspend) {
        if (suspend == readSuspended) {
            return;
        }
        readSuspended = suspend;
        updateInterest(SelectionKey.OP_READ, !suspend);
        logger.trace("{} reading from {}", suspend ? "Suspended" : "Resumed", clientAddress);
    }

    private synchronized boolean hasCapacity() {
        int inFlight = pendingCommands.size() + pendingResponses.size() + (commandInProgress ? 1 : 0);
        return inFlight < MAX_PENDING;
    }

    private void enqueue(Command command) {
        synchronized (this) {
            if (closed) {
                return;
            }
            pendingCommands.offer(command);
        }
        runNextCommand();
    }

    /**
     * Hand the next queued command to the worker pool unless one is already running.
     */
    private void runNextCommand() {
        Command next;
        synchronized (this) {
            if (closed || commandInProgress) {
                return;
            }
            next = pendingCommands.poll();
            if (next == null) {
                return;
            }
            commandInProgress = true;
        }
        workerPool.execute(() -> {
            try {
                queueResponse(execute(next));
            } finally {
                synchronized (this) {
                    commandInProgress = false;
                }
                runNextCommand();
            }
        });
    }

    private Reply execute(Command command) {
        long startTime = System.nanoTime();
        Reply reply = dispatcher.dispatch(command);
        metrics.recordCommand(command.getNormalizedName(), System.nanoTime() - startTime);

        if (reply.isError()) {
            metrics.recordError();
        } else if ("GET".equals(command.getNormalizedName())) {
            metrics.recordGet(!reply.isNull());
        }
        logger.trace("{} from {} -> {}", command, clientAddress, reply);
        return reply;
    }

    /**
     * Queue a reply from a worker thread and ask the selector for a write event.
     */
    private void queueResponse(Reply reply) {
        ByteBuffer encoded = RespEncoder.encode(reply);
        synchronized (this) {
            if (closed) {
                return;
            }
            pendingResponses.offer(encoded);
            if (!writeInProgress) {
                writeInProgress = true;
                updateInterest(SelectionKey.OP_WRITE, true);
                key.selector().wakeup();
            }
        }
    }

    /**
     * Handle a write event from the selector.
     *
     * @return true if the connection should stay open
     */
    public boolean handleWrite() {
        synchronized (this) {
            try {
                fillWriteBuffer();
                writeBuffer.flip();
                channel.write(writeBuffer);
                writeBuffer.compact();
                fillWriteBuffer();
            } catch (IOException e) {
                logger.warn("Write error to {}: {}", clientAddress, e.getMessage());
                return false;
            }

            boolean flushed = writeBuffer.position() == 0
                    && pendingResponses.isEmpty()
                    && (currentResponse == null || !currentResponse.hasRemaining());
            if (flushed) {
                writeInProgress = false;
                currentResponse = null;
                updateInterest(SelectionKey.OP_WRITE, false);
            }
        }
        return resumeReading();
    }

    private void fillWriteBuffer() {
        while (writeBuffer.hasRemaining()) {
            if (currentResponse == null || !currentResponse.hasRemaining()) {
                currentResponse = pendingResponses.poll();
                if (currentResponse == null) {
                    return;
                }
            }
            int toCopy = Math.min(writeBuffer.remaining(), currentResponse.remaining());
            int oldLimit = currentResponse.limit();
            currentResponse.limit(currentResponse.position() + toCopy);
            writeBuffer.put(currentResponse);
            currentResponse.limit(oldLimit);
        }
    }

    /**
     * Decode frames left behind while reading was suspended, once room has opened up.
     *
     * @return false if a buffered frame turned out to be malformed
     */
    private boolean resumeReading() {
        synchronized (readLock) {
            if (!readSuspended || readBuffer == null || !hasCapacity()) {
                return true;
            }
            try {
                decodeBufferedCommands();
                return true;
            } catch (ProtocolException e) {
                onProtocolViolation(e);
                return false;
            }
        }
    }

    private void onProtocolViolation(ProtocolException e) {
        logger.warn("Protocol violation from {} (closing connection): {}", clientAddress, e.getMessage());
        metrics.recordProtocolError();
    }

    private void updateInterest(int op, boolean enable) {
        synchronized (interestOpsLock) {
            if (!key.isValid()) {
                return;
            }
            try {
                int ops = key.interestOps();
                key.interestOps(enable ? ops | op : ops & ~op);
            } catch (CancelledKeyException e) {
                logger.trace("Key for {} cancelled while updating interest", clientAddress);
            }
        }
    }

    /**
     * Grow the read buffer to accommodate a larger frame.
     * The buffer is in write mode before and after; unread bytes are preserved.
     */
    private void growReadBuffer() {
        int currentCapacity = readBuffer.capacity();
        if (currentCapacity >= MAX_READ_BUFFER_SIZE) {
            throw new ProtocolException("Command exceeds maximum frame size of " + MAX_READ_BUFFER_SIZE + " bytes");
        }

        int newCapacity = (int) Math.min((long) currentCapacity * 2, MAX_READ_BUFFER_SIZE);
        logger.debug("Growing read buffer from {} to {} bytes for {}", currentCapacity, newCapacity, clientAddress);

        ByteBuffer grown = bufferPool.allocate(newCapacity);
        readBuffer.flip();
        grown.put(readBuffer);
        bufferPool.release(readBuffer);
        readBuffer = grown;
    }

    /**
     * Whether a partial frame has been buffered for longer than the frame timeout.
     *
     * @param nowMillis current time in epoch millis
     */
    boolean hasStaleFrame(long nowMillis) {
        synchronized (readLock) {
            return incompleteFrameSince > 0 && nowMillis - incompleteFrameSince > frameTimeoutMillis;
        }
    }

    /**
     * Close this connection and release its resources. Idempotent.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            pendingCommands.clear();
            pendingResponses.clear();
        }

        server.removeConnection(channel);
        key.cancel();
        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }

        synchronized (readLock) {
            bufferPool.release(readBuffer);
            readBuffer = null;
        }

        metrics.connectionClosed();
        logger.debug("Connection closed: {}", clientAddress);
    }

    public String getRemoteAddress() {
        return clientAddress;
    }
}
