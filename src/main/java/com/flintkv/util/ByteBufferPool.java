package com.flintkv.util;

import java.nio.ByteBuffer;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of reusable connection buffers.
 * A buffer is checked out by exactly one connection and returned when that
 * connection closes; buffers are never shared between live connections.
 */
public final class ByteBufferPool {

    private static final int DEFAULT_BUFFER_SIZE = 16 * 1024; // 16KB
    private static final int DEFAULT_MAX_POOL_SIZE = 64;

    private final int bufferSize;
    private final int maxPoolSize;
    private final boolean direct;
    private final Queue<ByteBuffer> pool;
    private final AtomicInteger pooled;

    /**
     * Create a pool with default settings (16KB direct buffers).
     */
    public ByteBufferPool() {
        this(DEFAULT_BUFFER_SIZE, DEFAULT_MAX_POOL_SIZE, true);
    }

    /**
     * Create a pool with custom settings.
     *
     * @param bufferSize  size of each buffer in bytes
     * @param maxPoolSize maximum number of idle buffers retained
     * @param direct      true for direct buffers (off-heap), false for heap buffers
     */
    public ByteBufferPool(int bufferSize, int maxPoolSize, boolean direct) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, got: " + bufferSize);
        }
        if (maxPoolSize < 0) {
            throw new IllegalArgumentException("maxPoolSize must be non-negative, got: " + maxPoolSize);
        }
        this.bufferSize = bufferSize;
        this.maxPoolSize = maxPoolSize;
        this.direct = direct;
        this.pool = new ConcurrentLinkedQueue<>();
        this.pooled = new AtomicInteger(0);
    }

    /**
     * Check a buffer out of the pool, allocating one if the pool is empty.
     *
     * @return a cleared ByteBuffer owned by the caller until released
     */
    public ByteBuffer acquire() {
        ByteBuffer buffer = pool.poll();
        if (buffer == null) {
            return createBuffer();
        }
        pooled.decrementAndGet();
        buffer.clear();
        return buffer;
    }

    /**
     * Return a buffer to the pool.
     * Buffers of a different size (for example ones that were grown) are dropped.
     *
     * @param buffer the buffer to return
     */
    public void release(ByteBuffer buffer) {
        if (buffer == null || buffer.capacity() != bufferSize || buffer.isDirect() != direct) {
            return;
        }
        if (pooled.incrementAndGet() <= maxPoolSize) {
            buffer.clear();
            pool.offer(buffer);
        } else {
            pooled.decrementAndGet();
        }
    }

    /**
     * Allocate a buffer outside the pool, e.g. when a connection's buffer must grow.
     *
     * @param size the required size
     * @return a new ByteBuffer
     */
    public ByteBuffer allocate(int size) {
        return direct ? ByteBuffer.allocateDirect(size) : ByteBuffer.allocate(size);
    }

    /**
     * Get the number of idle buffers in the pool.
     */
    public int getPoolSize() {
        return pooled.get();
    }

    private ByteBuffer createBuffer() {
        return allocate(bufferSize);
    }
}
