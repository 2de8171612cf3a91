package com.flintkv.util;

import com.flintkv.core.InMemoryStore;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collector for FlintKV.
 * Tracks command throughput, latency, keyspace hits and connection counts.
 */
public class MetricsCollector {

    static final List<String> TRACKED_COMMANDS = List.of("ping", "echo", "set", "get", "config");
    static final String OTHER_COMMAND = "other";

    private final MeterRegistry registry;

    // Per-command counters and timers, keyed by lower-case command name
    private final Map<String, Counter> commandCounters;
    private final Map<String, Timer> commandLatency;

    private final Counter getHits;
    private final Counter getMisses;
    private final Counter errors;
    private final Counter protocolErrors;

    private final LongAdder activeConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;
        this.commandCounters = new HashMap<>();
        this.commandLatency = new HashMap<>();

        for (String command : TRACKED_COMMANDS) {
            registerCommand(command);
        }
        registerCommand(OTHER_COMMAND);

        this.getHits = Counter.builder("flintkv.keyspace")
            .tag("result", "hit")
            .description("GET lookups that found a live key")
            .register(registry);

        this.getMisses = Counter.builder("flintkv.keyspace")
            .tag("result", "miss")
            .description("GET lookups that found nothing")
            .register(registry);

        this.errors = Counter.builder("flintkv.errors")
            .tag("kind", "command")
            .description("Error replies sent to clients")
            .register(registry);

        this.protocolErrors = Counter.builder("flintkv.errors")
            .tag("kind", "protocol")
            .description("Connections closed for malformed RESP")
            .register(registry);

        this.activeConnections = new LongAdder();
        Gauge.builder("flintkv.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);
    }

    private void registerCommand(String command) {
        commandCounters.put(command, Counter.builder("flintkv.commands")
            .tag("command", command)
            .description("Commands processed")
            .register(registry));
        commandLatency.put(command, Timer.builder("flintkv.latency")
            .tag("command", command)
            .description("Command dispatch latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry));
    }

    /**
     * Expose keyspace gauges for a store.
     *
     * @param store the store to observe
     */
    public void bindStore(InMemoryStore store) {
        Gauge.builder("flintkv.keyspace.size", store, InMemoryStore::rawSize)
            .description("Entries held, including expired ones not yet evicted")
            .register(registry);
        Gauge.builder("flintkv.keyspace.evictions", store, InMemoryStore::getExpiredEvictions)
            .description("Entries evicted on lookup after expiry")
            .register(registry);
    }

    // Operation recording methods

    public void recordCommand(String name, long durationNanos) {
        String key = name != null ? name.toLowerCase(Locale.ROOT) : OTHER_COMMAND;
        if (!commandCounters.containsKey(key)) {
            key = OTHER_COMMAND;
        }
        commandCounters.get(key).increment();
        commandLatency.get(key).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordGet(boolean hit) {
        if (hit) {
            getHits.increment();
        } else {
            getMisses.increment();
        }
    }

    public void recordError() {
        errors.increment();
    }

    public void recordProtocolError() {
        protocolErrors.increment();
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Getters for metrics values

    public long getCommandCount(String name) {
        Counter counter = commandCounters.get(name.toLowerCase(Locale.ROOT));
        return counter != null ? (long) counter.count() : 0;
    }

    public long getTotalCommands() {
        return (long) commandCounters.values().stream().mapToDouble(Counter::count).sum();
    }

    public long getTotalErrors() {
        return (long) errors.count();
    }

    public long getTotalProtocolErrors() {
        return (long) protocolErrors.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public double getHitRate() {
        double hits = getHits.count();
        double misses = getMisses.count();
        double total = hits + misses;
        return total > 0 ? hits / total : 0.0;
    }

    public double getMeanLatencyMs(String name) {
        Timer timer = commandLatency.get(name.toLowerCase(Locale.ROOT));
        return timer != null ? timer.mean(TimeUnit.MILLISECONDS) : 0.0;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "FlintKV Metrics Summary%n" +
            "=======================%n" +
            "Commands: total=%d, GET=%d, SET=%d, other=%d%n" +
            "Keyspace: hits=%d, misses=%d, hitRate=%.2f%%%n" +
            "Errors: command=%d, protocol=%d%n" +
            "Connections: %d active%n" +
            "Latency (mean): GET=%.3fms, SET=%.3fms",
            getTotalCommands(), getCommandCount("get"), getCommandCount("set"),
            getCommandCount(OTHER_COMMAND),
            (long) getHits.count(), (long) getMisses.count(), getHitRate() * 100,
            getTotalErrors(), getTotalProtocolErrors(),
            getActiveConnections(),
            getMeanLatencyMs("get"), getMeanLatencyMs("set")
        );
    }
}
