package com.flintkv.network;

import com.flintkv.FlintKVServer;
import com.flintkv.config.ServerConfig;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.net.Socket;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.flintkv.network.RespTestClient.frame;
import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests that talk raw RESP to a running server.
 */
class TcpServerTest {

    private static final int TEST_PORT = 16379;
    private static final int SHORT_TIMEOUT_PORT = 16380;

    private FlintKVServer server;
    private RespTestClient client;

    @BeforeEach
    void setUp() throws Exception {
        ServerConfig config = ServerConfig.builder()
            .port(TEST_PORT)
            .dir("/tmp/data")
            .dbFilename("dump.rdb")
            .build();
        server = new FlintKVServer(config);
        server.start();

        // Wait for server to be ready
        Thread.sleep(100);

        client = new RespTestClient(TEST_PORT);
    }

    @AfterEach
    void tearDown() throws IOException {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void ping() throws IOException {
        assertThat(server.isRunning()).isTrue();
        assertThat(client.call("PING")).isEqualTo("+PONG\r\n");
    }

    @Test
    void echo() throws IOException {
        assertThat(client.call("ECHO", "hello")).isEqualTo("$5\r\nhello\r\n");
    }

    @Test
    void setAndGet() throws IOException {
        assertThat(client.call("SET", "foo", "bar")).isEqualTo("+OK\r\n");
        assertThat(client.call("GET", "foo")).isEqualTo("$3\r\nbar\r\n");
        assertThat(client.call("GET", "missing")).isEqualTo("$-1\r\n");
    }

    @Test
    void setWithPx_expires() throws Exception {
        assertThat(client.call("SET", "foo", "bar", "PX", "100")).isEqualTo("+OK\r\n");
        assertThat(client.call("GET", "foo")).isEqualTo("$3\r\nbar\r\n");

        Thread.sleep(150);

        assertThat(client.call("GET", "foo")).isEqualTo("$-1\r\n");
    }

    @Test
    void unknownCommand() throws IOException {
        assertThat(client.call("HELLO")).isEqualTo("-ERR unknown command\r\n");
        // Connection stays usable after an error reply
        assertThat(client.call("PING")).isEqualTo("+PONG\r\n");
    }

    @Test
    void configGet() throws IOException {
        assertThat(client.call("CONFIG", "GET", "dir"))
            .isEqualTo("*2\r\n$3\r\ndir\r\n$9\r\n/tmp/data\r\n");
        assertThat(client.call("CONFIG", "GET", "dbfilename"))
            .isEqualTo("*2\r\n$10\r\ndbfilename\r\n$8\r\ndump.rdb\r\n");
    }

    @Test
    void pipelinedCommands_repliedInOrder() throws IOException {
        client.sendRaw(frame("SET", "k", "1") + frame("GET", "k") + frame("PING") + frame("ECHO", "x"));

        assertThat(client.readReply()).isEqualTo("+OK\r\n");
        assertThat(client.readReply()).isEqualTo("$1\r\n1\r\n");
        assertThat(client.readReply()).isEqualTo("+PONG\r\n");
        assertThat(client.readReply()).isEqualTo("$1\r\nx\r\n");
    }

    @Test
    void deepPipeline_everyCommandAnswered() throws IOException {
        int count = 1000;
        StringBuilder batch = new StringBuilder();
        for (int i = 0; i < count; i++) {
            batch.append(frame("PING"));
        }

        client.sendRaw(batch.toString());

        for (int i = 0; i < count; i++) {
            assertThat(client.readReply()).as("reply %d", i).isEqualTo("+PONG\r\n");
        }
        assertThat(client.call("ECHO", "still-open")).isEqualTo("$10\r\nstill-open\r\n");
    }

    @Test
    void deepPipeline_repliesKeepRequestOrder() throws IOException {
        int count = 600;
        StringBuilder batch = new StringBuilder();
        for (int i = 0; i < count; i++) {
            batch.append(frame("SET", "k" + i, "v" + i)).append(frame("GET", "k" + i));
        }

        client.sendRaw(batch.toString());

        for (int i = 0; i < count; i++) {
            String value = "v" + i;
            assertThat(client.readReply()).isEqualTo("+OK\r\n");
            assertThat(client.readReply()).isEqualTo("$" + value.length() + "\r\n" + value + "\r\n");
        }
    }

    @Test
    void pipelineLargerThanReadBuffer_isDrainedInBatches() throws IOException {
        // About 70KB of requests: more than one read buffer and far more than
        // the commands a connection keeps in flight
        int count = 5000;
        StringBuilder batch = new StringBuilder();
        for (int i = 0; i < count; i++) {
            batch.append(frame("ECHO", Integer.toString(i)));
        }

        client.sendRaw(batch.toString());

        for (int i = 0; i < count; i++) {
            String value = Integer.toString(i);
            assertThat(client.readReply()).isEqualTo("$" + value.length() + "\r\n" + value + "\r\n");
        }
        assertThat(server.getMetrics().getCommandCount("echo")).isEqualTo(count);
    }

    @Test
    void setWithPxAtLongBoundary() throws IOException {
        assertThat(client.call("SET", "forever", "x", "PX", String.valueOf(Long.MAX_VALUE))).isEqualTo("+OK\r\n");
        assertThat(client.call("GET", "forever")).isEqualTo("$1\r\nx\r\n");
    }

    @Test
    void partialCommand_droppedAfterFrameTimeout() throws Exception {
        ServerConfig config = ServerConfig.builder()
            .port(SHORT_TIMEOUT_PORT)
            .frameTimeoutMillis(300)
            .build();
        FlintKVServer shortTimeout = new FlintKVServer(config);
        shortTimeout.start();
        try {
            Thread.sleep(100);
            try (RespTestClient idle = new RespTestClient(SHORT_TIMEOUT_PORT);
                 RespTestClient active = new RespTestClient(SHORT_TIMEOUT_PORT)) {
                assertThat(idle.call("PING")).isEqualTo("+PONG\r\n");
                idle.sendRaw("*2\r\n$4\r\nECHO\r\n$5\r\nhel");

                // Closed by the server without any further bytes from the client
                assertThat(idle.readAfterClose()).isEqualTo(-1);
                assertThat(active.call("PING")).isEqualTo("+PONG\r\n");
                assertThat(shortTimeout.getConnectionCount()).isEqualTo(1);
            }
        } finally {
            shortTimeout.stop();
        }
    }

    @Test
    void fragmentedCommand_isBuffered() throws Exception {
        String command = frame("ECHO", "fragmented");
        int split = command.length() / 2;

        client.sendRaw(command.substring(0, 3));
        Thread.sleep(50);
        client.sendRaw(command.substring(3, split));
        Thread.sleep(50);
        client.sendRaw(command.substring(split));

        assertThat(client.readReply()).isEqualTo("$10\r\nfragmented\r\n");
    }

    @Test
    void largeValue_roundTrip() throws IOException {
        // Larger than the initial read buffer, forcing it to grow
        String value = "v".repeat(100 * 1024);

        assertThat(client.call("SET", "big", value)).isEqualTo("+OK\r\n");
        assertThat(client.call("GET", "big")).isEqualTo("$" + value.length() + "\r\n" + value + "\r\n");
    }

    @Test
    void malformedInput_closesConnection() throws IOException {
        client.sendRaw("GARBAGE\r\n");

        assertThat(client.readAfterClose()).isEqualTo(-1);
        assertThat(server.getMetrics().getTotalProtocolErrors()).isEqualTo(1);
    }

    @Test
    void malformedInput_doesNotAffectOtherClients() throws IOException {
        try (RespTestClient other = new RespTestClient(TEST_PORT)) {
            other.sendRaw("*1\r\n+PING\r\n");
            assertThat(other.readAfterClose()).isEqualTo(-1);
        }

        assertThat(client.call("PING")).isEqualTo("+PONG\r\n");
    }

    @Test
    void concurrentClients_seeEachOthersWrites() throws Exception {
        int numClients = 10;
        int opsPerClient = 50;
        ExecutorService executor = Executors.newFixedThreadPool(numClients);
        CountDownLatch latch = new CountDownLatch(numClients);
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();

        for (int c = 0; c < numClients; c++) {
            final int clientId = c;
            executor.submit(() -> {
                try (RespTestClient worker = new RespTestClient(TEST_PORT)) {
                    for (int i = 0; i < opsPerClient; i++) {
                        String key = "client" + clientId + "-key" + i;
                        String value = "value" + i;
                        assertThat(worker.call("SET", key, value)).isEqualTo("+OK\r\n");
                        assertThat(worker.call("GET", key))
                            .isEqualTo("$" + value.length() + "\r\n" + value + "\r\n");
                    }
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(failures).isEmpty();

        assertThat(client.call("GET", "client3-key7")).isEqualTo("$6\r\nvalue7\r\n");
        assertThat(server.getStore().size()).isEqualTo(numClients * opsPerClient);
    }

    @Test
    void stop_releasesPort() throws Exception {
        client.close();
        client = null;
        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThatThrownBy(() -> new Socket("localhost", TEST_PORT).close())
            .isInstanceOf(IOException.class);
    }
}
