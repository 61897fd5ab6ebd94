package server;

import config.ServerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class RedisServerTest {

    private RedisServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private RedisServer startServer(ServerConfig config) throws IOException {
        config.setPort(0);
        config.setBindAddress("127.0.0.1");
        server = new RedisServer(config);
        server.start();
        return server;
    }

    private RedisServer startServer() throws IOException {
        return startServer(new ServerConfig());
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", server.getLocalPort());
        socket.setSoTimeout(5_000);
        return socket;
    }

    private static String command(String... parts) {
        StringBuilder sb = new StringBuilder();
        sb.append('*').append(parts.length).append("\r\n");
        for (String part : parts) {
            byte[] raw = part.getBytes(StandardCharsets.UTF_8);
            sb.append('$').append(raw.length).append("\r\n").append(part).append("\r\n");
        }
        return sb.toString();
    }

    private static void send(Socket socket, String raw) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(raw.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static String read(Socket socket, int length) throws IOException {
        byte[] reply = new byte[length];
        new DataInputStream(socket.getInputStream()).readFully(reply);
        return new String(reply, StandardCharsets.UTF_8);
    }

    /**
     * A server close can surface as EOF or as a reset, depending on timing.
     */
    private static int readAfterClose(Socket socket) throws IOException {
        try {
            return socket.getInputStream().read();
        } catch (SocketException e) {
            return -1;
        }
    }

    private static void assertReply(Socket socket, String request, String expected) throws IOException {
        send(socket, request);
        assertEquals(expected, read(socket, expected.getBytes(StandardCharsets.UTF_8).length));
    }

    @Test
    void testPingEchoSetGet() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            assertReply(socket, command("PING"), "+PONG\r\n");
            assertReply(socket, command("ECHO", "hey"), "$3\r\nhey\r\n");
            assertReply(socket, command("ECHO", ""), "$0\r\n\r\n");
            assertReply(socket, command("SET", "k", "v"), "+OK\r\n");
            assertReply(socket, command("GET", "k"), "$1\r\nv\r\n");
            assertReply(socket, command("GET", "missing"), "$-1\r\n");
        }
    }

    @Test
    void testEchoWithEmbeddedCrlf() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            assertReply(socket, "*2\r\n$4\r\nECHO\r\n$4\r\na\r\nb\r\n", "$4\r\na\r\nb\r\n");
        }
    }

    @Test
    void testUnknownCommandThenValidCommand() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            assertReply(socket, command("FOO"), "-ERR unknown command 'FOO'\r\n");
            assertReply(socket, command("PING"), "+PONG\r\n");
        }
        assertEquals(0, server.getStorageService().size());
    }

    @Test
    void testPipelinedRequestsAnsweredInOrder() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            String pipeline = command("SET", "a", "1") + command("GET", "a") + command("PING") + command("GET", "b");
            assertReply(socket, pipeline, "+OK\r\n$1\r\n1\r\n+PONG\r\n$-1\r\n");
        }
    }

    @Test
    void testRequestSplitAcrossWrites() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            byte[] request = command("SET", "split", "value").getBytes(StandardCharsets.UTF_8);
            OutputStream out = socket.getOutputStream();
            for (byte b : request) {
                out.write(b);
                out.flush();
            }
            assertEquals("+OK\r\n", read(socket, 5));
            assertReply(socket, command("GET", "split"), "$5\r\nvalue\r\n");
        }
    }

    @Test
    void testExpiryWithPx() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            assertReply(socket, command("SET", "temp", "v", "PX", "100"), "+OK\r\n");
            assertReply(socket, command("GET", "temp"), "$1\r\nv\r\n");

            Thread.sleep(250);

            assertReply(socket, command("GET", "temp"), "$-1\r\n");
        }
    }

    @Test
    void testProtocolErrorKeepsConnectionOpen() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            assertReply(socket, "*x\r\n", "-ERR Protocol error: invalid number 'x'\r\n");
            assertReply(socket, command("PING"), "+PONG\r\n");
        }
    }

    @Test
    void testCommandsPipelinedBehindProtocolErrorAreDropped() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            send(socket, "*x\r\n" + command("SET", "dropped", "v"));
            assertEquals("-ERR Protocol error: invalid number 'x'\r\n", read(socket, 41));

            assertReply(socket, command("GET", "dropped"), "$-1\r\n");
        }
        assertEquals(0, server.getStorageService().size());
    }

    @Test
    void testRpushAndWrongType() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            assertReply(socket, command("RPUSH", "list", "a", "b"), ":2\r\n");
            assertReply(socket, command("GET", "list"),
                    "-WRONGTYPE Operation against a key holding the wrong kind of value\r\n");
        }
    }

    @Test
    void testQueryBufferLimitClosesConnection() throws Exception {
        ServerConfig config = new ServerConfig();
        config.setMaxQueryBufferBytes(64);
        startServer(config);

        try (Socket socket = connect()) {
            StringBuilder partial = new StringBuilder("*1\r\n$1000\r\n");
            for (int i = 0; i < 200; i++) {
                partial.append('x');
            }
            assertReply(socket, partial.toString(), "-ERR max query buffer length exceeded\r\n");
            assertEquals(-1, readAfterClose(socket));
        }
    }

    @Test
    void testIdleConnectionIsClosed() throws Exception {
        ServerConfig config = new ServerConfig();
        config.setIdleTimeoutSeconds(1);
        startServer(config);

        try (Socket socket = connect()) {
            assertReply(socket, command("PING"), "+PONG\r\n");
            InputStream in = socket.getInputStream();
            assertEquals(-1, in.read());
        }
    }

    @Test
    void testConcurrentClientsOnDisjointKeys() throws Exception {
        startServer();
        int clients = 8;
        int keysPerClient = 50;
        ExecutorService executor = Executors.newFixedThreadPool(clients);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int c = 0; c < clients; c++) {
                int client = c;
                futures.add(executor.submit(() -> {
                    try (Socket socket = connect()) {
                        for (int i = 0; i < keysPerClient; i++) {
                            assertReply(socket, command("SET", client + "-" + i, "v" + i), "+OK\r\n");
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(20, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        try (Socket socket = connect()) {
            for (int c = 0; c < clients; c++) {
                for (int i = 0; i < keysPerClient; i++) {
                    String value = "v" + i;
                    assertReply(socket, command("GET", c + "-" + i), "$" + value.length() + "\r\n" + value + "\r\n");
                }
            }
        }
        assertEquals(clients * keysPerClient, server.getStorageService().size());
    }

    @Test
    void testStartTwiceFails() throws Exception {
        startServer();

        assertThrows(IllegalStateException.class, () -> server.start());
    }

    @Test
    void testStopClosesOpenConnections() throws Exception {
        startServer();
        try (Socket socket = connect()) {
            assertReply(socket, command("PING"), "+PONG\r\n");

            server.stop();

            assertEquals(-1, readAfterClose(socket));
        }
    }
}
