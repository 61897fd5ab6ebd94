package config;

import org.junit.jupiter.api.Test;
import protocol.RespProtocol;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void testDefaults() {
        ServerConfig config = new ServerConfig();

        assertEquals(6379, config.getPort());
        assertEquals("0.0.0.0", config.getBindAddress());
        assertEquals(RespProtocol.DEFAULT_MAX_BULK_LENGTH, config.getMaxBulkLength());
        assertEquals(RespProtocol.DEFAULT_MAX_MULTIBULK_LENGTH, config.getMaxMultibulkLength());
        assertEquals(0, config.getIdleTimeoutSeconds());
        assertEquals(100, config.getSweepIntervalMillis());
    }

    @Test
    void testParseCommandLineArgs() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{
                "--port", "7000",
                "--bind", "127.0.0.1",
                "--max-bulk-length", "1024",
                "--max-multibulk-length", "16",
                "--max-query-buffer", "4096",
                "--idle-timeout", "30",
                "--sweep-interval", "0"
        });

        assertEquals(7000, config.getPort());
        assertEquals("127.0.0.1", config.getBindAddress());
        assertEquals(1024, config.getMaxBulkLength());
        assertEquals(16, config.getMaxMultibulkLength());
        assertEquals(4096, config.getMaxQueryBufferBytes());
        assertEquals(30, config.getIdleTimeoutSeconds());
        assertEquals(0, config.getSweepIntervalMillis());
    }

    @Test
    void testInvalidValuesKeepDefaults() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{
                "--port", "not-a-number",
                "--max-bulk-length", "0",
                "--idle-timeout", "-1"
        });

        assertEquals(6379, config.getPort());
        assertEquals(RespProtocol.DEFAULT_MAX_BULK_LENGTH, config.getMaxBulkLength());
        assertEquals(0, config.getIdleTimeoutSeconds());
    }

    @Test
    void testPortOutOfRangeIsIgnored() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{"--port", "70000"});

        assertEquals(6379, config.getPort());
    }

    @Test
    void testQueryBufferAboveArrayLimitIsIgnored() {
        ServerConfig config = new ServerConfig();
        long defaultLimit = config.getMaxQueryBufferBytes();

        config.parseCommandLineArgs(new String[]{"--max-query-buffer", "4294967296"});
        assertEquals(defaultLimit, config.getMaxQueryBufferBytes());

        config.parseCommandLineArgs(new String[]{"--max-query-buffer", String.valueOf(RespProtocol.MAX_REQUEST_BUFFER_LENGTH)});
        assertEquals(RespProtocol.MAX_REQUEST_BUFFER_LENGTH, config.getMaxQueryBufferBytes());
    }

    @Test
    void testUnknownAndDanglingOptionsAreIgnored() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{"--dir", "/tmp", "--port"});

        assertEquals(6379, config.getPort());
    }
}
