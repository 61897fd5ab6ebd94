package server;

import command.CommandHandler;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import protocol.RespDecoder;
import protocol.RespEncoder;
import protocol.RespProtocol;
import protocol.RespProtocolException;
import protocol.RespReader;
import protocol.RespValue;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;

/**
 * 클라이언트 연결 하나를 처리합니다. 읽은 바이트를 버퍼에 쌓고, 완성된 요청을 모두 처리한 뒤 한 번에 flush 합니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    private static final int READ_CHUNK_SIZE = 16 * 1024;

    private final Socket clientSocket;
    private final CommandHandler commandHandler;
    private final RespReader reader;
    private final long maxQueryBufferBytes;
    private final int idleTimeoutMillis;

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler, ServerConfig config) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
        this.reader = new RespReader(new RespDecoder(config.getMaxBulkLength(), config.getMaxMultibulkLength()));
        this.maxQueryBufferBytes = queryBufferLimit(config.getMaxQueryBufferBytes());
        this.idleTimeoutMillis = idleTimeoutMillis(config.getIdleTimeoutSeconds());
    }

    /**
     * 처리 후 남은 버퍼에 한 번 더 읽은 청크를 붙여도 {@link RespReader}의 최대 크기를 넘지 않도록 제한합니다.
     */
    static long queryBufferLimit(long configured) {
        return Math.min(configured, RespProtocol.MAX_REQUEST_BUFFER_LENGTH - READ_CHUNK_SIZE);
    }

    /** 0 이하는 타임아웃 없음(0) */
    static int idleTimeoutMillis(int seconds) {
        if (seconds <= 0) {
            return 0;
        }
        return (int) Math.min(seconds * 1000L, Integer.MAX_VALUE);
    }

    @Override
    public void run() {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());

        try (Socket socket = clientSocket;
             InputStream inputStream = socket.getInputStream();
             OutputStream outputStream = new BufferedOutputStream(socket.getOutputStream())) {

            socket.setSoTimeout(idleTimeoutMillis);
            socket.setTcpNoDelay(true);
            handleClientLoop(inputStream, outputStream, clientAddress);

        } catch (SocketTimeoutException e) {
            log.info("Closing idle client {}", clientAddress);
        } catch (SocketException e) {
            log.debug("Client disconnected: {} ({})", clientAddress, e.getMessage());
        } catch (IOException e) {
            log.warn("Error handling client {}: {}", clientAddress, e.getMessage());
        }

        log.debug("Client connection closed: {}", clientAddress);
    }

    private void handleClientLoop(InputStream inputStream, OutputStream outputStream, String clientAddress)
            throws IOException {
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        int read;
        while ((read = inputStream.read(chunk)) != IOUtils.EOF) {
            reader.feed(chunk, 0, read);
            boolean keepOpen = processBuffered(outputStream, clientAddress);
            outputStream.flush();
            if (!keepOpen) {
                return;
            }
        }
    }

    /**
     * 버퍼에 쌓인 완성된 요청을 모두 처리합니다.
     *
     * <p>프레이밍 오류가 나면 다시 맞출 경계가 없으므로 버퍼에 남은 바이트를 모두 버립니다.
     * 같은 청크에서 오류 프레임 뒤에 파이프라인으로 보낸 명령은 응답도 오류도 받지 못하고,
     * 다음에 읽은 바이트부터 새 요청으로 해석합니다.
     *
     * @return 연결을 유지해야 하면 true
     */
    private boolean processBuffered(OutputStream outputStream, String clientAddress) throws IOException {
        while (true) {
            RespValue request;
            try {
                request = reader.next();
            } catch (RespProtocolException e) {
                log.debug("Protocol error from {}: {}", clientAddress, e.getMessage());
                sendResponse(outputStream, CommandHandler.errorReply("Protocol error: " + e.getMessage()));
                reader.discard();
                return true;
            }
            if (request == null) {
                break;
            }

            RespValue response = commandHandler.handle(request);
            if (response != null) {
                sendResponse(outputStream, response);
            }
        }

        if (reader.buffered() > maxQueryBufferBytes) {
            log.warn("Closing client {}: query buffer of {} bytes exceeds {}",
                    clientAddress, reader.buffered(), maxQueryBufferBytes);
            sendResponse(outputStream, CommandHandler.errorReply("max query buffer length exceeded"));
            return false;
        }
        return true;
    }

    private void sendResponse(OutputStream outputStream, RespValue response) throws IOException {
        outputStream.write(RespEncoder.encode(response));
    }
}
