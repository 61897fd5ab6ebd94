package server;

import command.CommandHandler;
import config.ServerConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import service.ExpirationSweeper;
import service.StorageService;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Redis 서버의 메인 클래스
 * 서버 시작, 클라이언트 연결 수락과 종료를 담당
 */
@Slf4j
public class RedisServer {

    private final ServerConfig config;
    @Getter
    private final StorageService storageService;
    private final CommandHandler commandHandler;
    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
    private final ExecutorService clientExecutor;

    private ServerSocket serverSocket;
    private Thread acceptor;
    private ExpirationSweeper sweeper;

    public RedisServer(ServerConfig config) {
        this(config, new StorageService());
    }

    public RedisServer(ServerConfig config, StorageService storageService) {
        this.config = config;
        this.storageService = storageService;
        this.commandHandler = new CommandHandler(storageService);

        AtomicInteger clientThreads = new AtomicInteger();
        this.clientExecutor = Executors.newCachedThreadPool(runnable ->
                new Thread(runnable, "redis-client-" + clientThreads.incrementAndGet()));
    }

    /**
     * 서버 소켓을 바인드하고 연결 수락 스레드를 시작합니다.
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Server already started");
        }
        serverSocket = createServerSocket();

        if (config.getSweepIntervalMillis() > 0) {
            sweeper = new ExpirationSweeper(storageService, config.getSweepIntervalMillis());
            sweeper.start();
        }

        ServerSocket listening = serverSocket;
        acceptor = new Thread(() -> acceptLoop(listening), "redis-acceptor");
        acceptor.start();

        log.info("Redis server started on {}:{}", config.getBindAddress(), getLocalPort());
    }

    /**
     * 실제로 바인드된 포트. 설정 포트가 0이면 OS가 고른 포트입니다.
     */
    public synchronized int getLocalPort() {
        if (serverSocket == null) {
            throw new IllegalStateException("Server not started");
        }
        return serverSocket.getLocalPort();
    }

    /**
     * 수락 스레드가 끝날 때까지 기다립니다.
     */
    public void awaitTermination() throws InterruptedException {
        Thread thread;
        synchronized (this) {
            thread = acceptor;
        }
        if (thread != null) {
            thread.join();
        }
    }

    /**
     * 새 연결 수락을 멈추고 열려 있는 연결을 모두 닫습니다.
     */
    public synchronized void stop() {
        if (serverSocket == null) {
            return;
        }
        IOUtils.closeQuietly(serverSocket, e -> log.warn("Error closing server socket: {}", e.getMessage()));
        if (sweeper != null) {
            sweeper.close();
            sweeper = null;
        }
        for (Socket client : clients) {
            IOUtils.closeQuietly(client, e -> log.debug("Error closing client socket: {}", e.getMessage()));
        }
        clientExecutor.shutdown();
        try {
            if (!clientExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Client handlers did not finish within 5 seconds");
                clientExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            clientExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Redis server stopped");
    }

    private void acceptLoop(ServerSocket listening) {
        while (!listening.isClosed()) {
            try {
                Socket clientSocket = listening.accept();
                log.debug("Client connected: {}", clientSocket.getRemoteSocketAddress());
                dispatch(clientSocket);
            } catch (SocketException e) {
                if (!listening.isClosed()) {
                    log.error("Error accepting client connection: {}", e.getMessage());
                }
            } catch (IOException e) {
                log.error("Error accepting client connection: {}", e.getMessage());
            }
        }
    }

    private void dispatch(Socket clientSocket) {
        clients.add(clientSocket);
        ClientHandler clientHandler = new ClientHandler(clientSocket, commandHandler, config);
        try {
            clientExecutor.execute(() -> {
                try {
                    clientHandler.run();
                } finally {
                    clients.remove(clientSocket);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Server shutting down, dropping connection {}", clientSocket.getRemoteSocketAddress());
            clients.remove(clientSocket);
            IOUtils.closeQuietly(clientSocket, ex -> log.debug("Error closing client socket: {}", ex.getMessage()));
        }
    }

    /**
     * 서버 소켓을 생성하고 설정합니다.
     */
    private ServerSocket createServerSocket() throws IOException {
        ServerSocket socket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(config.getBindAddress(), config.getPort()));
        return socket;
    }
}
