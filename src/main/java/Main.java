import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import server.RedisServer;

import java.io.IOException;

/**
 * Redis 서버 애플리케이션의 진입점
 */
@Slf4j
public class Main {

    public static void main(String[] args) throws InterruptedException {
        // 서버 설정 생성 후 명령행 인수로 오버라이드
        ServerConfig config = new ServerConfig();
        config.parseCommandLineArgs(args);

        RedisServer server = new RedisServer(config);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start Redis server on port {}: {}", config.getPort(), e.getMessage());
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "redis-shutdown"));
        server.awaitTermination();
    }
}
