package service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 읽히지 않은 채 만료된 키를 주기적으로 정리합니다. 메모리 회수용일 뿐, 만료 판정의 정확성과는 무관합니다.
 */
@Slf4j
public class ExpirationSweeper implements AutoCloseable {

    private final StorageService storageService;
    private final long intervalMillis;
    private ScheduledExecutorService scheduler;

    public ExpirationSweeper(StorageService storageService, long intervalMillis) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("sweep interval must be positive: " + intervalMillis);
        }
        this.storageService = storageService;
        this.intervalMillis = intervalMillis;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "expiration-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Expiration sweeper started (every {} ms)", intervalMillis);
    }

    /**
     * 한 번 정리를 수행합니다. 예외가 나도 다음 주기는 계속 실행됩니다.
     */
    int sweep() {
        try {
            int removed = storageService.removeExpired();
            if (removed > 0) {
                log.debug("Expired keys removed: {}", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            log.error("Expiration sweep failed", e);
            return 0;
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Expiration sweeper stopped");
    }
}
