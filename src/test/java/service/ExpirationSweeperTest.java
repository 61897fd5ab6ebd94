package service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpirationSweeperTest {

    @Mock
    private StorageService failingStorage;

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testSweepRemovesExpiredEntries() {
        MutableClock clock = new MutableClock(1_000);
        StorageService storage = new StorageService(clock);
        storage.set(bytes("a"), bytes("1"), 1_010L);
        storage.set(bytes("b"), bytes("2"));
        clock.advance(10);

        ExpirationSweeper sweeper = new ExpirationSweeper(storage, 100);

        assertEquals(1, sweeper.sweep());
        assertEquals(0, sweeper.sweep());
        assertTrue(storage.exists(bytes("b")));
    }

    @Test
    void testScheduledSweepRuns() {
        StorageService storage = spy(new StorageService(new MutableClock(0)));

        try (ExpirationSweeper sweeper = new ExpirationSweeper(storage, 10)) {
            sweeper.start();
            verify(storage, timeout(2_000).atLeast(2)).removeExpired();
        }
    }

    @Test
    void testSweepFailureDoesNotPropagate() {
        when(failingStorage.removeExpired()).thenThrow(new IllegalStateException("boom"));

        ExpirationSweeper sweeper = new ExpirationSweeper(failingStorage, 100);

        assertEquals(0, sweeper.sweep());
        verify(failingStorage).removeExpired();
    }

    @Test
    void testRejectsNonPositiveInterval() {
        StorageService storage = new StorageService();

        assertThrows(IllegalArgumentException.class, () -> new ExpirationSweeper(storage, 0));
        assertThrows(IllegalArgumentException.class, () -> new ExpirationSweeper(storage, -5));
    }

    @Test
    void testStartAndCloseAreIdempotent() {
        StorageService storage = new StorageService();
        ExpirationSweeper sweeper = new ExpirationSweeper(storage, 50);

        sweeper.start();
        sweeper.start();
        sweeper.close();
        sweeper.close();
    }
}
