package service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import model.BinaryKey;
import model.StoreEntry;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 키-값 저장소와 만료 시간 관리를 담당하는 서비스 클래스
 *
 * <p>모든 연결 핸들러가 공유합니다. 각 연산은 키 단위로 원자적이며(ConcurrentHashMap),
 * 만료 여부는 호출 시점의 {@link Clock} 값으로 판단하므로 백그라운드 정리 없이도 정확합니다.
 */
@Slf4j
public class StorageService {

    private final Map<BinaryKey, StoreEntry> keyValueStore = new ConcurrentHashMap<>();
    @Getter
    private final Clock clock;

    public StorageService() {
        this(Clock.systemUTC());
    }

    public StorageService(Clock clock) {
        this.clock = clock;
    }

    /**
     * 키-값을 저장합니다. 기존 엔트리는 타입과 만료 시간까지 통째로 교체됩니다.
     *
     * @param expiresAt 절대 만료 시각(epoch millis), 없으면 null
     */
    public void set(byte[] key, byte[] value, Long expiresAt) {
        BinaryKey storeKey = BinaryKey.of(key);
        keyValueStore.put(storeKey, StoreEntry.string(value, expiresAt));
        if (log.isDebugEnabled()) {
            log.debug("Stored key '{}' ({} bytes, expires at {})", storeKey, value.length, expiresAt);
        }
    }

    public void set(byte[] key, byte[] value) {
        set(key, value, null);
    }

    /**
     * 키에 해당하는 문자열 값을 가져옵니다. 없거나 만료된 키는 null입니다.
     *
     * @throws WrongTypeException 키가 리스트를 담고 있는 경우
     */
    public byte[] get(byte[] key) {
        StoreEntry entry = liveEntry(BinaryKey.of(key));
        if (entry == null) {
            return null;
        }
        if (entry.getType() != StoreEntry.Type.STRING) {
            throw new WrongTypeException();
        }
        return entry.getStringValue();
    }

    /**
     * 리스트 끝에 값을 추가하고 새 길이를 반환합니다. 키가 없거나 만료됐으면 만료 없는 새 리스트를 만듭니다.
     *
     * @throws WrongTypeException 키가 문자열을 담고 있는 경우. 저장소는 변경되지 않습니다.
     */
    public int rpush(byte[] key, List<byte[]> values) {
        BinaryKey storeKey = BinaryKey.of(key);
        long now = clock.millis();
        StoreEntry updated = keyValueStore.compute(storeKey, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                return StoreEntry.list(values, null);
            }
            if (current.getType() != StoreEntry.Type.LIST) {
                throw new WrongTypeException();
            }
            return current.append(values);
        });
        log.debug("Pushed {} value(s) to '{}', length {}", values.size(), storeKey, updated.listSize());
        return updated.listSize();
    }

    /**
     * 리스트 전체를 반환합니다. 없거나 만료된 키는 null입니다.
     *
     * @throws WrongTypeException 키가 문자열을 담고 있는 경우
     */
    public List<byte[]> getList(byte[] key) {
        StoreEntry entry = liveEntry(BinaryKey.of(key));
        if (entry == null) {
            return null;
        }
        if (entry.getType() != StoreEntry.Type.LIST) {
            throw new WrongTypeException();
        }
        return entry.getListValue();
    }

    /**
     * 키가 존재하는지 확인합니다.
     */
    public boolean exists(byte[] key) {
        return liveEntry(BinaryKey.of(key)) != null;
    }

    /**
     * 만료되지 않은 키의 개수를 반환합니다.
     */
    public int size() {
        long now = clock.millis();
        int count = 0;
        for (StoreEntry entry : keyValueStore.values()) {
            if (!entry.isExpired(now)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 저장소를 초기화합니다.
     */
    public void clear() {
        keyValueStore.clear();
    }

    /**
     * 만료된 키들을 정리하고 삭제한 개수를 반환합니다.
     * 검사한 엔트리가 그 사이 다른 값으로 교체됐다면 지우지 않습니다.
     */
    public int removeExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<BinaryKey, StoreEntry> entry : keyValueStore.entrySet()) {
            StoreEntry captured = entry.getValue();
            if (captured.isExpired(now) && keyValueStore.remove(entry.getKey(), captured)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * 살아있는 엔트리를 반환합니다. 만료된 엔트리는 읽는 김에 삭제합니다.
     */
    private StoreEntry liveEntry(BinaryKey key) {
        StoreEntry entry = keyValueStore.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            // remove(key, value) only succeeds if no newer SET replaced it
            if (keyValueStore.remove(key, entry)) {
                log.debug("Key expired and removed: {}", key);
            }
            return null;
        }
        return entry;
    }
}
