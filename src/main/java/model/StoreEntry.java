package model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 저장소 내부 레코드: 값과 선택적인 만료 시각(epoch millis).
 * 저장소 밖으로 참조가 나가지 않으며, 값을 바꿀 때는 새 엔트리로 교체합니다.
 * {@code remove(key, entry)}로 재확인하므로 equals는 재정의하지 않습니다(동일성 비교).
 */
public final class StoreEntry {

    public enum Type {
        STRING, LIST
    }

    @Getter
    private final Type type;
    private final byte[] stringValue;
    private final List<byte[]> listValue;
    @Getter
    private final Long expiresAt;

    private StoreEntry(Type type, byte[] stringValue, List<byte[]> listValue, Long expiresAt) {
        this.type = type;
        this.stringValue = stringValue;
        this.listValue = listValue;
        this.expiresAt = expiresAt;
    }

    public static StoreEntry string(byte[] value, Long expiresAt) {
        return new StoreEntry(Type.STRING, value.clone(), null, expiresAt);
    }

    public static StoreEntry list(List<byte[]> values, Long expiresAt) {
        List<byte[]> copy = new ArrayList<>(values.size());
        for (byte[] value : values) {
            copy.add(value.clone());
        }
        return new StoreEntry(Type.LIST, null, copy, expiresAt);
    }

    /**
     * 현재 리스트 뒤에 값을 붙인 새 엔트리. 만료 시각은 유지합니다.
     */
    public StoreEntry append(List<byte[]> values) {
        if (type != Type.LIST) {
            throw new IllegalStateException("not a list entry");
        }
        List<byte[]> merged = new ArrayList<>(listValue.size() + values.size());
        merged.addAll(listValue);
        for (byte[] value : values) {
            merged.add(value.clone());
        }
        return new StoreEntry(Type.LIST, null, merged, expiresAt);
    }

    /**
     * 만료 시각이 없거나 {@code now}보다 엄격히 뒤일 때만 살아있는 엔트리입니다.
     */
    public boolean isExpired(long now) {
        return expiresAt != null && expiresAt <= now;
    }

    public byte[] getStringValue() {
        return stringValue == null ? null : stringValue.clone();
    }

    public List<byte[]> getListValue() {
        if (listValue == null) {
            return null;
        }
        List<byte[]> copy = new ArrayList<>(listValue.size());
        for (byte[] value : listValue) {
            copy.add(value.clone());
        }
        return copy;
    }

    public int listSize() {
        return listValue == null ? 0 : listValue.size();
    }

    @Override
    public String toString() {
        return "StoreEntry{type=" + type + ", expiresAt=" + expiresAt + "}";
    }
}
