package model;

import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;

/**
 * 저장소의 키. 임의의 바이트열이며 내용 기준으로 비교합니다.
 */
@EqualsAndHashCode(cacheStrategy = EqualsAndHashCode.CacheStrategy.LAZY)
public final class BinaryKey {

    private final byte[] bytes;

    private BinaryKey(byte[] bytes) {
        this.bytes = bytes;
    }

    public static BinaryKey of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new BinaryKey(bytes.clone());
    }

    public static BinaryKey of(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new BinaryKey(key.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
