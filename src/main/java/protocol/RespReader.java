package protocol;

import java.util.Arrays;

/**
 * 커넥션 하나가 받은 바이트를 누적하고, 완성된 프레임을 순서대로 꺼내주는 버퍼.
 * 커넥션마다 하나씩 사용하며 동기화하지 않습니다.
 */
public class RespReader {

    private static final int INITIAL_CAPACITY = 512;

    private final RespDecoder decoder;
    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int start;
    private int end;

    public RespReader(RespDecoder decoder) {
        this.decoder = decoder;
    }

    public void feed(byte[] data) {
        feed(data, 0, data.length);
    }

    public void feed(byte[] data, int offset, int length) {
        ensureCapacity(length);
        System.arraycopy(data, offset, buffer, end, length);
        end += length;
    }

    /**
     * 다음 프레임을 꺼냅니다.
     *
     * @return 완성된 프레임, 아직 바이트가 부족하면 null
     * @throws RespProtocolException 프레이밍 오류. 버퍼는 그대로 남으므로 호출자가 {@link #discard()} 여부를 결정합니다.
     */
    public RespValue next() throws RespProtocolException {
        if (start == end) {
            return null;
        }
        RespDecoder.Decoded decoded = decoder.decode(buffer, start, end);
        if (decoded == null) {
            return null;
        }
        start += decoded.getConsumed();
        if (start == end) {
            start = 0;
            end = 0;
        }
        return decoded.getValue();
    }

    /** 아직 프레임으로 소비되지 않은 바이트 수 */
    public int buffered() {
        return end - start;
    }

    public void discard() {
        start = 0;
        end = 0;
        if (buffer.length > INITIAL_CAPACITY) {
            buffer = new byte[INITIAL_CAPACITY];
        }
    }

    private void ensureCapacity(int extra) {
        if (buffer.length - end >= extra) {
            return;
        }
        int pending = end - start;
        if (start > 0) {
            // compact before growing
            System.arraycopy(buffer, start, buffer, 0, pending);
            start = 0;
            end = pending;
            if (buffer.length - end >= extra) {
                return;
            }
        }
        long required = (long) pending + extra;
        if (required > RespProtocol.MAX_REQUEST_BUFFER_LENGTH) {
            throw new IllegalStateException("request buffer overflow");
        }
        int capacity = buffer.length;
        while (capacity < required) {
            capacity = (int) Math.min((long) capacity * 2, RespProtocol.MAX_REQUEST_BUFFER_LENGTH);
        }
        buffer = Arrays.copyOf(buffer, capacity);
    }
}
