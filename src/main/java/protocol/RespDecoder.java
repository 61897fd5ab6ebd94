package protocol;

import lombok.Getter;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static protocol.RespProtocol.ARRAY_PREFIX;
import static protocol.RespProtocol.BULK_STRING_PREFIX;
import static protocol.RespProtocol.CR;
import static protocol.RespProtocol.ERROR_PREFIX;
import static protocol.RespProtocol.INTEGER_PREFIX;
import static protocol.RespProtocol.LF;
import static protocol.RespProtocol.MAX_HEADER_LINE_LENGTH;
import static protocol.RespProtocol.SIMPLE_STRING_PREFIX;

/**
 * 누적된 바이트 버퍼에서 RESP 프레임 하나를 디코딩합니다.
 *
 * <p>상태를 갖지 않으며 버퍼를 수정하지 않습니다. 입력이 모자라면 null을 반환하고
 * 아무 바이트도 소비하지 않으므로, 호출자는 바이트를 더 받은 뒤 같은 위치에서 다시 호출하면 됩니다.
 * 선언된 길이 이상을 읽는 일은 없습니다.
 */
@Getter
public class RespDecoder {

    static final int MAX_NESTING_DEPTH = 32;

    private final int maxBulkLength;
    private final int maxMultibulkLength;

    public RespDecoder() {
        this(RespProtocol.DEFAULT_MAX_BULK_LENGTH, RespProtocol.DEFAULT_MAX_MULTIBULK_LENGTH);
    }

    public RespDecoder(int maxBulkLength, int maxMultibulkLength) {
        if (maxBulkLength < 0 || maxMultibulkLength < 0) {
            throw new IllegalArgumentException("limits must not be negative");
        }
        this.maxBulkLength = maxBulkLength;
        this.maxMultibulkLength = maxMultibulkLength;
    }

    /**
     * {@code buffer[offset, limit)} 구간에서 프레임 하나를 디코딩합니다.
     *
     * @return 완성된 프레임과 소비한 바이트 수, 입력이 부족하면 null
     * @throws RespProtocolException 프레이밍이 잘못된 경우
     */
    public Decoded decode(byte[] buffer, int offset, int limit) throws RespProtocolException {
        if (offset < 0 || limit > buffer.length || offset > limit) {
            throw new IndexOutOfBoundsException("offset " + offset + ", limit " + limit + ", length " + buffer.length);
        }
        Cursor cursor = new Cursor(offset);
        RespValue value = parse(buffer, cursor, limit, 0);
        if (value == null) {
            return null;
        }
        return new Decoded(value, cursor.position - offset);
    }

    public Decoded decode(byte[] buffer) throws RespProtocolException {
        return decode(buffer, 0, buffer.length);
    }

    private RespValue parse(byte[] buffer, Cursor cursor, int limit, int depth) throws RespProtocolException {
        int start = cursor.position;
        if (start >= limit) {
            return null;
        }
        int lineEnd = findLineEnd(buffer, start + 1, limit);
        if (lineEnd < 0) {
            return null;
        }
        int lineStart = start + 1;
        int next = lineEnd + 2;

        byte prefix = buffer[start];
        switch (prefix) {
            case SIMPLE_STRING_PREFIX: {
                cursor.position = next;
                return RespValue.simpleString(line(buffer, lineStart, lineEnd));
            }
            case ERROR_PREFIX: {
                cursor.position = next;
                return RespValue.error(line(buffer, lineStart, lineEnd));
            }
            case INTEGER_PREFIX: {
                long value = RespProtocol.parseLong(buffer, lineStart, lineEnd);
                cursor.position = next;
                return RespValue.integer(value);
            }
            case BULK_STRING_PREFIX:
                return parseBulk(buffer, cursor, limit, lineStart, lineEnd);
            case ARRAY_PREFIX:
                if (depth >= MAX_NESTING_DEPTH) {
                    throw new RespProtocolException("too deeply nested array");
                }
                return parseArray(buffer, cursor, limit, lineStart, lineEnd, depth);
            default:
                throw new RespProtocolException("expected '*' or '$', got '" + printable(prefix) + "'");
        }
    }

    private RespValue parseBulk(byte[] buffer, Cursor cursor, int limit, int lineStart, int lineEnd)
            throws RespProtocolException {
        long length = RespProtocol.parseLong(buffer, lineStart, lineEnd);
        int payloadStart = lineEnd + 2;
        if (length == -1) {
            cursor.position = payloadStart;
            return RespValue.NULL_BULK;
        }
        if (length < -1 || length > maxBulkLength) {
            throw new RespProtocolException("invalid bulk length");
        }
        long frameEnd = payloadStart + length + 2;
        if (frameEnd > limit) {
            return null;
        }
        int payloadEnd = (int) (payloadStart + length);
        if (buffer[payloadEnd] != CR || buffer[payloadEnd + 1] != LF) {
            throw new RespProtocolException("bulk string not terminated by CRLF");
        }
        cursor.position = (int) frameEnd;
        return RespValue.bulkString(Arrays.copyOfRange(buffer, payloadStart, payloadEnd));
    }

    private RespValue parseArray(byte[] buffer, Cursor cursor, int limit, int lineStart, int lineEnd, int depth)
            throws RespProtocolException {
        long count = RespProtocol.parseLong(buffer, lineStart, lineEnd);
        cursor.position = lineEnd + 2;
        if (count == -1) {
            return RespValue.NULL_ARRAY;
        }
        if (count < -1 || count > maxMultibulkLength) {
            throw new RespProtocolException("invalid multibulk length");
        }
        List<RespValue> elements = new ArrayList<>((int) Math.min(count, 1024));
        for (long i = 0; i < count; i++) {
            RespValue element = parse(buffer, cursor, limit, depth + 1);
            if (element == null) {
                return null;
            }
            elements.add(element);
        }
        return RespValue.array(elements);
    }

    /**
     * {@code from}부터 CR의 위치를 찾습니다. CR 바로 뒤는 반드시 LF여야 합니다.
     *
     * @return CR의 인덱스, CRLF가 아직 도착하지 않았으면 -1
     */
    private static int findLineEnd(byte[] buffer, int from, int limit) throws RespProtocolException {
        int scanLimit = Math.min(limit, from + MAX_HEADER_LINE_LENGTH);
        for (int i = from; i < scanLimit; i++) {
            byte b = buffer[i];
            if (b == CR) {
                if (i + 1 >= limit) {
                    return -1;
                }
                if (buffer[i + 1] != LF) {
                    throw new RespProtocolException("expected LF after CR");
                }
                return i;
            }
            if (b == LF) {
                throw new RespProtocolException("unexpected LF in header line");
            }
        }
        if (scanLimit - from >= MAX_HEADER_LINE_LENGTH) {
            throw new RespProtocolException("too big header line");
        }
        return -1;
    }

    private static String line(byte[] buffer, int start, int end) {
        return RespProtocol.text(buffer, start, end);
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b);
    }

    private static final class Cursor {
        private int position;

        private Cursor(int position) {
            this.position = position;
        }
    }

    /**
     * 디코딩 결과: 프레임과 버퍼에서 소비한 바이트 수
     */
    @Value
    public static class Decoded {
        RespValue value;
        int consumed;
    }
}
