package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/**
 * RESP 프로토콜에서 주고받는 값(프레임)의 닫힌 집합.
 * 요청(멀티 벌크 배열)과 응답(simple/error/integer/bulk/null) 모두 이 타입으로 표현합니다.
 */
public sealed interface RespValue
        permits RespValue.SimpleString, RespValue.ErrorReply, RespValue.IntegerReply,
                RespValue.BulkString, RespValue.ArrayValue {

    enum Type {
        SIMPLE_STRING, ERROR, INTEGER, BULK_STRING, ARRAY
    }

    SimpleString OK = new SimpleString("OK");
    SimpleString PONG = new SimpleString("PONG");
    BulkString NULL_BULK = new BulkString(null);
    ArrayValue NULL_ARRAY = new ArrayValue(null);

    Type type();

    static SimpleString simpleString(String text) {
        return new SimpleString(text);
    }

    static ErrorReply error(String message) {
        return new ErrorReply(message);
    }

    static IntegerReply integer(long value) {
        return new IntegerReply(value);
    }

    static BulkString bulkString(byte[] data) {
        return data == null ? NULL_BULK : new BulkString(data);
    }

    static BulkString bulkString(String text) {
        return text == null ? NULL_BULK : new BulkString(text.getBytes(StandardCharsets.UTF_8));
    }

    static ArrayValue array(List<RespValue> elements) {
        return elements == null ? NULL_ARRAY : new ArrayValue(List.copyOf(elements));
    }

    static ArrayValue array(RespValue... elements) {
        return new ArrayValue(List.of(elements));
    }

    /**
     * {@code +<text>\r\n}. CR, LF는 허용하지 않습니다.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    final class SimpleString implements RespValue {
        private final String text;

        SimpleString(String text) {
            if (text == null) {
                throw new IllegalArgumentException("simple string must not be null");
            }
            if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("simple string must not contain CR or LF");
            }
            this.text = text;
        }

        @Override
        public Type type() {
            return Type.SIMPLE_STRING;
        }
    }

    /**
     * {@code -<message>\r\n}. 메시지 안의 CR, LF는 공백으로 치환합니다.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    final class ErrorReply implements RespValue {
        private final String message;

        ErrorReply(String message) {
            String text = message == null ? "" : message;
            this.message = text.replace('\r', ' ').replace('\n', ' ');
        }

        @Override
        public Type type() {
            return Type.ERROR;
        }
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    final class IntegerReply implements RespValue {
        private final long value;

        IntegerReply(long value) {
            this.value = value;
        }

        @Override
        public Type type() {
            return Type.INTEGER;
        }
    }

    /**
     * 길이 접두 바이너리 문자열. {@code data}가 null이면 null bulk({@code $-1\r\n})입니다.
     * 배열은 복사하지 않고 그대로 보관합니다.
     */
    @Getter
    @EqualsAndHashCode
    final class BulkString implements RespValue {
        private final byte[] data;

        BulkString(byte[] data) {
            this.data = data;
        }

        public boolean isNull() {
            return data == null;
        }

        public String asString() {
            return data == null ? null : new String(data, StandardCharsets.UTF_8);
        }

        @Override
        public Type type() {
            return Type.BULK_STRING;
        }

        @Override
        public String toString() {
            return isNull() ? "BulkString(null)" : "BulkString(" + asString() + ")";
        }
    }

    /**
     * {@code elements}가 null이면 null 배열({@code *-1\r\n})입니다.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    final class ArrayValue implements RespValue {
        private final List<RespValue> elements;

        ArrayValue(List<RespValue> elements) {
            this.elements = elements == null ? null : Collections.unmodifiableList(elements);
        }

        public boolean isNull() {
            return elements == null;
        }

        public int size() {
            return elements == null ? 0 : elements.size();
        }

        @Override
        public Type type() {
            return Type.ARRAY;
        }
    }
}
