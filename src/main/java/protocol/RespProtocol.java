package protocol;

import java.nio.charset.StandardCharsets;

/**
 * Redis RESP 프로토콜의 와이어 상수와 숫자 파싱 규칙을 모아둔 클래스
 */
public final class RespProtocol {

    public static final byte SIMPLE_STRING_PREFIX = '+';
    public static final byte ERROR_PREFIX = '-';
    public static final byte INTEGER_PREFIX = ':';
    public static final byte BULK_STRING_PREFIX = '$';
    public static final byte ARRAY_PREFIX = '*';

    public static final byte CR = '\r';
    public static final byte LF = '\n';
    public static final byte[] CRLF = {CR, LF};

    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int DEFAULT_MAX_MULTIBULK_LENGTH = 1024 * 1024;

    /** 타입 바이트부터 CRLF까지 한 줄의 최대 길이 */
    public static final int MAX_HEADER_LINE_LENGTH = 64 * 1024;
    /** 커넥션 하나가 쌓아둘 수 있는 요청 버퍼의 최대 크기(배열 한계) */
    public static final int MAX_REQUEST_BUFFER_LENGTH = Integer.MAX_VALUE - 8;

    private RespProtocol() {
    }

    /**
     * {@code [-]digits} 형식의 10진수를 파싱합니다. 공백, '+' 부호, 빈 문자열, long 범위 초과는 모두 오류입니다.
     */
    public static long parseLong(byte[] buffer, int start, int end) throws RespProtocolException {
        if (start >= end) {
            throw new RespProtocolException("empty number");
        }
        boolean negative = buffer[start] == '-';
        int i = negative ? start + 1 : start;
        if (i >= end) {
            throw new RespProtocolException("invalid number '" + text(buffer, start, end) + "'");
        }
        long result = 0;
        for (; i < end; i++) {
            int digit = buffer[i] - '0';
            if (digit < 0 || digit > 9) {
                throw new RespProtocolException("invalid number '" + text(buffer, start, end) + "'");
            }
            if (result > (Long.MAX_VALUE - digit) / 10) {
                throw new RespProtocolException("number out of range '" + text(buffer, start, end) + "'");
            }
            result = result * 10 + digit;
        }
        return negative ? -result : result;
    }

    static String text(byte[] buffer, int start, int end) {
        return new String(buffer, start, end - start, StandardCharsets.UTF_8);
    }
}
