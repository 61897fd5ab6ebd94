package protocol;

import java.io.IOException;

/**
 * 잘못된 RESP 프레이밍(길이, 종결자, 타입 바이트 등)을 나타냅니다.
 */
public class RespProtocolException extends IOException {

    public RespProtocolException(String message) {
        super(message);
    }
}
