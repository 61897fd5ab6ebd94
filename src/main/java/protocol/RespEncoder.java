package protocol;

import org.apache.commons.io.output.ByteArrayOutputStream;

import java.nio.charset.StandardCharsets;

import static protocol.RespProtocol.ARRAY_PREFIX;
import static protocol.RespProtocol.BULK_STRING_PREFIX;
import static protocol.RespProtocol.CRLF;
import static protocol.RespProtocol.ERROR_PREFIX;
import static protocol.RespProtocol.INTEGER_PREFIX;
import static protocol.RespProtocol.SIMPLE_STRING_PREFIX;

/**
 * 응답 값을 RESP 바이트로 직렬화합니다.
 */
public final class RespEncoder {

    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    private RespEncoder() {
    }

    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        encodeTo(value, out);
        return out.toByteArray();
    }

    public static void encodeTo(RespValue value, ByteArrayOutputStream out) {
        switch (value.type()) {
            case SIMPLE_STRING:
                writeLine(out, SIMPLE_STRING_PREFIX, utf8(((RespValue.SimpleString) value).getText()));
                break;
            case ERROR:
                writeLine(out, ERROR_PREFIX, utf8(((RespValue.ErrorReply) value).getMessage()));
                break;
            case INTEGER:
                writeLine(out, INTEGER_PREFIX, number(((RespValue.IntegerReply) value).getValue()));
                break;
            case BULK_STRING: {
                byte[] data = ((RespValue.BulkString) value).getData();
                if (data == null) {
                    writeLine(out, BULK_STRING_PREFIX, NULL_LENGTH);
                } else {
                    writeLine(out, BULK_STRING_PREFIX, number(data.length));
                    out.write(data, 0, data.length);
                    out.write(CRLF, 0, CRLF.length);
                }
                break;
            }
            case ARRAY: {
                RespValue.ArrayValue array = (RespValue.ArrayValue) value;
                if (array.isNull()) {
                    writeLine(out, ARRAY_PREFIX, NULL_LENGTH);
                } else {
                    writeLine(out, ARRAY_PREFIX, number(array.size()));
                    for (RespValue element : array.getElements()) {
                        encodeTo(element, out);
                    }
                }
                break;
            }
            default:
                throw new IllegalStateException("Unhandled RESP type: " + value.type());
        }
    }

    private static void writeLine(ByteArrayOutputStream out, byte prefix, byte[] line) {
        out.write(prefix);
        out.write(line, 0, line.length);
        out.write(CRLF, 0, CRLF.length);
    }

    private static byte[] number(long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
