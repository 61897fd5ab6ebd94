package command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import protocol.RespProtocol;
import protocol.RespProtocolException;
import protocol.RespValue;
import service.StorageService;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

/**
 * {@code SET key value [PX milliseconds]}. 상대 만료 시간은 파싱 시점에 절대 시각으로 바뀝니다.
 */
@Getter
@EqualsAndHashCode
public final class SetCommand implements Command {

    static final String NAME = "set";

    private final byte[] key;
    private final byte[] value;
    private final Long expireAt;

    public SetCommand(byte[] key, byte[] value, Long expireAt) {
        this.key = key;
        this.value = value;
        this.expireAt = expireAt;
    }

    static SetCommand parse(List<byte[]> args, Clock clock) throws CommandException {
        if (args.size() < 2) {
            throw CommandException.wrongArity(NAME);
        }

        byte[] key = args.get(0);
        byte[] value = args.get(1);
        Long expireAt = null;

        for (int i = 2; i < args.size(); i++) {
            String option = new String(args.get(i), StandardCharsets.UTF_8);
            if (!"px".equalsIgnoreCase(option) || expireAt != null || i + 1 >= args.size()) {
                throw new CommandException("syntax error");
            }
            long milliseconds = parseMilliseconds(args.get(++i)); // skip the value
            try {
                expireAt = Math.addExact(clock.millis(), milliseconds);
            } catch (ArithmeticException e) {
                throw new CommandException("invalid expire time in '" + NAME + "' command");
            }
        }

        return new SetCommand(key, value, expireAt);
    }

    private static long parseMilliseconds(byte[] argument) throws CommandException {
        long milliseconds;
        try {
            milliseconds = RespProtocol.parseLong(argument, 0, argument.length);
        } catch (RespProtocolException e) {
            throw new CommandException("value is not an integer or out of range");
        }
        if (milliseconds < 0) {
            throw new CommandException("invalid expire time in '" + NAME + "' command");
        }
        return milliseconds;
    }

    @Override
    public RespValue execute(StorageService storageService) {
        storageService.set(key, value, expireAt);
        return RespValue.OK;
    }
}
