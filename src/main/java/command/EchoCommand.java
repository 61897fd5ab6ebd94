package command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import protocol.RespValue;
import service.StorageService;

import java.util.List;

@Getter
@EqualsAndHashCode
public final class EchoCommand implements Command {

    static final String NAME = "echo";

    private final byte[] message;

    public EchoCommand(byte[] message) {
        this.message = message;
    }

    static EchoCommand parse(List<byte[]> args) throws CommandException {
        if (args.size() != 1) {
            throw CommandException.wrongArity(NAME);
        }
        return new EchoCommand(args.get(0));
    }

    @Override
    public RespValue execute(StorageService storageService) {
        return RespValue.bulkString(message);
    }
}
