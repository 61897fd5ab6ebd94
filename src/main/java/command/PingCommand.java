package command;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import protocol.RespValue;
import service.StorageService;

import java.util.List;

@EqualsAndHashCode
@ToString
public final class PingCommand implements Command {

    static final String NAME = "ping";

    static PingCommand parse(List<byte[]> args) throws CommandException {
        if (!args.isEmpty()) {
            throw CommandException.wrongArity(NAME);
        }
        return new PingCommand();
    }

    @Override
    public RespValue execute(StorageService storageService) {
        return RespValue.PONG;
    }
}
