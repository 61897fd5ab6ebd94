package command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import protocol.RespValue;
import service.StorageService;

import java.util.List;

@Getter
@EqualsAndHashCode
public final class RpushCommand implements Command {

    static final String NAME = "rpush";

    private final byte[] key;
    private final List<byte[]> values;

    public RpushCommand(byte[] key, List<byte[]> values) {
        this.key = key;
        this.values = List.copyOf(values);
    }

    static RpushCommand parse(List<byte[]> args) throws CommandException {
        if (args.size() < 2) {
            throw CommandException.wrongArity(NAME);
        }
        return new RpushCommand(args.get(0), args.subList(1, args.size()));
    }

    @Override
    public RespValue execute(StorageService storageService) {
        return RespValue.integer(storageService.rpush(key, values));
    }
}
