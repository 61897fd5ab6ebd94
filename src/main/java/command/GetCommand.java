package command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import protocol.RespValue;
import service.StorageService;

import java.util.List;

@Getter
@EqualsAndHashCode
public final class GetCommand implements Command {

    static final String NAME = "get";

    private final byte[] key;

    public GetCommand(byte[] key) {
        this.key = key;
    }

    static GetCommand parse(List<byte[]> args) throws CommandException {
        if (args.size() != 1) {
            throw CommandException.wrongArity(NAME);
        }
        return new GetCommand(args.get(0));
    }

    @Override
    public RespValue execute(StorageService storageService) {
        byte[] value = storageService.get(key);
        if (value == null) {
            return RespValue.NULL_BULK;
        }
        return RespValue.bulkString(value);
    }
}
