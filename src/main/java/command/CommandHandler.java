package command;

import lombok.extern.slf4j.Slf4j;
import protocol.RespValue;
import service.StorageService;
import service.WrongTypeException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 요청 프레임을 명령어로 해석하고, 저장소에 실행한 뒤 응답 값을 돌려주는 핸들러 클래스
 */
@Slf4j
public class CommandHandler {

    @FunctionalInterface
    interface CommandParser {
        Command parse(List<byte[]> args) throws CommandException;
    }

    private final Map<String, CommandParser> commandMap = new HashMap<>();
    private final StorageService storageService;

    public CommandHandler(StorageService storageService) {
        this.storageService = storageService;
        Clock clock = storageService.getClock();

        commandMap.put(PingCommand.NAME, PingCommand::parse);
        commandMap.put(EchoCommand.NAME, EchoCommand::parse);
        commandMap.put(GetCommand.NAME, GetCommand::parse);
        commandMap.put(SetCommand.NAME, args -> SetCommand.parse(args, clock));
        commandMap.put(RpushCommand.NAME, RpushCommand::parse);
    }

    /**
     * 요청 하나를 처리합니다.
     *
     * @return 보낼 응답, 빈 요청(빈 배열, null 배열)이면 응답 없이 null
     */
    public RespValue handle(RespValue request) {
        if (isEmptyRequest(request)) {
            return null;
        }

        Command command;
        try {
            command = parse(request);
        } catch (CommandException e) {
            log.debug("Rejected request: {}", e.getMessage());
            return errorReply(e.getMessage());
        }

        try {
            return command.execute(storageService);
        } catch (WrongTypeException e) {
            return RespValue.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error executing {}", command, e);
            return errorReply("internal error");
        }
    }

    /**
     * 멀티 벌크 요청을 {@link Command}로 해석합니다. 명령어 이름은 대소문자를 구분하지 않습니다.
     */
    public Command parse(RespValue request) throws CommandException {
        List<byte[]> parts = toArguments(request);
        if (parts.isEmpty()) {
            throw new CommandException("empty command");
        }
        String commandName = new String(parts.get(0), StandardCharsets.UTF_8);
        CommandParser parser = commandMap.get(commandName.toLowerCase(Locale.ROOT));
        if (parser == null) {
            throw new CommandException("unknown command '" + commandName + "'");
        }
        return parser.parse(parts.subList(1, parts.size()));
    }

    public static RespValue.ErrorReply errorReply(String message) {
        return RespValue.error("ERR " + message);
    }

    private static List<byte[]> toArguments(RespValue request) throws CommandException {
        if (request.type() != RespValue.Type.ARRAY) {
            throw new CommandException("Protocol error: expected multibulk request");
        }
        RespValue.ArrayValue array = (RespValue.ArrayValue) request;
        List<byte[]> parts = new ArrayList<>(array.size());
        if (array.isNull()) {
            return parts;
        }
        for (RespValue element : array.getElements()) {
            if (element.type() != RespValue.Type.BULK_STRING) {
                throw new CommandException("Protocol error: expected bulk string argument");
            }
            RespValue.BulkString bulk = (RespValue.BulkString) element;
            if (bulk.isNull()) {
                throw new CommandException("invalid null argument");
            }
            parts.add(bulk.getData());
        }
        return parts;
    }

    private static boolean isEmptyRequest(RespValue request) {
        return request.type() == RespValue.Type.ARRAY && ((RespValue.ArrayValue) request).size() == 0;
    }
}
