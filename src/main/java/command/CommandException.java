package command;

/**
 * 알 수 없는 명령어나 잘못된 인자. 클라이언트에게 에러 응답으로 돌려주며 연결은 유지됩니다.
 */
public class CommandException extends Exception {

    public CommandException(String message) {
        super(message);
    }

    public static CommandException wrongArity(String commandName) {
        return new CommandException("wrong number of arguments for '" + commandName + "' command");
    }
}
