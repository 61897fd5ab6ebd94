package service;

/**
 * 키가 담고 있는 값의 타입과 맞지 않는 연산을 시도했을 때 발생합니다.
 */
public class WrongTypeException extends RuntimeException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}
