package bbt.tao.reclaim.exception;

public class InvalidInputException extends TaskInputException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
