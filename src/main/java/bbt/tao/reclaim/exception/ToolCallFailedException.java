package bbt.tao.reclaim.exception;

public class ToolCallFailedException extends RuntimeException {

    public ToolCallFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
