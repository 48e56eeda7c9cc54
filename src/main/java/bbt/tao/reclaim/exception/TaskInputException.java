package bbt.tao.reclaim.exception;

/**
 * Base class for deterministic input errors raised while resolving or normalizing task fields.
 * These are never retried and are relayed to the caller unchanged.
 */
public abstract class TaskInputException extends RuntimeException {

    protected TaskInputException(String message) {
        super(message);
    }

    protected TaskInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
