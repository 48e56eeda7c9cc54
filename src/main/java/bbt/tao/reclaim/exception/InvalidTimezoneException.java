package bbt.tao.reclaim.exception;

public class InvalidTimezoneException extends TaskInputException {

    public InvalidTimezoneException(String timeZone, Throwable cause) {
        super("Invalid timeZone \"" + timeZone + "\". Use an IANA time zone like \"America/Los_Angeles\".", cause);
    }
}
