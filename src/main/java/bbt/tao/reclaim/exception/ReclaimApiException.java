package bbt.tao.reclaim.exception;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * Failure reported by the Reclaim API or by the transport in front of it.
 * {@code status} is {@code null} when no HTTP response was received.
 */
@Getter
public class ReclaimApiException extends RuntimeException {

    private final Integer status;
    private final JsonNode detail;

    public ReclaimApiException(String message) {
        this(message, null, null, null);
    }

    public ReclaimApiException(String message, Integer status, JsonNode detail, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.detail = detail;
    }
}
