package bbt.tao.reclaim.tools.formatter.impl;

import bbt.tao.reclaim.exception.ReclaimApiException;
import bbt.tao.reclaim.tools.formatter.ToolResponseFormatter;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * Renders a failure as {@code Error[ <status>]: <message>[ - <title>][ (<detail>)]}, where title and detail
 * come from the Reclaim error body when it has them.
 */
@Component
public class ToolErrorResponseFormatter implements ToolResponseFormatter<Throwable> {

    private static final int MAX_DETAIL_LENGTH = 150;

    @Override
    public String format(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        Integer status = null;
        JsonNode detail = null;
        if (error instanceof ReclaimApiException apiException) {
            status = apiException.getStatus();
            detail = apiException.getDetail();
        }

        StringBuilder sb = new StringBuilder(status != null ? "Error " + status + ": " : "Error: ").append(message);
        if (detail == null) {
            return sb.toString();
        }

        String detailText = null;
        if (detail.isObject()) {
            JsonNode title = detail.get("title");
            if (title != null && title.isTextual()) {
                sb.append(" - ").append(title.asText());
            }
            JsonNode nested = detail.get("detail");
            JsonNode nestedMessage = detail.get("message");
            if (nested != null && nested.isTextual() && nested.asText().length() < MAX_DETAIL_LENGTH) {
                detailText = nested.asText();
            } else if (nestedMessage != null && nestedMessage.isTextual() && !nestedMessage.asText().equals(message)) {
                detailText = nestedMessage.asText();
            }
        } else if (detail.isTextual() && detail.asText().length() < MAX_DETAIL_LENGTH && !detail.asText().equals(message)) {
            detailText = detail.asText();
        }

        if (detailText != null) {
            sb.append(" (").append(detailText).append(')');
        }
        return sb.toString();
    }
}
