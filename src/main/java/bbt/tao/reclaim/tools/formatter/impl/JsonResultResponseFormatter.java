package bbt.tao.reclaim.tools.formatter.impl;

import bbt.tao.reclaim.tools.formatter.JsonRenderer;
import bbt.tao.reclaim.tools.formatter.ToolResponseFormatter;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

@Component
public class JsonResultResponseFormatter implements ToolResponseFormatter<JsonNode> {

    private final JsonRenderer jsonRenderer;

    public JsonResultResponseFormatter(JsonRenderer jsonRenderer) {
        this.jsonRenderer = jsonRenderer;
    }

    @Override
    public String format(JsonNode response) {
        if (response == null || response.isMissingNode() || response.isNull()) {
            return "null";
        }
        if (response.isTextual()) {
            return response.asText();
        }
        return jsonRenderer.render(response);
    }
}
