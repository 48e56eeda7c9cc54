package bbt.tao.reclaim.tools.formatter.impl;

import bbt.tao.reclaim.dto.reclaim.ReclaimTask;
import bbt.tao.reclaim.tools.formatter.JsonRenderer;
import bbt.tao.reclaim.tools.formatter.ToolResponseFormatter;
import org.springframework.stereotype.Component;

@Component
public class ReclaimTaskResponseFormatter implements ToolResponseFormatter<ReclaimTask> {

    private final JsonRenderer jsonRenderer;

    public ReclaimTaskResponseFormatter(JsonRenderer jsonRenderer) {
        this.jsonRenderer = jsonRenderer;
    }

    @Override
    public String format(ReclaimTask response) {
        return jsonRenderer.render(response);
    }
}
