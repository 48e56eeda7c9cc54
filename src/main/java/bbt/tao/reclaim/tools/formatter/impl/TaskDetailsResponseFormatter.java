package bbt.tao.reclaim.tools.formatter.impl;

import bbt.tao.reclaim.dto.TaskDetailsView;
import bbt.tao.reclaim.tools.formatter.JsonRenderer;
import bbt.tao.reclaim.tools.formatter.ToolResponseFormatter;
import org.springframework.stereotype.Component;

@Component
public class TaskDetailsResponseFormatter implements ToolResponseFormatter<TaskDetailsView> {

    public static final String STATUS_NOTE = "Note: If 'status' is 'COMPLETE', this means the task is NOT marked completed by the user. "
            + "ARCHIVED or CANCELLED is used for completed tasks. A 'COMPLETE' task is still 'active'.";

    private final JsonRenderer jsonRenderer;

    public TaskDetailsResponseFormatter(JsonRenderer jsonRenderer) {
        this.jsonRenderer = jsonRenderer;
    }

    @Override
    public String format(TaskDetailsView response) {
        return jsonRenderer.render(response.task()) + "\n\n" + STATUS_NOTE;
    }
}
