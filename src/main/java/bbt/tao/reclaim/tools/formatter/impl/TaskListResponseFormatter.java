package bbt.tao.reclaim.tools.formatter.impl;

import bbt.tao.reclaim.dto.TaskListView;
import bbt.tao.reclaim.tools.formatter.JsonRenderer;
import bbt.tao.reclaim.tools.formatter.ToolResponseFormatter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Task list as JSON followed by a reminder on what {@code COMPLETE} means, so that assistants do not
 * drop those tasks from "active" listings.
 */
@Component
public class TaskListResponseFormatter implements ToolResponseFormatter<TaskListView> {

    public static final String STATUS_NOTE = "IMPORTANT NOTE: Tasks with 'status: COMPLETE' were NOT marked complete by the user. "
            + "This means the user finished the initial block of time allocated to the task but did NOT finish the task. "
            + "If asked to list all tasks or all active tasks, include each 'COMPLETE' task unless the user requests otherwise. "
            + "Do NOT skip 'COMPLETE' tasks.";

    private final JsonRenderer jsonRenderer;

    public TaskListResponseFormatter(JsonRenderer jsonRenderer) {
        this.jsonRenderer = jsonRenderer;
    }

    @Override
    public String format(TaskListView response) {
        List<?> tasks = response.tasks() == null ? List.of() : response.tasks();
        return jsonRenderer.render(tasks) + "\n\n" + STATUS_NOTE;
    }
}
