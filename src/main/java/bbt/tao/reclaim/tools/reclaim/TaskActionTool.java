package bbt.tao.reclaim.tools.reclaim;

import bbt.tao.reclaim.dto.TaskDetailsView;
import bbt.tao.reclaim.dto.TaskListView;
import bbt.tao.reclaim.service.TaskService;
import bbt.tao.reclaim.tools.formatter.fabric.ResponseFormatterRegistry;
import bbt.tao.reclaim.tools.meta.TaskToolMeta;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@Slf4j
public class TaskActionTool extends ReclaimToolSupport {

    private final TaskService taskService;

    public TaskActionTool(TaskService taskService, ResponseFormatterRegistry formatterRegistry) {
        super(formatterRegistry);
        this.taskService = taskService;
    }

    @TaskToolMeta
    @Tool(name = "reclaim_get_task_defaults",
            description = "Fetch account-level Reclaim task defaults (chunk sizes, priority defaults, etc.).")
    public String getTaskDefaults() {
        return execute("reclaim_get_task_defaults", taskService::getTaskDefaults, JsonNode.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_list_tasks", description = """
            List Reclaim.ai tasks, optionally filtering for active ones (not deleted, ARCHIVED, or CANCELLED).
            """)
    public String listTasks(
            @ToolParam(description = "'active' (default) or 'all'.", required = false) String filter) {
        return execute("reclaim_list_tasks", () -> {
            boolean activeOnly = filter == null || !"all".equals(filter.trim().toLowerCase(Locale.ROOT));
            log.debug("Listing tasks, activeOnly={}", activeOnly);
            return taskService.listTasks(activeOnly).map(tasks -> new TaskListView(tasks, activeOnly));
        }, TaskListView.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_get_task", description = "Fetch details for a specific Reclaim.ai task by its ID.")
    public String getTask(@ToolParam(description = "The unique ID of the task to fetch.") Long taskId) {
        return execute("reclaim_get_task",
                () -> taskService.getTask(requireTaskId(taskId)).map(TaskDetailsView::new),
                TaskDetailsView.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_mark_complete", description = "Mark a specific Reclaim.ai task as completed/done by the user.")
    public String markComplete(@ToolParam(description = "The unique ID of the task to mark as complete.") Long taskId) {
        return execute("reclaim_mark_complete", () -> taskService.markComplete(requireTaskId(taskId)), JsonNode.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_mark_incomplete", description = "Mark a specific Reclaim.ai task as incomplete (unarchive it).")
    public String markIncomplete(
            @ToolParam(description = "The unique ID of the task to mark as incomplete (unarchive).") Long taskId) {
        return execute("reclaim_mark_incomplete", () -> taskService.markIncomplete(requireTaskId(taskId)), JsonNode.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_add_time", description = "Add scheduled time (in minutes) to a specific Reclaim.ai task.")
    public String addTime(
            @ToolParam(description = "The unique ID of the task to add time to.") Long taskId,
            @ToolParam(description = "Number of minutes to add, must be positive.") Integer minutes) {
        return execute("reclaim_add_time",
                () -> taskService.addTime(requireTaskId(taskId), minutes == null ? 0 : minutes),
                JsonNode.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_start_timer", description = "Start the timer for a specific Reclaim.ai task.")
    public String startTimer(@ToolParam(description = "The unique ID of the task to start the timer for.") Long taskId) {
        return execute("reclaim_start_timer", () -> taskService.startTimer(requireTaskId(taskId)), JsonNode.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_stop_timer", description = "Stop the timer for a specific Reclaim.ai task.")
    public String stopTimer(@ToolParam(description = "The unique ID of the task to stop the timer for.") Long taskId) {
        return execute("reclaim_stop_timer", () -> taskService.stopTimer(requireTaskId(taskId)), JsonNode.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_log_work", description = """
            Log work (time spent) against a specific Reclaim.ai task. The end of the work session defaults to now;
            a local date/time is read in timeZone.
            """)
    public String logWork(
            @ToolParam(description = "The unique ID of the task to log work against.") Long taskId,
            @ToolParam(description = "Number of minutes worked, must be positive.") Integer minutes,
            @ToolParam(description = "End of the work session, ISO 8601 or YYYY-MM-DD.", required = false) String end,
            @ToolParam(description = "IANA time zone for a local end time, e.g. Europe/Berlin.", required = false) String timeZone,
            @ToolParam(description = "Alias of timeZone.", required = false) String timezone) {
        return execute("reclaim_log_work",
                () -> taskService.logWork(requireTaskId(taskId), minutes == null ? 0 : minutes, end, timeZone(timeZone, timezone)),
                JsonNode.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_clear_exceptions", description = "Clear any scheduling exceptions for a specific Reclaim.ai task.")
    public String clearExceptions(@ToolParam(description = "The unique ID of the task.") Long taskId) {
        return execute("reclaim_clear_exceptions", () -> taskService.clearExceptions(requireTaskId(taskId)), JsonNode.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_prioritize", description = "Mark a specific Reclaim.ai task for prioritization in the planner.")
    public String prioritize(@ToolParam(description = "The unique ID of the task to prioritize.") Long taskId) {
        return execute("reclaim_prioritize", () -> taskService.prioritize(requireTaskId(taskId)), JsonNode.class);
    }
}
