package bbt.tao.reclaim.tools.reclaim;

import bbt.tao.reclaim.dto.reclaim.ReclaimTask;
import bbt.tao.reclaim.exception.InvalidInputException;
import bbt.tao.reclaim.normalize.RawTaskFields;
import bbt.tao.reclaim.service.TaskService;
import bbt.tao.reclaim.time.TimeInput;
import bbt.tao.reclaim.tools.formatter.fabric.ResponseFormatterRegistry;
import bbt.tao.reclaim.tools.meta.TaskToolMeta;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class TaskCrudTool extends ReclaimToolSupport {

    private static final String DATE_HINT = "ISO 8601 with offset (2026-01-05T16:00:00Z) is taken as-is; "
            + "a local date/time (2026-01-05T08:00:00 or 2026-01-05) is read in timeZone.";

    private final TaskService taskService;

    public TaskCrudTool(TaskService taskService, ResponseFormatterRegistry formatterRegistry) {
        super(formatterRegistry);
        this.taskService = taskService;
    }

    @TaskToolMeta
    @Tool(name = "reclaim_create_task", description = """
            Create a new Reclaim.ai task. Durations can be given in 15-minute chunks (timeChunksRequired, minChunkSize, maxChunkSize)
            or in minutes (durationMinutes, minDurationMinutes, maxDurationMinutes; must be multiples of 15).
            Fields left out are filled from the account's task defaults. Without a deadline the task is due
            after the account's default number of days (1 day if unset).
            If startTime is given the task is placed on the calendar at that time and, without a deadline,
            is due when its duration has elapsed.
            """)
    public String createTask(
            @ToolParam(description = "Task title (required).") String title,
            @ToolParam(description = "Task notes or description.", required = false) String notes,
            @ToolParam(description = "WORK or PERSONAL.", required = false) String eventCategory,
            @ToolParam(description = "Sub-category, e.g. FOCUS, STAFF_MEETING, ONE_ON_ONE, ERRAND, HEALTH.", required = false) String eventSubType,
            @ToolParam(description = "P1 (highest) to P4 (lowest). HIGH, MEDIUM, LOW are accepted too.", required = false) String priority,
            @ToolParam(description = "Total duration in 15-minute chunks.", required = false) Integer timeChunksRequired,
            @ToolParam(description = "Total duration in minutes, multiple of 15. Overrides timeChunksRequired.", required = false) Integer durationMinutes,
            @ToolParam(description = "Smallest scheduled block in 15-minute chunks.", required = false) Integer minChunkSize,
            @ToolParam(description = "Smallest scheduled block in minutes, multiple of 15.", required = false) Integer minDurationMinutes,
            @ToolParam(description = "Largest scheduled block in 15-minute chunks.", required = false) Integer maxChunkSize,
            @ToolParam(description = "Largest scheduled block in minutes, multiple of 15.", required = false) Integer maxDurationMinutes,
            @ToolParam(description = "Schedule the whole duration as a single block.", required = false) Boolean lockChunkSizeToDuration,
            @ToolParam(description = "Put the task on deck (Up Next).", required = false) Boolean onDeck,
            @ToolParam(description = "Keep scheduled events private.", required = false) Boolean alwaysPrivate,
            @ToolParam(description = "Id of the hours scheme the task is scheduled in.", required = false) String timeSchemeId,
            @ToolParam(description = "Deadline. " + DATE_HINT, required = false) String deadline,
            @ToolParam(description = "Deadline as a number of days from now. Do not combine with deadline.", required = false) Integer deadlineInDays,
            @ToolParam(description = "Do not schedule before this time. " + DATE_HINT, required = false) String snoozeUntil,
            @ToolParam(description = "Snooze as a number of days from now. Do not combine with snoozeUntil.", required = false) Integer snoozeUntilInDays,
            @ToolParam(description = "Place the task at this exact time. " + DATE_HINT, required = false) String startTime,
            @ToolParam(description = "Calendar color, e.g. LAVENDER, SAGE, GRAPE, BANANA, TOMATO.", required = false) String eventColor,
            @ToolParam(description = "IANA time zone for local date/times, e.g. America/Los_Angeles.", required = false) String timeZone,
            @ToolParam(description = "Alias of timeZone.", required = false) String timezone) {
        return execute("reclaim_create_task", () -> {
            RawTaskFields fields = RawTaskFields.builder()
                    .title(title)
                    .notes(notes)
                    .eventCategory(eventCategory)
                    .eventSubType(eventSubType)
                    .priority(priority)
                    .timeChunksRequired(timeChunksRequired)
                    .durationMinutes(durationMinutes)
                    .minChunkSize(minChunkSize)
                    .minDurationMinutes(minDurationMinutes)
                    .maxChunkSize(maxChunkSize)
                    .maxDurationMinutes(maxDurationMinutes)
                    .lockChunkSizeToDuration(lockChunkSizeToDuration)
                    .onDeck(onDeck)
                    .alwaysPrivate(alwaysPrivate)
                    .timeSchemeId(timeSchemeId)
                    .deadline(TimeInput.of("deadline", deadline, deadlineInDays))
                    .snoozeUntil(TimeInput.of("snoozeUntil", snoozeUntil, snoozeUntilInDays))
                    .startTime(startTime == null || startTime.isBlank() ? null : TimeInput.ofText(startTime))
                    .eventColor(eventColor)
                    .build();
            return taskService.createTask(fields, timeZone(timeZone, timezone));
        }, this::formatCreated);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_update_task", description = """
            Update fields of an existing Reclaim.ai task. Only the fields given are changed; at least one is required
            besides taskId. Duration fields follow the same rules as reclaim_create_task. No account defaults are applied.
            """)
    public String updateTask(
            @ToolParam(description = "The unique ID of the task to update.") Long taskId,
            @ToolParam(description = "New title.", required = false) String title,
            @ToolParam(description = "New notes.", required = false) String notes,
            @ToolParam(description = "WORK or PERSONAL.", required = false) String eventCategory,
            @ToolParam(description = "Sub-category, e.g. FOCUS, STAFF_MEETING.", required = false) String eventSubType,
            @ToolParam(description = "P1 (highest) to P4 (lowest).", required = false) String priority,
            @ToolParam(description = "Total duration in 15-minute chunks.", required = false) Integer timeChunksRequired,
            @ToolParam(description = "Total duration in minutes, multiple of 15.", required = false) Integer durationMinutes,
            @ToolParam(description = "Smallest scheduled block in 15-minute chunks.", required = false) Integer minChunkSize,
            @ToolParam(description = "Smallest scheduled block in minutes, multiple of 15.", required = false) Integer minDurationMinutes,
            @ToolParam(description = "Largest scheduled block in 15-minute chunks.", required = false) Integer maxChunkSize,
            @ToolParam(description = "Largest scheduled block in minutes, multiple of 15.", required = false) Integer maxDurationMinutes,
            @ToolParam(description = "Schedule the whole duration as a single block.", required = false) Boolean lockChunkSizeToDuration,
            @ToolParam(description = "Put the task on deck (Up Next).", required = false) Boolean onDeck,
            @ToolParam(description = "Keep scheduled events private.", required = false) Boolean alwaysPrivate,
            @ToolParam(description = "Id of the hours scheme.", required = false) String timeSchemeId,
            @ToolParam(description = "NEW, SCHEDULED, IN_PROGRESS, COMPLETE, CANCELLED or ARCHIVED.", required = false) String status,
            @ToolParam(description = "Deadline. " + DATE_HINT, required = false) String deadline,
            @ToolParam(description = "Deadline as a number of days from now.", required = false) Integer deadlineInDays,
            @ToolParam(description = "Do not schedule before this time. " + DATE_HINT, required = false) String snoozeUntil,
            @ToolParam(description = "Snooze as a number of days from now.", required = false) Integer snoozeUntilInDays,
            @ToolParam(description = "Calendar color.", required = false) String eventColor,
            @ToolParam(description = "IANA time zone for local date/times.", required = false) String timeZone,
            @ToolParam(description = "Alias of timeZone.", required = false) String timezone) {
        return execute("reclaim_update_task", () -> {
            long id = requireTaskId(taskId);
            RawTaskFields fields = RawTaskFields.builder()
                    .title(title)
                    .notes(notes)
                    .eventCategory(eventCategory)
                    .eventSubType(eventSubType)
                    .priority(priority)
                    .timeChunksRequired(timeChunksRequired)
                    .durationMinutes(durationMinutes)
                    .minChunkSize(minChunkSize)
                    .minDurationMinutes(minDurationMinutes)
                    .maxChunkSize(maxChunkSize)
                    .maxDurationMinutes(maxDurationMinutes)
                    .lockChunkSizeToDuration(lockChunkSizeToDuration)
                    .onDeck(onDeck)
                    .alwaysPrivate(alwaysPrivate)
                    .timeSchemeId(timeSchemeId)
                    .status(status)
                    .deadline(TimeInput.of("deadline", deadline, deadlineInDays))
                    .snoozeUntil(TimeInput.of("snoozeUntil", snoozeUntil, snoozeUntilInDays))
                    .eventColor(eventColor)
                    .build();
            if (RawTaskFields.builder().build().equals(fields)) {
                throw new InvalidInputException("Update requires at least one field to change besides taskId.");
            }
            return taskService.updateTask(id, fields, timeZone(timeZone, timezone));
        }, ReclaimTask.class);
    }

    @TaskToolMeta
    @Tool(name = "reclaim_delete_task", description = "Permanently delete a Reclaim.ai task. This cannot be undone.")
    public String deleteTask(@ToolParam(description = "The unique ID of the task to delete.") Long taskId) {
        return execute("reclaim_delete_task", () -> taskService.deleteTask(requireTaskId(taskId)), JsonNode.class);
    }

    private String formatCreated(Object created) {
        if (created instanceof ReclaimTask task) {
            return formatterRegistry.getFormatter(ReclaimTask.class).format(task);
        }
        return formatterRegistry.getFormatter(JsonNode.class).format((JsonNode) created);
    }
}
