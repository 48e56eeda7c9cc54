package bbt.tao.reclaim.service;

import bbt.tao.reclaim.conf.ReclaimProperties;
import bbt.tao.reclaim.dto.reclaim.AccountInfo;
import bbt.tao.reclaim.dto.reclaim.ReclaimTask;
import bbt.tao.reclaim.exception.InvalidInputException;
import bbt.tao.reclaim.normalize.NormalizedTask;
import bbt.tao.reclaim.normalize.RawTaskFields;
import bbt.tao.reclaim.normalize.TaskFieldNormalizer;
import bbt.tao.reclaim.normalize.TaskFlow;
import bbt.tao.reclaim.service.client.ReclaimApiClient;
import bbt.tao.reclaim.time.LocalTimeResolver;
import bbt.tao.reclaim.time.ResolutionContext;
import bbt.tao.reclaim.time.ResolvedInstant;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
public class TaskService {

    private final ReclaimApiClient apiClient;
    private final AccountInfoService accountInfoService;
    private final TaskFieldNormalizer normalizer;
    private final LocalTimeResolver timeResolver;
    private final ReclaimProperties properties;
    private final Clock clock;

    public TaskService(ReclaimApiClient apiClient,
                       AccountInfoService accountInfoService,
                       TaskFieldNormalizer normalizer,
                       LocalTimeResolver timeResolver,
                       ReclaimProperties properties,
                       Clock clock) {
        this.apiClient = apiClient;
        this.accountInfoService = accountInfoService;
        this.normalizer = normalizer;
        this.timeResolver = timeResolver;
        this.properties = properties;
        this.clock = clock;
    }

    public Mono<List<ReclaimTask>> listTasks(boolean activeOnly) {
        return apiClient.listTasks()
                .map(tasks -> activeOnly ? filterActive(tasks) : tasks);
    }

    public Mono<List<ReclaimTask>> listActiveTasks() {
        return listTasks(true);
    }

    public Mono<ReclaimTask> getTask(long taskId) {
        return apiClient.getTask(taskId);
    }

    public Mono<JsonNode> getTaskDefaults() {
        return accountInfoService.accountInfo().map(AccountInfo::rawDefaults);
    }

    /**
     * Creates a task. With a start time the task is placed at that time, otherwise Reclaim schedules it.
     *
     * @return the created {@link ReclaimTask}, or the raw response of the at-time endpoint
     */
    public Mono<Object> createTask(RawTaskFields fields, String timeZone) {
        TaskFlow flow = fields.startTime() != null ? TaskFlow.CREATE_AT_TIME : TaskFlow.CREATE;
        return accountInfoService.accountInfoOrEmpty()
                .map(info -> normalizer.normalize(fields, info.defaults(), context(timeZone, info), flow))
                .flatMap(normalized -> flow == TaskFlow.CREATE_AT_TIME
                        ? apiClient.createTaskAtTime(normalized.payload(), normalized.startTime()).cast(Object.class)
                        : apiClient.createTask(normalized.payload()).cast(Object.class));
    }

    /**
     * Applies a partial update. When nothing is left to send the current task is returned unchanged.
     */
    public Mono<ReclaimTask> updateTask(long taskId, RawTaskFields fields, String timeZone) {
        return resolutionContext(timeZone, hasTimeInput(fields))
                .map(context -> normalizer.normalize(fields, null, context, TaskFlow.UPDATE))
                .map(NormalizedTask::payload)
                .flatMap(payload -> {
                    if (payload.hasNoFields()) {
                        log.warn("Update for task {} has no fields to change, returning the current task", taskId);
                        return apiClient.getTask(taskId);
                    }
                    return apiClient.updateTask(taskId, payload);
                });
    }

    public Mono<JsonNode> deleteTask(long taskId) {
        return apiClient.deleteTask(taskId);
    }

    public Mono<JsonNode> markComplete(long taskId) {
        return apiClient.markTaskComplete(taskId);
    }

    public Mono<JsonNode> markIncomplete(long taskId) {
        return apiClient.markTaskIncomplete(taskId);
    }

    public Mono<JsonNode> addTime(long taskId, int minutes) {
        if (minutes <= 0) {
            return Mono.error(new InvalidInputException("Minutes must be positive to add time."));
        }
        return apiClient.addTimeToTask(taskId, minutes);
    }

    public Mono<JsonNode> startTimer(long taskId) {
        return apiClient.startTaskTimer(taskId);
    }

    public Mono<JsonNode> stopTimer(long taskId) {
        return apiClient.stopTaskTimer(taskId);
    }

    /**
     * @param end optional end of the work session, any form accepted for deadlines
     */
    public Mono<JsonNode> logWork(long taskId, int minutes, String end, String timeZone) {
        if (minutes <= 0) {
            return Mono.error(new InvalidInputException("Minutes must be positive to log work."));
        }
        if (end == null || end.isBlank()) {
            return apiClient.logWorkForTask(taskId, minutes, null);
        }
        return resolutionContext(timeZone, true)
                .map(context -> resolveEnd(end, context))
                .flatMap(resolvedEnd -> apiClient.logWorkForTask(taskId, minutes, resolvedEnd));
    }

    public Mono<JsonNode> clearExceptions(long taskId) {
        return apiClient.clearTaskExceptions(taskId);
    }

    public Mono<JsonNode> prioritize(long taskId) {
        return apiClient.prioritizeTask(taskId);
    }

    /**
     * Active means not deleted and neither {@code ARCHIVED} nor {@code CANCELLED}. {@code COMPLETE} tasks only
     * used up their scheduled time and stay active.
     */
    public static List<ReclaimTask> filterActive(List<ReclaimTask> tasks) {
        return tasks.stream().filter(ReclaimTask::isActive).toList();
    }

    private ResolvedInstant resolveEnd(String end, ResolutionContext context) {
        try {
            return timeResolver.resolve(end, context);
        } catch (InvalidInputException e) {
            throw new InvalidInputException("Invalid 'end' date format: \"" + end + "\". " + e.getMessage()
                    + " Please use ISO 8601 or YYYY-MM-DD format.", e);
        }
    }

    private Mono<ResolutionContext> resolutionContext(String timeZone, boolean needsZone) {
        ResolutionContext base = context(timeZone, AccountInfo.EMPTY);
        if (!needsZone || !base.needsAccountTimeZone()) {
            return Mono.just(base);
        }
        return accountInfoService.accountInfoOrEmpty()
                .map(info -> base.withAccountTimeZone(info.timeZone()));
    }

    private ResolutionContext context(String timeZone, AccountInfo info) {
        return new ResolutionContext(timeZone, properties.getDefaultTimeZone(), info.timeZone(), clock.getZone().getId());
    }

    private static boolean hasTimeInput(RawTaskFields fields) {
        return fields.deadline() != null || fields.snoozeUntil() != null || fields.startTime() != null;
    }
}
