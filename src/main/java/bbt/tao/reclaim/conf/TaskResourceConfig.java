package bbt.tao.reclaim.conf;

import bbt.tao.reclaim.service.TaskService;
import bbt.tao.reclaim.tools.formatter.JsonRenderer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

@Slf4j
@Configuration
public class TaskResourceConfig {

    public static final String ACTIVE_TASKS_URI = "tasks://active";
    public static final String TASK_DEFAULTS_URI = "tasks://defaults";

    private static final String JSON = "application/json";

    @Bean
    public List<McpServerFeatures.SyncResourceSpecification> taskResources(TaskService taskService, JsonRenderer jsonRenderer) {
        McpSchema.Resource activeTasks = new McpSchema.Resource(
                ACTIVE_TASKS_URI,
                "reclaim_active_tasks",
                "List of all active tasks from Reclaim.ai. Active means tasks that are not deleted and whose status is "
                        + "not ARCHIVED or CANCELLED. Tasks with status 'COMPLETE' (meaning scheduled time is finished) are included here.",
                JSON,
                null);
        McpSchema.Resource taskDefaults = new McpSchema.Resource(
                TASK_DEFAULTS_URI,
                "reclaim_task_defaults",
                "Account-level task defaults from Reclaim (chunk size defaults, priority defaults, etc.). "
                        + "Useful for building valid task payloads.",
                JSON,
                null);

        return List.of(
                new McpServerFeatures.SyncResourceSpecification(activeTasks,
                        (exchange, request) -> read(ACTIVE_TASKS_URI, taskService::listActiveTasks, jsonRenderer)),
                new McpServerFeatures.SyncResourceSpecification(taskDefaults,
                        (exchange, request) -> read(TASK_DEFAULTS_URI, taskService::getTaskDefaults, jsonRenderer))
        );
    }

    static McpSchema.ReadResourceResult read(String uri, Supplier<? extends Mono<?>> source, JsonRenderer jsonRenderer) {
        Object data;
        try {
            data = source.get().subscribeOn(Schedulers.boundedElastic()).toFuture().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("MCP resource error (URI: {}): {}", uri, cause.getMessage(), cause);
            throw new IllegalStateException("Failed to fetch resource " + uri + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching resource " + uri, e);
        }
        McpSchema.TextResourceContents contents = new McpSchema.TextResourceContents(uri, JSON, jsonRenderer.render(data));
        return new McpSchema.ReadResourceResult(List.of(contents));
    }
}
