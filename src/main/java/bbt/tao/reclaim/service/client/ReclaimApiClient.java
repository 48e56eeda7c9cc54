package bbt.tao.reclaim.service.client;

import bbt.tao.reclaim.dto.reclaim.ReclaimTask;
import bbt.tao.reclaim.dto.reclaim.TaskInputData;
import bbt.tao.reclaim.exception.ReclaimApiException;
import bbt.tao.reclaim.time.ResolvedInstant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@Service
public class ReclaimApiClient {

    private static final ParameterizedTypeReference<List<ReclaimTask>> TASK_LIST = new ParameterizedTypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public ReclaimApiClient(@Qualifier("reclaimWebClient") WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    public Mono<List<ReclaimTask>> listTasks() {
        return webClient.get()
                .uri("/tasks")
                .retrieve()
                .bodyToMono(TASK_LIST)
                .defaultIfEmpty(List.of())
                .doOnNext(tasks -> log.debug("Fetched {} tasks", tasks.size()))
                .onErrorMap(e -> toApiException(e, "listTasks"));
    }

    public Mono<ReclaimTask> getTask(long taskId) {
        return webClient.get()
                .uri("/tasks/{id}", taskId)
                .retrieve()
                .bodyToMono(ReclaimTask.class)
                .onErrorMap(e -> toApiException(e, "getTask(taskId=" + taskId + ")"));
    }

    public Mono<ReclaimTask> createTask(TaskInputData payload) {
        return webClient.post()
                .uri("/tasks")
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(ReclaimTask.class)
                .doOnNext(task -> log.info("Created task {} '{}'", task.getId(), task.getTitle()))
                .onErrorMap(e -> toApiException(e, "createTask"));
    }

    /**
     * Creates a task pinned to {@code startTime}. The response shape differs from a plain create, so it is
     * returned as-is.
     */
    public Mono<JsonNode> createTaskAtTime(TaskInputData payload, ResolvedInstant startTime) {
        String context = "createTaskAtTime(startTime=" + startTime + ")";
        return webClient.post()
                .uri(builder -> builder.path("/tasks/at-time")
                        .queryParam("startTime", startTime.iso())
                        .build())
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(success())
                .onErrorMap(e -> toApiException(e, context));
    }

    public Mono<ReclaimTask> updateTask(long taskId, TaskInputData payload) {
        return webClient.patch()
                .uri("/tasks/{id}", taskId)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(ReclaimTask.class)
                .onErrorMap(e -> toApiException(e, "updateTask(taskId=" + taskId + ")"));
    }

    public Mono<JsonNode> deleteTask(long taskId) {
        return webClient.delete()
                .uri("/tasks/{id}", taskId)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(success())
                .doOnSuccess(ignored -> log.info("Deleted task {}", taskId))
                .onErrorMap(e -> toApiException(e, "deleteTask(taskId=" + taskId + ")"));
    }

    public Mono<JsonNode> markTaskComplete(long taskId) {
        return plannerAction("/planner/done/task/{id}", taskId, "markTaskComplete");
    }

    public Mono<JsonNode> markTaskIncomplete(long taskId) {
        return plannerAction("/planner/unarchive/task/{id}", taskId, "markTaskIncomplete");
    }

    public Mono<JsonNode> addTimeToTask(long taskId, int minutes) {
        String context = "addTimeToTask(taskId=" + taskId + ", minutes=" + minutes + ")";
        return webClient.post()
                .uri(builder -> builder.path("/planner/add-time/task/{id}")
                        .queryParam("minutes", minutes)
                        .build(taskId))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(success())
                .onErrorMap(e -> toApiException(e, context));
    }

    public Mono<JsonNode> startTaskTimer(long taskId) {
        return plannerAction("/planner/start/task/{id}", taskId, "startTaskTimer");
    }

    public Mono<JsonNode> stopTaskTimer(long taskId) {
        return plannerAction("/planner/stop/task/{id}", taskId, "stopTaskTimer");
    }

    /**
     * @param end end of the work session, {@code null} lets Reclaim assume now
     */
    public Mono<JsonNode> logWorkForTask(long taskId, int minutes, ResolvedInstant end) {
        String context = "logWorkForTask(taskId=" + taskId + ", minutes=" + minutes + ", end=" + (end == null ? "now" : end) + ")";
        return webClient.post()
                .uri(builder -> {
                    builder.path("/planner/log-work/task/{id}").queryParam("minutes", minutes);
                    if (end != null) {
                        builder.queryParam("end", end.iso());
                    }
                    return builder.build(taskId);
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(success())
                .onErrorMap(e -> toApiException(e, context));
    }

    public Mono<JsonNode> clearTaskExceptions(long taskId) {
        return plannerAction("/planner/clear-exceptions/task/{id}", taskId, "clearTaskExceptions");
    }

    public Mono<JsonNode> prioritizeTask(long taskId) {
        return plannerAction("/planner/prioritize/task/{id}", taskId, "prioritizeTask");
    }

    public Mono<JsonNode> fetchCurrentUser() {
        return webClient.get()
                .uri("/users/current")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorMap(e -> toApiException(e, "fetchCurrentUser"));
    }

    private Mono<JsonNode> plannerAction(String path, long taskId, String operation) {
        return webClient.post()
                .uri(path, taskId)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(success())
                .doOnNext(body -> log.debug("{} for task {} returned {}", operation, taskId, body))
                .onErrorMap(e -> toApiException(e, operation + "(taskId=" + taskId + ")"));
    }

    private ObjectNode success() {
        return objectMapper.createObjectNode().put("success", true);
    }

    private ReclaimApiException toApiException(Throwable error, String context) {
        Integer status = null;
        JsonNode detail = null;
        String message = error.getMessage();

        if (error instanceof WebClientResponseException responseException) {
            status = responseException.getStatusCode().value();
            detail = readDetail(responseException.getResponseBodyAsString());
            String fromBody = firstText(detail, "message", "title");
            if (fromBody != null) {
                message = fromBody;
            }
            log.error("Reclaim API error ({}) - status {}: {}", context, status, detail);
        } else if (error instanceof ReclaimApiException apiException) {
            status = apiException.getStatus();
            detail = apiException.getDetail();
            log.error("Reclaim API call ({}) failed: {}", context, message);
        } else {
            log.error("Error during Reclaim API call ({})", context, error);
        }
        return new ReclaimApiException("API Call Failed (" + context + "): " + message, status, detail, error);
    }

    private JsonNode readDetail(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return TextNode.valueOf(body);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
