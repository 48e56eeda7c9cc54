package bbt.tao.reclaim;

import bbt.tao.reclaim.conf.TaskResourceConfig;
import bbt.tao.reclaim.dto.reclaim.ReclaimTask;
import bbt.tao.reclaim.exception.ReclaimApiException;
import bbt.tao.reclaim.service.TaskService;
import bbt.tao.reclaim.tools.formatter.JsonRenderer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskResourceConfigTest {

    @Mock
    private TaskService taskService;

    private Map<String, McpServerFeatures.SyncResourceSpecification> resources;

    @BeforeEach
    void setUp() {
        resources = new TaskResourceConfig().taskResources(taskService, new JsonRenderer(new ObjectMapper()))
                .stream()
                .collect(Collectors.toMap(spec -> spec.resource().uri(), Function.identity()));
    }

    private McpSchema.ReadResourceResult read(String uri) {
        return resources.get(uri).readHandler().apply(null, null);
    }

    @Test
    void exposesActiveTasksAndDefaults() {
        assertThat(resources).containsOnlyKeys(TaskResourceConfig.ACTIVE_TASKS_URI, TaskResourceConfig.TASK_DEFAULTS_URI);
        assertThat(resources.get(TaskResourceConfig.ACTIVE_TASKS_URI).resource().mimeType()).isEqualTo("application/json");
    }

    @Test
    void activeTasksAreServedAsJson() {
        ReclaimTask task = new ReclaimTask();
        task.setId(12L);
        task.setStatus("COMPLETE");
        when(taskService.listActiveTasks()).thenReturn(Mono.just(List.of(task)));

        McpSchema.ReadResourceResult result = read(TaskResourceConfig.ACTIVE_TASKS_URI);

        McpSchema.TextResourceContents contents = (McpSchema.TextResourceContents) result.contents().get(0);
        assertThat(contents.uri()).isEqualTo("tasks://active");
        assertThat(contents.text()).contains("\"id\" : 12").contains("\"status\" : \"COMPLETE\"");
    }

    @Test
    void failuresNameTheResource() {
        when(taskService.getTaskDefaults()).thenReturn(Mono.error(new ReclaimApiException("API Call Failed (fetchCurrentUser): boom")));

        assertThatThrownBy(() -> read(TaskResourceConfig.TASK_DEFAULTS_URI))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Failed to fetch resource tasks://defaults: API Call Failed (fetchCurrentUser): boom");
    }
}
