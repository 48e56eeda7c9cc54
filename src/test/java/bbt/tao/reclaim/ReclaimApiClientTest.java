package bbt.tao.reclaim;

import bbt.tao.reclaim.dto.reclaim.ReclaimTask;
import bbt.tao.reclaim.dto.reclaim.TaskInputData;
import bbt.tao.reclaim.exception.ReclaimApiException;
import bbt.tao.reclaim.service.client.ReclaimApiClient;
import bbt.tao.reclaim.time.ResolvedInstant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReclaimApiClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private ReclaimApiClient clientReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://api.example.test/api")
                .exchangeFunction(request -> {
                    requests.add(request);
                    ClientResponse.Builder response = ClientResponse.create(status);
                    if (body != null) {
                        response.header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE).body(body);
                    }
                    return Mono.just(response.build());
                })
                .build();
        return new ReclaimApiClient(webClient, new ObjectMapper());
    }

    @Test
    void listTasksReadsTheTaskArray() {
        ReclaimApiClient client = clientReturning(HttpStatus.OK, """
                [{"id": 1, "title": "Write report", "status": "COMPLETE", "timeChunksRemaining": 2, "recurringAssignmentType": "TASK"},
                 {"id": 2, "title": "Old", "status": "ARCHIVED"}]
                """);

        StepVerifier.create(client.listTasks())
                .assertNext(tasks -> {
                    assertThat(tasks).extracting(ReclaimTask::getId).containsExactly(1L, 2L);
                    assertThat(tasks.get(0).getTimeChunksRemaining()).isEqualTo(2);
                    assertThat(tasks.get(0).getAdditionalProperties()).containsEntry("recurringAssignmentType", "TASK");
                })
                .verifyComplete();

        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.GET);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/tasks");
    }

    @Test
    void createAtTimePassesStartTimeAsQueryParameter() {
        ReclaimApiClient client = clientReturning(HttpStatus.OK, "{\"taskOrHabit\": {\"id\": 7}}");
        ResolvedInstant start = ResolvedInstant.of(Instant.parse("2026-01-05T16:00:00Z"));

        StepVerifier.create(client.createTaskAtTime(TaskInputData.builder().title("Focus").build(), start))
                .assertNext(body -> assertThat(body.path("taskOrHabit").path("id").asLong()).isEqualTo(7L))
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().getPath()).isEqualTo("/api/tasks/at-time");
        assertThat(request.url().getQuery()).isEqualTo("startTime=2026-01-05T16:00:00.000Z");
    }

    @Test
    void plannerActionWithoutBodyReportsSuccess() {
        ReclaimApiClient client = clientReturning(HttpStatus.NO_CONTENT, null);

        StepVerifier.create(client.markTaskComplete(42))
                .assertNext(body -> assertThat(body.path("success").asBoolean()).isTrue())
                .verifyComplete();

        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/planner/done/task/42");
    }

    @Test
    void logWorkSendsMinutesAndEnd() {
        ReclaimApiClient client = clientReturning(HttpStatus.OK, "{}");
        ResolvedInstant end = ResolvedInstant.of(Instant.parse("2026-01-05T17:30:00Z"));

        StepVerifier.create(client.logWorkForTask(42, 30, end)).expectNextCount(1).verifyComplete();

        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/planner/log-work/task/42");
        assertThat(requests.get(0).url().getQuery()).isEqualTo("minutes=30&end=2026-01-05T17:30:00.000Z");
    }

    @Test
    void errorResponseBecomesReclaimApiException() {
        ReclaimApiClient client = clientReturning(HttpStatus.NOT_FOUND,
                "{\"title\": \"Not Found\", \"message\": \"Task not found\"}");

        StepVerifier.create(client.getTask(42))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ReclaimApiException.class)
                            .hasMessage("API Call Failed (getTask(taskId=42)): Task not found");
                    ReclaimApiException apiError = (ReclaimApiException) error;
                    assertThat(apiError.getStatus()).isEqualTo(404);
                    assertThat(apiError.getDetail().path("title").asText()).isEqualTo("Not Found");
                })
                .verify();
    }

    @Test
    void nonJsonErrorBodyIsKeptAsText() {
        ReclaimApiClient client = clientReturning(HttpStatus.BAD_GATEWAY, "upstream unavailable");

        StepVerifier.create(client.deleteTask(5))
                .expectErrorSatisfies(error -> {
                    ReclaimApiException apiError = (ReclaimApiException) error;
                    assertThat(apiError.getStatus()).isEqualTo(502);
                    assertThat(apiError.getDetail().asText()).isEqualTo("upstream unavailable");
                    assertThat(apiError.getMessage()).startsWith("API Call Failed (deleteTask(taskId=5)): ");
                })
                .verify();
    }
}
