package bbt.tao.reclaim;

import bbt.tao.reclaim.conf.ReclaimProperties;
import bbt.tao.reclaim.exception.ReclaimApiException;
import bbt.tao.reclaim.manager.init.ReclaimApiAuthenticator;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReclaimApiAuthenticatorTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private WebClient webClientWithKey(String apiKey) {
        ReclaimProperties properties = new ReclaimProperties();
        properties.setApiKey(apiKey);
        ReclaimApiAuthenticator authenticator = new ReclaimApiAuthenticator(properties);
        return WebClient.builder()
                .baseUrl("https://api.example.test/api")
                .filter(authenticator.authenticationFilter())
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK).build());
                })
                .build();
    }

    @Test
    void configuredKeyIsSentAsBearerToken() {
        WebClient webClient = webClientWithKey("  secret-key ");

        StepVerifier.create(webClient.get().uri("/tasks").retrieve().toBodilessEntity())
                .assertNext(entity -> assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK))
                .verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-key");
    }

    @Test
    void blankKeyFailsBeforeAnyRequestIsSent() {
        WebClient webClient = webClientWithKey("   ");

        StepVerifier.create(webClient.get().uri("/tasks").retrieve().toBodilessEntity())
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ReclaimApiException.class)
                        .hasMessageStartingWith("RECLAIM_API_KEY environment variable is not set"))
                .verify();

        assertThat(requests).isEmpty();
    }

    @Test
    void missingKeyReportsNoCredentials() {
        ReclaimApiAuthenticator authenticator = new ReclaimApiAuthenticator(new ReclaimProperties());

        assertThat(authenticator.hasCredentials()).isFalse();
    }
}
