package bbt.tao.reclaim.manager.init;

import bbt.tao.reclaim.conf.ReclaimProperties;
import bbt.tao.reclaim.exception.ReclaimApiException;
import bbt.tao.reclaim.manager.ApiAuthenticator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import reactor.core.publisher.Mono;

@Component
@Slf4j
public class ReclaimApiAuthenticator implements ApiAuthenticator {

    private final ReclaimProperties properties;

    public ReclaimApiAuthenticator(ReclaimProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    private void checkApiKey() {
        if (!hasCredentials()) {
            log.error("RECLAIM_API_KEY is not set. Every Reclaim tool call will fail until it is configured.");
        }
    }

    @Override
    public boolean hasCredentials() {
        String apiKey = properties.getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ExchangeFilterFunction authenticationFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (!hasCredentials()) {
                return Mono.error(new ReclaimApiException(
                        "RECLAIM_API_KEY environment variable is not set. Configure it before using Reclaim tools."));
            }
            ClientRequest authorized = ClientRequest.from(clientRequest)
                    .headers(headers -> headers.setBearerAuth(properties.getApiKey().trim()))
                    .build();
            return Mono.just(authorized);
        });
    }
}
