package bbt.tao.reclaim.service;

import bbt.tao.reclaim.conf.ReclaimProperties;
import bbt.tao.reclaim.dto.reclaim.AccountDefaults;
import bbt.tao.reclaim.dto.reclaim.AccountInfo;
import bbt.tao.reclaim.manager.ApiAuthenticator;
import bbt.tao.reclaim.service.client.ReclaimApiClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Process-wide cache of the account timezone and task defaults.
 * <p>
 * The first caller triggers {@code GET /users/current}; callers arriving while it is in flight share that
 * request and later callers get the stored result. A failed fetch is cached as well, so the account is
 * queried at most once per process.
 */
@Slf4j
@Service
public class AccountInfoService {

    private final ReclaimApiClient apiClient;
    private final ReclaimProperties properties;
    private final ApiAuthenticator authenticator;
    private final ObjectMapper objectMapper;

    private Mono<AccountInfo> accountInfoMono;

    public AccountInfoService(ReclaimApiClient apiClient,
                              ReclaimProperties properties,
                              ApiAuthenticator authenticator,
                              ObjectMapper objectMapper) {
        this.apiClient = apiClient;
        this.properties = properties;
        this.authenticator = authenticator;
        this.objectMapper = objectMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        if (hasText(properties.getDefaultTimeZone()) || !authenticator.hasCredentials()) {
            return;
        }
        accountInfo().subscribe(
                info -> log.info("Account timezone loaded at startup: {}", info.timeZone()),
                error -> log.warn("Could not load account info at startup: {}", error.getMessage())
        );
    }

    public Mono<AccountInfo> accountInfo() {
        synchronized (this) {
            if (accountInfoMono == null) {
                log.debug("Fetching account info from /users/current");
                accountInfoMono = apiClient.fetchCurrentUser()
                        .map(this::toAccountInfo)
                        .doOnError(e -> log.error("Account info fetch failed", e))
                        .cache();
            }
            return accountInfoMono;
        }
    }

    /**
     * Same as {@link #accountInfo()} but degrades to {@link AccountInfo#EMPTY} when the fetch failed,
     * for callers that can proceed without account data.
     */
    public Mono<AccountInfo> accountInfoOrEmpty() {
        return accountInfo()
                .onErrorResume(e -> {
                    log.warn("Proceeding without account info: {}", e.getMessage());
                    return Mono.just(AccountInfo.EMPTY);
                })
                .defaultIfEmpty(AccountInfo.EMPTY);
    }

    private AccountInfo toAccountInfo(JsonNode user) {
        String timeZone = firstText(user.path("timezone"), user.path("settings").path("timezone"));
        JsonNode rawDefaults = user.path("features").path("taskSettings").path("defaults");
        if (rawDefaults.isMissingNode() || rawDefaults.isNull()) {
            return new AccountInfo(timeZone, AccountDefaults.NONE, NullNode.getInstance());
        }
        try {
            AccountDefaults defaults = objectMapper.treeToValue(rawDefaults, AccountDefaults.class);
            return new AccountInfo(timeZone, defaults, rawDefaults);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable task defaults, ignoring them: {}", e.getOriginalMessage());
            return new AccountInfo(timeZone, AccountDefaults.NONE, rawDefaults);
        }
    }

    private static String firstText(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            if (node.isTextual() && hasText(node.asText())) {
                return node.asText().trim();
            }
        }
        return null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
