package bbt.tao.reclaim.manager;

import org.springframework.web.reactive.function.client.ExchangeFilterFunction;

public interface ApiAuthenticator {
    boolean hasCredentials();

    ExchangeFilterFunction authenticationFilter();
}
