package bbt.tao.reclaim.conf;

import bbt.tao.reclaim.manager.init.ReclaimApiAuthenticator;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@EnableConfigurationProperties(ReclaimProperties.class)
public class WebClientConfig {

    private final ReclaimProperties properties;
    private final ReclaimApiAuthenticator reclaimApiAuthenticator;

    public WebClientConfig(ReclaimProperties properties, ReclaimApiAuthenticator reclaimApiAuthenticator) {
        this.properties = properties;
        this.reclaimApiAuthenticator = reclaimApiAuthenticator;
    }

    @Bean
    public WebClient reclaimWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis())
                .responseTimeout(properties.getResponseTimeout());

        log.info("Reclaim API client targets {}", properties.getBaseUrl());
        return builder
                .baseUrl(properties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(reclaimApiAuthenticator.authenticationFilter())
                .codecs(conf -> conf.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }
}
