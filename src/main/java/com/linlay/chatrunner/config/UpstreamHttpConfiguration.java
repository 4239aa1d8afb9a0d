package com.linlay.chatrunner.config;

import com.linlay.chatrunner.service.LlmLogSanitizer;
import io.netty.handler.logging.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * HTTP plumbing for calls to the upstream model providers.
 */
@Configuration
public class UpstreamHttpConfiguration {

    private static final Logger log = LoggerFactory.getLogger(UpstreamHttpConfiguration.class);
    private static final String WIRETAP_LOGGER = "com.linlay.chatrunner.upstream.wiretap";

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider upstreamConnectionProvider() {
        return ConnectionProvider.builder("upstream-model-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    /**
     * Prototype builder for provider clients. Each provider clones it and adds its base url and key.
     */
    @Bean
    public WebClient.Builder upstreamWebClientBuilder(
            LlmInteractionLogProperties logProperties,
            ConnectionProvider upstreamConnectionProvider
    ) {
        HttpClient httpClient = HttpClient.create(upstreamConnectionProvider);
        if (logProperties.isEnabled() && !logProperties.isMaskSensitive()) {
            httpClient = httpClient.wiretap(WIRETAP_LOGGER, LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
        }

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .build());
        if (!logProperties.isEnabled()) {
            return builder;
        }

        boolean maskSensitive = logProperties.isMaskSensitive();
        return builder.filter((request, next) -> {
            log.debug("[upstream-http][request] {} {} headers={}", request.method(), request.url(),
                    LlmLogSanitizer.maskHeaders(request.headers(), maskSensitive));
            return next.exchange(request)
                    .doOnNext(response -> log.info("[upstream-http][response] {} {} status={}",
                            request.method(), request.url(), response.statusCode().value()));
        });
    }
}
