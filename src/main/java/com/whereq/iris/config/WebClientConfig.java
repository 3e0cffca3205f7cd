package com.whereq.iris.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for the streaming completion backend
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)); // 16MB
    }

    /**
     * Client pre-bound to the Anthropic Messages API: base URL, key and version headers.
     */
    @Bean
    public WebClient completionWebClient(WebClient.Builder webClientBuilder, IrisProperties properties) {
        IrisProperties.LlmConfig llm = properties.getLlm();

        HttpClient httpClient = HttpClient.create()
            .responseTimeout(llm.getReadTimeout());

        return webClientBuilder.clone()
            .baseUrl(llm.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("x-api-key", llm.getApiKey())
            .defaultHeader("anthropic-version", llm.getApiVersion())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }
}
