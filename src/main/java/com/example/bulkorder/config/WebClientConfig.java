package com.example.bulkorder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Shopline API 호출을 위한 WebClient 설정
 * 스토어 도메인과 토큰은 작업마다 다르므로 Builder만 빈으로 등록한다.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder shoplineWebClientBuilder(ShoplineProperties properties) {
        return WebClient.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(10 * 1024 * 1024)) // 10MB
                .defaultHeader(HttpHeaders.CONTENT_TYPE, "application/json; charset=utf-8")
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent());
    }
}
