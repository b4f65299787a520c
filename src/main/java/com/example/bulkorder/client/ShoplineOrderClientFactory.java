package com.example.bulkorder.client;

import com.example.bulkorder.config.ShoplineProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 작업마다 토큰/스토어 도메인이 다른 ShoplineOrderClient 를 생성
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShoplineOrderClientFactory {

    private final WebClient.Builder shoplineWebClientBuilder;
    private final ObjectMapper objectMapper;
    private final ShoplineProperties properties;

    /**
     * @param accessToken Admin API Access Token (Bearer)
     * @param storeDomain 스토어 도메인 (예: example.myshopline.com, http(s):// 접두사 허용)
     * @return 주문 생성 클라이언트
     */
    public ShoplineOrderClient create(String accessToken, String storeDomain) {
        ShoplineOrderClient client = new ShoplineOrderClient(
                shoplineWebClientBuilder.clone(),
                objectMapper,
                accessToken,
                storeDomain,
                properties.getApiVersion(),
                properties.getRequestTimeout(),
                properties.getMaxErrorBodyLength());
        log.info("주문 생성 클라이언트 생성: baseUrl={}", client.getBaseUrl());
        return client;
    }
}
