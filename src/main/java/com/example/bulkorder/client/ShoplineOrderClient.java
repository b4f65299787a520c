package com.example.bulkorder.client;

import com.example.bulkorder.constants.ShoplineApiConstants;
import com.example.bulkorder.dto.OrderPayload;
import com.example.bulkorder.dto.SubmissionOutcome;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Shopline Admin OpenAPI 주문 생성 클라이언트
 * <p>
 * 작업 하나(토큰 + 스토어 도메인)마다 한 번 생성되며 주문 생성 요청을 동기로 1건씩 보낸다.
 * API 오류나 네트워크 오류는 예외로 던지지 않고 실패 결과로 변환한다.
 */
@Slf4j
public class ShoplineOrderClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    @Getter
    private final String storeDomain;
    @Getter
    private final String baseUrl;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final int maxErrorBodyLength;

    public ShoplineOrderClient(WebClient.Builder webClientBuilder,
                               ObjectMapper objectMapper,
                               String accessToken,
                               String storeDomain,
                               String apiVersion,
                               Duration requestTimeout,
                               int maxErrorBodyLength) {
        this.storeDomain = normalizeDomain(storeDomain);
        this.baseUrl = "https://" + this.storeDomain + ShoplineApiConstants.ADMIN_API_PATH + apiVersion;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.maxErrorBodyLength = maxErrorBodyLength;
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .build();
    }

    /**
     * 주문 생성 (POST {baseUrl}/orders.json, 본문: {"order": payload})
     *
     * @param payload 주문 생성 요청
     * @return 처리 결과 (200/201 이면 성공, 그 외 상태코드/네트워크 오류는 실패)
     */
    public SubmissionOutcome submit(OrderPayload payload) {
        try {
            RawResponse response = webClient.post()
                    .uri(ShoplineApiConstants.ORDERS_PATH)
                    .bodyValue(Map.of("order", payload))
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new RawResponse(clientResponse.statusCode().value(), body)))
                    .timeout(requestTimeout)
                    .block();

            if (response == null) {
                return SubmissionOutcome.failure("Empty response from " + baseUrl + ShoplineApiConstants.ORDERS_PATH);
            }
            return toOutcome(response);

        } catch (Exception e) {
            // 네트워크 오류(DNS, 연결 실패, 타임아웃)는 이 행만 실패 처리
            String description = describeTransportError(e);
            log.error("주문 생성 요청 실패 (네트워크 오류): store={}, error={}", storeDomain, description);
            return SubmissionOutcome.failure(description);
        }
    }

    private SubmissionOutcome toOutcome(RawResponse response) {
        if (response.status == 200 || response.status == 201) {
            String reference = extractOrderReference(response.body);
            log.info("주문 생성 성공: store={}, order={}", storeDomain, reference);
            return SubmissionOutcome.success("Order " + reference + " created");
        }

        String body = truncate(response.body);
        log.error("주문 생성 실패: store={}, status={}", storeDomain, response.status);
        log.error("응답 본문: {}", body);
        return SubmissionOutcome.failure("Error " + response.status + ": " + body);
    }

    /**
     * 응답의 order.name, 없으면 order.id, 둘 다 없으면 "unknown" 을 반환
     */
    private String extractOrderReference(String body) {
        if (body == null || body.isBlank()) {
            return "unknown";
        }
        try {
            Map<String, Object> response = objectMapper.readValue(body, MAP_TYPE);
            Object order = response.get("order");
            if (order instanceof Map<?, ?> orderMap) {
                Object name = orderMap.get("name");
                if (name != null) {
                    return String.valueOf(name);
                }
                Object id = orderMap.get("id");
                if (id != null) {
                    return String.valueOf(id);
                }
            }
        } catch (Exception parseError) {
            log.debug("성공 응답 본문 JSON 파싱 실패 (일반 텍스트일 수 있음)", parseError);
        }
        return "unknown";
    }

    private String truncate(String body) {
        if (body == null) {
            return "";
        }
        if (maxErrorBodyLength > 0 && body.length() > maxErrorBodyLength) {
            return body.substring(0, maxErrorBodyLength) + "...(truncated)";
        }
        return body;
    }

    private String describeTransportError(Throwable error) {
        // block() 은 checked 예외를 감싸서 던지므로 원인 예외를 꺼낸다
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof WebClientRequestException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "Request timed out after " + requestTimeout.toMillis() + "ms";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    /**
     * 스토어 도메인 정규화 (http:// / https:// 접두사와 끝의 / 제거)
     */
    public static String normalizeDomain(String storeDomain) {
        if (storeDomain == null) {
            return "";
        }
        String domain = storeDomain.trim()
                .replace("https://", "")
                .replace("http://", "");
        while (domain.endsWith("/")) {
            domain = domain.substring(0, domain.length() - 1);
        }
        return domain;
    }

    /**
     * 상태코드 + 응답 본문
     */
    private static final class RawResponse {
        private final int status;
        private final String body;

        private RawResponse(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }
}
