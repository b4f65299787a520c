package com.example.bulkorder.config;

import com.example.bulkorder.constants.ShoplineApiConstants;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Shopline 주문 일괄 등록 설정 프로퍼티
 */
@Component
@Getter
@Setter
@ConfigurationProperties(prefix = "shopline")
public class ShoplineProperties {

    private String apiVersion = ShoplineApiConstants.DEFAULT_API_VERSION;
    private String userAgent = ShoplineApiConstants.DEFAULT_USER_AGENT;

    /**
     * 주문 생성 요청 1건의 타임아웃
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * 실패 로그에 남길 응답 본문 최대 길이
     */
    private int maxErrorBodyLength = 2000;

    private Batch batch = new Batch();

    @Getter
    @Setter
    public static class Batch {

        /**
         * 주문 요청 사이 대기 시간 (Rate Limit 방지, 0이면 대기 없음)
         */
        private Duration pacingInterval = Duration.ofMillis(200);

        /**
         * 동시에 실행할 수 있는 작업(파일) 수
         */
        private int executorPoolSize = 4;

        private String uploadDir = "uploads";
        private String resultDir = "results";
    }
}
