package com.example.bulkorder.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 일괄 주문 작업 실행용 스레드 풀 설정
 * 작업(파일) 하나당 스레드 하나, 작업 내부의 주문 요청은 순차 처리
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String BATCH_TASK_EXECUTOR = "batchTaskExecutor";

    @Bean(name = BATCH_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor batchTaskExecutor(ShoplineProperties properties) {
        int poolSize = Math.max(1, properties.getBatch().getExecutorPoolSize());
        log.info("일괄 주문 작업 실행기 생성: poolSize={}", poolSize);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("bulk-order-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
