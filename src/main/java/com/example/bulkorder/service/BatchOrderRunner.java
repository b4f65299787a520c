package com.example.bulkorder.service;

import com.example.bulkorder.client.ShoplineOrderClient;
import com.example.bulkorder.config.ShoplineProperties;
import com.example.bulkorder.domain.BatchTask;
import com.example.bulkorder.domain.OrderRecord;
import com.example.bulkorder.dto.OrderPayload;
import com.example.bulkorder.dto.SubmissionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 일괄 주문 실행 서비스
 * 입력 파일의 주문들을 순차적으로 Shopline 스토어에 생성하고 결과 파일을 남긴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchOrderRunner {

    private final OrderFileReader orderFileReader;
    private final OrderRecordNormalizer orderRecordNormalizer;
    private final ResultExportService resultExportService;
    private final ShoplineProperties properties;

    /**
     * 입력 파일 전체를 처리
     * 행 단위 실패는 로그 한 줄로 남기고 다음 행을 계속 처리한다.
     *
     * @param task 로그를 기록할 작업
     * @param inputFile 입력 파일 (.csv 또는 .xlsx)
     * @param client 작업용 주문 생성 클라이언트
     * @return 결과 파일 경로
     * @throws BatchProcessingException 입력 파일을 읽을 수 없거나 결과 파일 저장에 실패한 경우, 또는 스레드가 인터럽트된 경우
     */
    public Path run(BatchTask task, Path inputFile, ShoplineOrderClient client) {
        List<OrderRecord> records = orderFileReader.read(inputFile);
        log.info("일괄 주문 시작: taskId={}, store={}, 총 {}개 행", task.getId(), client.getStoreDomain(), records.size());

        int successCount = 0;
        for (OrderRecord record : records) {
            if (Thread.currentThread().isInterrupted()) {
                throw interrupted(task);
            }
            SubmissionOutcome outcome = process(record, client);
            if (outcome.isSuccess()) {
                successCount++;
            }
            task.appendLog(outcome.getMessage());

            // Rate Limit 방지를 위해 주문 요청 사이에 딜레이
            pause(task);
        }

        log.info("일괄 주문 완료: taskId={}, 총 {}개, 성공 {}개, 실패 {}개",
                task.getId(), records.size(), successCount, records.size() - successCount);

        return resultExportService.export(task.getLogs());
    }

    private SubmissionOutcome process(OrderRecord record, ShoplineOrderClient client) {
        OrderPayload payload;
        try {
            payload = orderRecordNormalizer.normalize(record);
        } catch (InvalidQuantityException e) {
            // 검증 에러: 요청을 보내지 않고 이 행만 실패 처리
            log.error("주문 변환 실패 (검증 에러): 행 {}, 에러={}", record.getRowNumber(), e.getMessage());
            return SubmissionOutcome.failure("Row " + record.getRowNumber() + ": " + e.getMessage());
        }

        log.info("주문 생성 시작: 행 {}, 고객={}, 상품 {}개",
                record.getRowNumber(), payload.getCustomer().getEmail(), payload.getLineItems().size());
        return client.submit(payload);
    }

    private void pause(BatchTask task) {
        Duration interval = properties.getBatch().getPacingInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw interrupted(task);
        }
    }

    /**
     * 스레드가 인터럽트되면 남은 행은 전송하지 않고 작업을 중단한다
     */
    private BatchProcessingException interrupted(BatchTask task) {
        log.warn("일괄 주문 중단됨 (인터럽트): taskId={}, 처리된 행 {}개", task.getId(), task.getLogCount());
        return new BatchProcessingException("Batch interrupted after " + task.getLogCount() + " rows");
    }
}
