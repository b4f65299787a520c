package com.example.bulkorder.service;

import com.example.bulkorder.domain.BatchTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 프로세스 전역 작업 저장소 (작업 ID -> 작업)
 * <p>
 * 작업 ID 는 1부터 순차 발급되며 프로세스가 살아있는 동안 재사용/삭제되지 않는다.
 * 항목을 지우지 않으므로 오래 실행되는 프로세스에서는 작업 수만큼 메모리가 계속 늘어난다.
 * 단일 운영자 환경을 가정하며 ID 추측에 대한 보호는 없다.
 */
@Slf4j
@Component
public class TaskRegistry {

    private final Map<String, BatchTask> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * 새 작업 생성 (상태: Processing, 빈 로그)
     *
     * @param fileName 업로드된 원본 파일명
     * @return 생성된 작업
     */
    public BatchTask create(String fileName) {
        String taskId = String.valueOf(sequence.incrementAndGet());
        BatchTask task = new BatchTask(taskId, fileName);
        tasks.put(taskId, task);
        log.info("작업 생성: taskId={}, fileName={}", taskId, fileName);
        return task;
    }

    public Optional<BatchTask> get(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * 전체 작업 목록 (생성 순)
     */
    public List<BatchTask> findAll() {
        List<BatchTask> all = new ArrayList<>(tasks.values());
        all.sort(Comparator.comparingLong(task -> Long.parseLong(task.getId())));
        return all;
    }
}
