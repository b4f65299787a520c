package com.example.bulkorder.domain;

import lombok.Getter;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 일괄 주문 작업 (파일 하나에 대한 실행 단위)
 * <p>
 * 쓰기는 작업을 실행하는 BatchOrderRunner 한 곳에서만 일어나고,
 * 상태 조회는 다른 스레드에서 언제든 일어날 수 있다.
 * 조회 시점에 로그가 일부만 채워져 있을 수 있으나 길이는 줄어들지 않는다.
 */
@Getter
public class BatchTask {

    private final String id;
    private final String fileName;
    private final LocalDateTime createdAt;

    private final List<String> logs = new CopyOnWriteArrayList<>();

    private volatile TaskStatus status = TaskStatus.PROCESSING;
    private volatile Path resultFile;
    private volatile String error;
    private volatile LocalDateTime completedAt;

    public BatchTask(String id, String fileName) {
        this.id = id;
        this.fileName = fileName;
        this.createdAt = LocalDateTime.now();
    }

    /**
     * 현재까지 쌓인 로그의 스냅샷
     */
    public List<String> getLogs() {
        return List.copyOf(logs);
    }

    public int getLogCount() {
        return logs.size();
    }

    public Optional<Path> getResultFile() {
        return Optional.ofNullable(resultFile);
    }

    public void appendLog(String line) {
        logs.add(line);
    }

    /**
     * 정상 완료 처리 (결과 파일 설정 후 상태 변경)
     */
    public void complete(Path resultFile) {
        this.resultFile = resultFile;
        this.completedAt = LocalDateTime.now();
        this.status = TaskStatus.COMPLETED;
    }

    /**
     * 작업 전체 실패 처리 (파일 읽기 실패, 결과 파일 저장 실패 등)
     */
    public void fail(String error) {
        this.error = error;
        this.completedAt = LocalDateTime.now();
        this.status = TaskStatus.FAILED;
    }
}
