package com.example.bulkorder.dto;

import com.example.bulkorder.domain.BatchTask;
import com.example.bulkorder.domain.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 작업 상태 조회 응답 DTO
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskStatusResponse {

    private String taskId;

    private TaskStatus status;

    private String fileName;

    /**
     * 처리된 행 수 (로그 줄 수)
     */
    private int processedCount;

    /**
     * 행별 처리 결과 (입력 순서 유지). 목록 조회에서는 생략
     */
    private List<String> logs;

    /**
     * 결과 파일 다운로드 가능 여부
     */
    private boolean resultReady;

    /**
     * 작업 전체 실패 사유 (status=Failed 인 경우)
     */
    private String error;

    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    public static TaskStatusResponse from(BatchTask task) {
        List<String> logs = task.getLogs();
        return TaskStatusResponse.builder()
                .taskId(task.getId())
                .status(task.getStatus())
                .fileName(task.getFileName())
                .processedCount(logs.size())
                .logs(logs)
                .resultReady(task.getResultFile().isPresent())
                .error(task.getError())
                .createdAt(task.getCreatedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }

    /**
     * 로그를 제외한 요약 응답
     */
    public static TaskStatusResponse summaryOf(BatchTask task) {
        TaskStatusResponse response = from(task);
        response.setLogs(null);
        return response;
    }
}
