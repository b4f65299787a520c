package com.example.bulkorder.controller;

import com.example.bulkorder.domain.BatchTask;
import com.example.bulkorder.dto.TaskStatusResponse;
import com.example.bulkorder.service.BulkOrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 주문 일괄 등록 REST API
 */
@Tag(name = "주문 일괄 등록", description = "CSV/엑셀 파일로 Shopline 주문을 일괄 생성하는 API")
@Slf4j
@RestController
@RequestMapping("/api/bulk-orders")
@RequiredArgsConstructor
public class BulkOrderController {

    private final BulkOrderService bulkOrderService;

    /**
     * 주문 파일 업로드 및 일괄 등록 시작
     * 작업은 백그라운드에서 실행되며 작업 ID 를 즉시 반환합니다.
     *
     * @param accessToken Admin API Access Token
     * @param storeDomain 스토어 도메인
     * @param file 주문 파일 (.csv 또는 .xlsx)
     * @return 작업 ID 와 상태
     */
    @Operation(
            summary = "주문 파일 업로드",
            description = "주문 파일(.csv/.xlsx)을 업로드하여 Shopline 스토어에 주문을 일괄 생성합니다. " +
                    "파일의 각 행이 하나의 주문으로 등록되며, 진행 상황은 작업 ID 로 조회합니다."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "작업 시작"),
            @ApiResponse(responseCode = "400", description = "잘못된 요청 (필수값 누락, 파일 형식 오류 등)"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> startBatch(
            @Parameter(description = "Admin API Access Token", required = true)
            @RequestParam(value = "access_token", required = false) String accessToken,
            @Parameter(description = "스토어 도메인 (예: example.myshopline.com)", required = true)
            @RequestParam(value = "store_domain", required = false) String storeDomain,
            @Parameter(description = "주문 파일 (.csv 또는 .xlsx)", required = true)
            @RequestParam(value = "file", required = false) MultipartFile file) {
        try {
            log.info("주문 파일 업로드 요청: fileName={}, size={}, storeDomain={}",
                    file != null ? file.getOriginalFilename() : null,
                    file != null ? file.getSize() : 0, storeDomain);

            BatchTask task = bulkOrderService.startBatch(accessToken, storeDomain, file);

            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("taskId", task.getId(), "status", task.getStatus()));

        } catch (IllegalArgumentException e) {
            log.error("주문 파일 업로드 실패: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(Map.of("error", e.getMessage(), "code", "VALIDATION_ERROR"));

        } catch (IOException e) {
            log.error("업로드 파일 저장 실패", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "업로드 파일을 저장할 수 없습니다: " + e.getMessage(),
                            "code", "UPLOAD_ERROR"));

        } catch (Exception e) {
            log.error("주문 파일 업로드 중 오류 발생", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "주문 파일 업로드 중 오류가 발생했습니다: " + e.getMessage(),
                            "code", "INTERNAL_ERROR"));
        }
    }

    /**
     * 작업 상태 조회
     */
    @Operation(summary = "작업 상태 조회", description = "작업 상태(Processing/Completed/Failed)와 행별 처리 결과를 조회합니다.")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "조회 성공",
                    content = @Content(schema = @Schema(implementation = TaskStatusResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "작업 없음")
    })
    @GetMapping("/{taskId}")
    public ResponseEntity<?> getStatus(@PathVariable String taskId) {
        Optional<BatchTask> task = bulkOrderService.getTask(taskId);
        if (task.isEmpty()) {
            return taskNotFound(taskId);
        }
        return ResponseEntity.ok(TaskStatusResponse.from(task.get()));
    }

    /**
     * 전체 작업 목록 (로그 제외)
     */
    @GetMapping
    public ResponseEntity<List<TaskStatusResponse>> getTasks() {
        List<TaskStatusResponse> tasks = bulkOrderService.getTasks().stream()
                .map(TaskStatusResponse::summaryOf)
                .toList();
        return ResponseEntity.ok(tasks);
    }

    /**
     * 결과 파일 다운로드
     */
    @Operation(summary = "결과 파일 다운로드", description = "완료된 작업의 결과 파일(JSON)을 다운로드합니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "다운로드 성공"),
            @ApiResponse(responseCode = "404", description = "작업 없음 또는 결과 파일 미생성")
    })
    @GetMapping("/{taskId}/result")
    public ResponseEntity<?> downloadResult(@PathVariable String taskId) {
        Optional<BatchTask> task = bulkOrderService.getTask(taskId);
        if (task.isEmpty()) {
            return taskNotFound(taskId);
        }

        Optional<Path> resultFile = task.get().getResultFile();
        if (resultFile.isEmpty() || !Files.exists(resultFile.get())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "결과 파일이 아직 준비되지 않았습니다. (status=" +
                            task.get().getStatus().getDisplayName() + ")", "code", "RESULT_NOT_READY"));
        }

        Path path = resultFile.get();
        Resource resource = new FileSystemResource(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(path.getFileName().toString())
                .build());

        log.info("결과 파일 다운로드: taskId={}, file={}", taskId, path);
        return ResponseEntity.ok()
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .body(resource);
    }

    private ResponseEntity<?> taskNotFound(String taskId) {
        log.warn("존재하지 않는 작업 ID: {}", taskId);
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "존재하지 않는 작업 ID 입니다: " + taskId, "code", "TASK_NOT_FOUND"));
    }
}
