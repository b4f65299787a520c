package com.example.bulkorder.service;

import com.example.bulkorder.client.ShoplineOrderClient;
import com.example.bulkorder.client.ShoplineOrderClientFactory;
import com.example.bulkorder.config.AsyncConfig;
import com.example.bulkorder.config.ShoplineProperties;
import com.example.bulkorder.domain.BatchTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * 주문 일괄 등록 서비스
 * 업로드된 파일을 저장하고 작업을 생성한 뒤 백그라운드에서 실행한다.
 * 호출자는 작업 ID 를 즉시 돌려받고 상태는 조회(polling)로 확인한다.
 */
@Slf4j
@Service
public class BulkOrderService {

    private static final List<String> SUPPORTED_EXTENSIONS = List.of(".csv", ".xlsx");

    private final TaskRegistry taskRegistry;
    private final BatchOrderRunner batchOrderRunner;
    private final ShoplineOrderClientFactory clientFactory;
    private final ShoplineProperties properties;
    private final TaskExecutor taskExecutor;

    public BulkOrderService(TaskRegistry taskRegistry,
                            BatchOrderRunner batchOrderRunner,
                            ShoplineOrderClientFactory clientFactory,
                            ShoplineProperties properties,
                            @Qualifier(AsyncConfig.BATCH_TASK_EXECUTOR) TaskExecutor taskExecutor) {
        this.taskRegistry = taskRegistry;
        this.batchOrderRunner = batchOrderRunner;
        this.clientFactory = clientFactory;
        this.properties = properties;
        this.taskExecutor = taskExecutor;
    }

    /**
     * 주문 파일을 업로드하여 일괄 등록 작업을 시작
     *
     * @param accessToken Admin API Access Token
     * @param storeDomain 스토어 도메인
     * @param file 주문 파일 (.csv 또는 .xlsx)
     * @return 생성된 작업 (상태: Processing)
     * @throws IllegalArgumentException 입력값 검증 실패
     * @throws IOException 업로드 파일 저장 실패
     */
    public BatchTask startBatch(String accessToken, String storeDomain, MultipartFile file) throws IOException {
        validateRequest(accessToken, storeDomain, file);

        Path storedFile = storeUpload(file);
        BatchTask task = taskRegistry.create(file.getOriginalFilename());
        ShoplineOrderClient client = clientFactory.create(accessToken.trim(), storeDomain);

        taskExecutor.execute(() -> execute(task, storedFile, client));
        log.info("일괄 주문 작업 시작: taskId={}, file={}", task.getId(), storedFile);
        return task;
    }

    /**
     * 작업 실행 (백그라운드 스레드)
     * 어떤 경우에도 작업은 Completed 또는 Failed 로 끝난다.
     */
    void execute(BatchTask task, Path inputFile, ShoplineOrderClient client) {
        try {
            Path resultFile = batchOrderRunner.run(task, inputFile, client);
            task.complete(resultFile);
            log.info("작업 완료: taskId={}, resultFile={}", task.getId(), resultFile);
        } catch (BatchProcessingException e) {
            log.error("작업 실패: taskId={}, error={}", task.getId(), e.getMessage());
            task.fail(e.getMessage());
        } catch (Exception e) {
            log.error("작업 실행 중 오류 발생: taskId={}", task.getId(), e);
            task.fail("Unexpected error: " + e.getMessage());
        } finally {
            // Error 계열(OutOfMemoryError 등)로 빠져나가도 Processing 으로 남지 않게 한다
            if (!task.getStatus().isFinished()) {
                task.fail("Task aborted unexpectedly");
            }
        }
    }

    public Optional<BatchTask> getTask(String taskId) {
        return taskRegistry.get(taskId);
    }

    public List<BatchTask> getTasks() {
        return taskRegistry.findAll();
    }

    /**
     * 요청 검증
     */
    private void validateRequest(String accessToken, String storeDomain, MultipartFile file) {
        if (!StringUtils.hasText(accessToken)) {
            throw new IllegalArgumentException("Access Token 은 필수입니다.");
        }
        if (!StringUtils.hasText(ShoplineOrderClient.normalizeDomain(storeDomain))) {
            throw new IllegalArgumentException("스토어 도메인은 필수입니다.");
        }
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("주문 파일이 비어있습니다.");
        }

        String fileName = file.getOriginalFilename();
        if (fileName == null || SUPPORTED_EXTENSIONS.stream().noneMatch(fileName.toLowerCase(Locale.ROOT)::endsWith)) {
            throw new IllegalArgumentException("주문 파일 형식이 올바르지 않습니다. (.csv 또는 .xlsx 파일만 지원)");
        }
    }

    /**
     * 업로드 파일을 업로드 디렉토리에 고유한 이름으로 저장
     */
    private Path storeUpload(MultipartFile file) throws IOException {
        Path uploadDir = Paths.get(properties.getBatch().getUploadDir()).toAbsolutePath();
        Files.createDirectories(uploadDir);

        String originalName = StringUtils.getFilename(StringUtils.cleanPath(file.getOriginalFilename()));
        Path target = uploadDir.resolve(UUID.randomUUID() + "_" + originalName);
        file.transferTo(target);
        log.info("업로드 파일 저장: {} ({} bytes)", target, file.getSize());
        return target;
    }
}
