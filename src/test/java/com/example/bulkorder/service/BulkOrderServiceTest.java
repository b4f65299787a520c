package com.example.bulkorder.service;

import com.example.bulkorder.client.ShoplineOrderClient;
import com.example.bulkorder.client.ShoplineOrderClientFactory;
import com.example.bulkorder.config.ShoplineProperties;
import com.example.bulkorder.domain.BatchTask;
import com.example.bulkorder.domain.TaskStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkOrderServiceTest {

    @Mock
    private BatchOrderRunner batchOrderRunner;

    @Mock
    private ShoplineOrderClientFactory clientFactory;

    @TempDir
    Path tempDir;

    private TaskRegistry taskRegistry;
    private ShoplineProperties properties;

    @BeforeEach
    void setUp() {
        taskRegistry = new TaskRegistry();
        properties = new ShoplineProperties();
        properties.getBatch().setUploadDir(tempDir.resolve("uploads").toString());
        properties.getBatch().setResultDir(tempDir.resolve("results").toString());
        properties.getBatch().setPacingInterval(Duration.ZERO);
    }

    private BulkOrderService service(TaskExecutor executor) {
        return new BulkOrderService(taskRegistry, batchOrderRunner, clientFactory, properties, executor);
    }

    private static MockMultipartFile csv(String name, String content) {
        return new MockMultipartFile("file", name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("업로드 파일을 저장하고 작업을 실행해 Completed 로 끝낸다")
    void startBatchRunsTaskToCompletion() throws Exception {
        ShoplineOrderClient client = mock(ShoplineOrderClient.class);
        when(clientFactory.create("token", "https://demo.myshopline.com")).thenReturn(client);
        Path resultFile = tempDir.resolve("results_20260101_000000.json");
        when(batchOrderRunner.run(any(BatchTask.class), any(Path.class), eq(client))).thenReturn(resultFile);

        BatchTask task = service(new SyncTaskExecutor())
                .startBatch(" token ", "https://demo.myshopline.com", csv("orders.csv", "customer_email\na@b.c\n"));

        assertThat(task.getId()).isEqualTo("1");
        assertThat(task.getFileName()).isEqualTo("orders.csv");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getResultFile()).contains(resultFile);
        assertThat(task.getCompletedAt()).isNotNull();

        ArgumentCaptor<Path> stored = ArgumentCaptor.forClass(Path.class);
        verify(batchOrderRunner).run(eq(task), stored.capture(), eq(client));
        assertThat(stored.getValue().getParent()).isEqualTo(tempDir.resolve("uploads").toAbsolutePath());
        assertThat(stored.getValue().getFileName().toString()).endsWith("_orders.csv");
        assertThat(Files.readString(stored.getValue())).isEqualTo("customer_email\na@b.c\n");
    }

    @Test
    @DisplayName("작업 ID 를 먼저 돌려주고 실행은 백그라운드에서 한다")
    void startBatchReturnsBeforeExecution() throws Exception {
        List<Runnable> queued = new ArrayList<>();
        when(clientFactory.create(any(), any())).thenReturn(mock(ShoplineOrderClient.class));

        BatchTask task = service(queued::add)
                .startBatch("token", "demo.myshopline.com", csv("orders.csv", "customer_email\n"));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(queued).hasSize(1);
        verifyNoInteractions(batchOrderRunner);
    }

    @Test
    @DisplayName("입력 파일을 읽을 수 없으면 작업은 Failed 로 끝난다")
    void fatalReadErrorMarksTaskFailed() {
        BatchOrderRunner realRunner = new BatchOrderRunner(new OrderFileReader(), new OrderRecordNormalizer(),
                new ResultExportService(properties, new ObjectMapper()), properties);
        BulkOrderService bulkOrderService = new BulkOrderService(taskRegistry, realRunner, clientFactory,
                properties, new SyncTaskExecutor());
        BatchTask task = taskRegistry.create("gone.csv");

        bulkOrderService.execute(task, tempDir.resolve("gone.csv"), mock(ShoplineOrderClient.class));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getError()).contains("gone.csv");
        assertThat(task.getResultFile()).isEmpty();
        assertThat(bulkOrderService.getTask(task.getId())).containsSame(task);
    }

    @Test
    @DisplayName("예상하지 못한 예외도 작업을 Failed 로 만든다")
    void unexpectedErrorMarksTaskFailed() {
        when(batchOrderRunner.run(any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        BatchTask task = taskRegistry.create("orders.csv");

        service(new SyncTaskExecutor()).execute(task, tempDir.resolve("orders.csv"), mock(ShoplineOrderClient.class));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getError()).contains("boom");
    }

    @Test
    @DisplayName("Error 로 빠져나가도 작업은 Processing 으로 남지 않는다")
    void errorEscapingRunnerStillMarksTaskFailed() {
        when(batchOrderRunner.run(any(), any(), any()))
                .thenThrow(new NoClassDefFoundError("org/apache/poi/xssf/usermodel/XSSFWorkbook"));
        BatchTask task = taskRegistry.create("orders.xlsx");
        BulkOrderService bulkOrderService = service(new SyncTaskExecutor());

        assertThatThrownBy(() -> bulkOrderService.execute(task, tempDir.resolve("orders.xlsx"),
                mock(ShoplineOrderClient.class)))
                .isInstanceOf(NoClassDefFoundError.class);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getError()).isNotBlank();
        assertThat(task.getCompletedAt()).isNotNull();
    }

    @Test
    @DisplayName("필수값이 없거나 파일 형식이 다르면 IllegalArgumentException")
    void validatesRequest() {
        BulkOrderService bulkOrderService = service(new SyncTaskExecutor());
        MockMultipartFile file = csv("orders.csv", "customer_email\n");

        assertThatThrownBy(() -> bulkOrderService.startBatch(" ", "demo.myshopline.com", file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Access Token");
        assertThatThrownBy(() -> bulkOrderService.startBatch("token", "https://", file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("스토어 도메인");
        assertThatThrownBy(() -> bulkOrderService.startBatch("token", "demo.myshopline.com", csv("orders.csv", "")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("비어있습니다");
        assertThatThrownBy(() -> bulkOrderService.startBatch("token", "demo.myshopline.com", csv("orders.txt", "x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("형식");

        assertThat(taskRegistry.findAll()).isEmpty();
        verifyNoInteractions(clientFactory, batchOrderRunner);
    }
}
