package com.example.bulkorder.service;

import com.example.bulkorder.config.ShoplineProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultExportServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ResultExportService service;

    @BeforeEach
    void setUp() {
        ShoplineProperties properties = new ShoplineProperties();
        properties.getBatch().setResultDir(tempDir.resolve("out").toString());
        service = new ResultExportService(properties, objectMapper);
    }

    @Test
    @DisplayName("결과 파일은 logs 배열 하나만 가진 JSON 이다")
    void writesLogsDocument() throws Exception {
        List<String> logs = List.of("Order #1001 created", "Row 2: invalid quantity 'abc' for product_1", "Error 422: {}");

        Path file = service.export(logs);

        assertThat(file.getFileName().toString()).startsWith("results_").endsWith(".json");
        assertThat(file.getParent()).isEqualTo(tempDir.resolve("out").toAbsolutePath());
        JsonNode json = objectMapper.readTree(file.toFile());
        assertThat(json.size()).isEqualTo(1);
        assertThat(json.path("logs").isArray()).isTrue();
        assertThat(service.read(file).getLogs()).containsExactlyElementsOf(logs);
    }

    @Test
    @DisplayName("같은 시각에 저장해도 파일명이 겹치지 않는다")
    void generatesUniqueFileNames() {
        Path first = service.export(List.of("a"));
        Path second = service.export(List.of("b"));
        Path third = service.export(List.of("c"));

        assertThat(List.of(first, second, third)).doesNotHaveDuplicates();
    }
}
