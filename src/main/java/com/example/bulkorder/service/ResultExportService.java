package com.example.bulkorder.service;

import com.example.bulkorder.config.ShoplineProperties;
import com.example.bulkorder.constants.ShoplineApiConstants;
import com.example.bulkorder.dto.BatchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 결과 파일 내보내기 서비스
 * 작업 로그를 {"logs": [...]} 형태의 JSON 파일로 저장
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultExportService {

    private static final DateTimeFormatter FILE_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ShoplineProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * 로그를 결과 파일로 저장
     * 파일명: results_yyyyMMdd_HHmmss.json (같은 초에 이미 있으면 _1, _2 ... 를 붙임)
     *
     * @param logs 행별 처리 결과 (입력 순서)
     * @return 저장된 파일 경로 (절대 경로)
     * @throws BatchProcessingException 파일 저장 실패
     */
    public Path export(List<String> logs) {
        try {
            // 설정된 디렉토리 생성 (절대 경로 또는 상대 경로)
            Path resultDirPath = Paths.get(properties.getBatch().getResultDir()).toAbsolutePath();
            Files.createDirectories(resultDirPath);

            String baseName = ShoplineApiConstants.RESULT_FILE_PREFIX + LocalDateTime.now().format(FILE_DATE_FORMATTER);
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new BatchResult(List.copyOf(logs)));

            for (int suffix = 0; ; suffix++) {
                String fileName = suffix == 0
                        ? baseName + ShoplineApiConstants.RESULT_FILE_EXTENSION
                        : baseName + "_" + suffix + ShoplineApiConstants.RESULT_FILE_EXTENSION;
                Path filePath = resultDirPath.resolve(fileName);
                try (OutputStream out = Files.newOutputStream(filePath, StandardOpenOption.CREATE_NEW)) {
                    out.write(content);
                } catch (FileAlreadyExistsException e) {
                    continue; // 같은 초에 생성된 결과 파일이 있음
                }
                log.info("결과 파일 저장 완료: {} ({}개 행)", filePath, logs.size());
                return filePath;
            }
        } catch (IOException e) {
            log.error("결과 파일 저장 실패", e);
            throw new BatchProcessingException("Cannot write result file: " + e.getMessage(), e);
        }
    }

    /**
     * 결과 파일 읽기
     */
    public BatchResult read(Path resultFile) throws IOException {
        return objectMapper.readValue(resultFile.toFile(), BatchResult.class);
    }
}
