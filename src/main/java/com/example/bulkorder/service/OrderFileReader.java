package com.example.bulkorder.service;

import com.example.bulkorder.domain.OrderRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 주문 입력 파일 읽기 및 파싱 서비스
 * <p>
 * .xlsx 는 첫 번째 시트를, 그 외는 CSV 로 읽는다. 모든 셀은 문자열로 다루며
 * 비어있는 셀/누락된 컬럼은 빈 문자열이 된다.
 * CSV 는 UTF-8(BOM 허용)로 읽고, UTF-8 로 디코딩할 수 없으면 ISO-8859-1 로 다시 읽는다.
 */
@Slf4j
@Service
public class OrderFileReader {

    private static final char BOM = '\ufeff';

    /**
     * 입력 파일을 읽어서 행별 주문 레코드로 반환 (첫 번째 행은 헤더, 제외)
     *
     * @param file 입력 파일 경로 (.csv 또는 .xlsx)
     * @return 주문 레코드 목록 (파일 순서 유지)
     * @throws BatchProcessingException 파일을 읽을 수 없는 경우
     */
    public List<OrderRecord> read(Path file) {
        String fileName = file.getFileName().toString();
        log.info("주문 파일 파싱 시작: {}", file);

        List<Map<String, String>> rows;
        try {
            if (fileName.toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
                rows = readExcel(file);
            } else {
                rows = parseCsv(decode(Files.readAllBytes(file)));
            }
        } catch (IOException | RuntimeException e) {
            log.error("주문 파일 읽기 실패: {}", file, e);
            throw new BatchProcessingException("Cannot read input file " + fileName + ": " + e.getMessage(), e);
        }

        List<OrderRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(OrderRecord.fromCells(i + 1, rows.get(i)));
        }

        log.info("주문 파일 파싱 완료: 총 {}개 행 파싱됨", records.size());
        return records;
    }

    /**
     * UTF-8 로 디코딩, 실패하면 ISO-8859-1 로 디코딩 (BOM 제거)
     */
    String decode(byte[] bytes) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("UTF-8 디코딩 실패, ISO-8859-1 로 다시 읽습니다: {}", e.getMessage());
            text = new String(bytes, StandardCharsets.ISO_8859_1);
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return text;
    }

    /**
     * CSV 텍스트를 헤더명 -> 값 맵 리스트로 변환
     * 큰따옴표로 감싼 필드(쉼표, 줄바꿈, "" 이스케이프 포함)를 지원
     */
    List<Map<String, String>> parseCsv(String text) {
        List<List<String>> lines = splitCsv(text);
        List<Map<String, String>> rows = new ArrayList<>();
        if (lines.isEmpty()) {
            log.warn("CSV 파일에 데이터가 없습니다.");
            return rows;
        }

        List<String> headers = new ArrayList<>();
        for (String header : lines.get(0)) {
            headers.add(header.trim());
        }
        log.debug("헤더 컬럼명: {}", headers);

        for (int i = 1; i < lines.size(); i++) {
            List<String> values = lines.get(i);
            if (values.size() == 1 && values.get(0).isBlank()) {
                continue; // 빈 줄 건너뛰기
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int col = 0; col < headers.size(); col++) {
                String header = headers.get(col);
                if (header.isEmpty()) {
                    continue;
                }
                row.put(header, col < values.size() ? values.get(col) : "");
            }
            rows.add(row);
        }
        return rows;
    }

    private List<List<String>> splitCsv(String text) {
        List<List<String>> lines = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean lineHasContent = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
                continue;
            }

            switch (c) {
                case '"':
                    inQuotes = true;
                    lineHasContent = true;
                    break;
                case ',':
                    current.add(field.toString());
                    field.setLength(0);
                    lineHasContent = true;
                    break;
                case '\r':
                    // \r\n 은 \n 에서 처리
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                        break;
                    }
                    // fall through: 단독 \r 도 줄바꿈으로 취급
                case '\n':
                    current.add(field.toString());
                    field.setLength(0);
                    lines.add(current);
                    current = new ArrayList<>();
                    lineHasContent = false;
                    break;
                default:
                    field.append(c);
                    lineHasContent = true;
            }
        }

        if (lineHasContent || field.length() > 0) {
            current.add(field.toString());
            lines.add(current);
        }
        return lines;
    }

    /**
     * 엑셀 첫 번째 시트를 헤더명 -> 값 맵 리스트로 변환
     */
    private List<Map<String, String>> readExcel(Path file) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();

        try (InputStream inputStream = Files.newInputStream(file);
             Workbook workbook = new XSSFWorkbook(inputStream)) {

            Sheet sheet = workbook.getSheetAt(0); // 첫 번째 시트 사용
            log.info("엑셀 시트 이름: {}, 총 행 수: {}", sheet.getSheetName(), sheet.getLastRowNum() + 1);

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                log.warn("엑셀 파일에 데이터가 없습니다.");
                return rows;
            }

            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            List<String> headers = new ArrayList<>();
            for (int i = 0; i < headerRow.getLastCellNum(); i++) {
                headers.add(cellText(headerRow.getCell(i), formatter, evaluator).trim());
            }

            // 데이터 행 읽기 (헤더 다음 행부터)
            for (int rowIndex = headerRow.getRowNum() + 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                Row row = sheet.getRow(rowIndex);
                if (row == null) {
                    continue; // 빈 행 건너뛰기
                }

                List<String> values = new ArrayList<>();
                for (int col = 0; col < headers.size(); col++) {
                    values.add(cellText(row.getCell(col), formatter, evaluator));
                }
                if (isBlankRow(values)) {
                    continue;
                }

                Map<String, String> rowData = new LinkedHashMap<>();
                for (int col = 0; col < headers.size(); col++) {
                    String header = headers.get(col);
                    if (header.isEmpty()) {
                        continue; // 헤더명이 없으면 건너뛰기
                    }
                    rowData.put(header, values.get(col));
                }
                rows.add(rowData);
            }
        }
        return rows;
    }

    /**
     * 셀 값을 화면에 보이는 문자열 그대로 반환 (숫자/날짜 타입 추론 없음)
     */
    private String cellText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell, evaluator);
    }

    private boolean isBlankRow(List<String> values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
