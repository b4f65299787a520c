package com.example.bulkorder.service;

import com.example.bulkorder.domain.OrderRecord;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderFileReaderTest {

    private static final String HEADER = "customer_email,customer_first_name,customer_last_name,"
            + "shipping_address1,shipping_city,shipping_state,shipping_country,shipping_zip,payment_method,"
            + "product_1_name,product_1_price,product_1_quantity";

    private final OrderFileReader reader = new OrderFileReader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("UTF-8 BOM 이 있는 CSV 를 읽고 모든 값을 문자열로 유지한다")
    void readsUtf8CsvWithBom() throws Exception {
        String csv = "\ufeff" + HEADER + "\r\n"
                + "a@example.com,Ana,Lee,1 Main St,Seoul,,Korea,00123,paid,Mug,12.50,002\r\n"
                + "b@example.com,Bo,Kim,,,,,,,,,\r\n";
        Path file = tempDir.resolve("orders.csv");
        Files.write(file, csv.getBytes(StandardCharsets.UTF_8));

        List<OrderRecord> records = reader.read(file);

        assertThat(records).hasSize(2);
        OrderRecord first = records.get(0);
        assertThat(first.getRowNumber()).isEqualTo(1);
        assertThat(first.getCustomerEmail()).isEqualTo("a@example.com");
        assertThat(first.getShippingZip()).isEqualTo("00123");
        assertThat(first.getShippingState()).isEmpty();
        assertThat(first.getProducts()).hasSize(5);
        assertThat(first.getProducts().get(0).getPrice()).isEqualTo("12.50");
        assertThat(first.getProducts().get(0).getQuantity()).isEqualTo("002");
        assertThat(first.getProducts().get(4).getName()).isEmpty();
        assertThat(records.get(1).getRowNumber()).isEqualTo(2);
        assertThat(records.get(1).getPaymentMethod()).isEmpty();
    }

    @Test
    @DisplayName("큰따옴표 필드의 쉼표, 줄바꿈, 이스케이프를 처리하고 빈 줄은 건너뛴다")
    void parsesQuotedFields() throws Exception {
        String csv = "customer_email,shipping_address1,product_1_name\n"
                + "a@example.com,\"12 Oak St, Apt 4\",\"The \"\"Big\"\" Mug\"\n"
                + "\n"
                + "b@example.com,\"Line 1\nLine 2\",Hat";
        Path file = tempDir.resolve("quoted.csv");
        Files.writeString(file, csv, StandardCharsets.UTF_8);

        List<OrderRecord> records = reader.read(file);

        assertThat(records).hasSize(2);
        assertThat(records.get(0).getShippingAddress1()).isEqualTo("12 Oak St, Apt 4");
        assertThat(records.get(0).getProducts().get(0).getName()).isEqualTo("The \"Big\" Mug");
        assertThat(records.get(1).getShippingAddress1()).isEqualTo("Line 1\nLine 2");
        assertThat(records.get(1).getProducts().get(0).getName()).isEqualTo("Hat");
        // 파일에 없는 컬럼은 빈 문자열
        assertThat(records.get(1).getCustomerFirstName()).isEmpty();
    }

    @Test
    @DisplayName("UTF-8 로 읽을 수 없으면 ISO-8859-1 로 다시 읽는다")
    void fallsBackToLatin1() throws Exception {
        String csv = "customer_first_name,shipping_city\nJosé,Montréal\n";
        Path file = tempDir.resolve("latin1.csv");
        Files.write(file, csv.getBytes(StandardCharsets.ISO_8859_1));

        List<OrderRecord> records = reader.read(file);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getCustomerFirstName()).isEqualTo("José");
        assertThat(records.get(0).getShippingCity()).isEqualTo("Montréal");
    }

    @Test
    @DisplayName("헤더만 있는 파일은 빈 목록")
    void headerOnlyFileHasNoRecords() throws Exception {
        Path file = tempDir.resolve("empty.csv");
        Files.writeString(file, HEADER + "\n");

        assertThat(reader.read(file)).isEmpty();
    }

    @Test
    @DisplayName("엑셀(.xlsx) 파일은 첫 번째 시트를 문자열로 읽는다")
    void readsExcelWorkbook() throws Exception {
        Path file = tempDir.resolve("orders.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("orders");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("customer_email");
            header.createCell(1).setCellValue("product_1_name");
            header.createCell(2).setCellValue("product_1_price");
            header.createCell(3).setCellValue("product_1_quantity");

            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("a@example.com");
            row.createCell(1).setCellValue("Mug");
            row.createCell(2).setCellValue(12.5);
            row.createCell(3).setCellValue(3);

            sheet.createRow(2); // 빈 행

            Row second = sheet.createRow(3);
            second.createCell(0).setCellValue("b@example.com");

            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            workbook.write(bytes);
            try (OutputStream out = Files.newOutputStream(file)) {
                out.write(bytes.toByteArray());
            }
        }

        List<OrderRecord> records = reader.read(file);

        assertThat(records).hasSize(2);
        assertThat(records.get(0).getProducts().get(0).getName()).isEqualTo("Mug");
        assertThat(records.get(0).getProducts().get(0).getPrice()).isEqualTo("12.5");
        assertThat(records.get(0).getProducts().get(0).getQuantity()).isEqualTo("3");
        assertThat(records.get(1).getCustomerEmail()).isEqualTo("b@example.com");
        assertThat(records.get(1).getProducts().get(0).getName()).isEmpty();
    }

    @Test
    @DisplayName("파일을 읽을 수 없으면 BatchProcessingException")
    void missingFileIsFatal() {
        Path file = tempDir.resolve("missing.csv");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(BatchProcessingException.class)
                .hasMessageContaining("missing.csv");
    }

    @Test
    @DisplayName("손상된 엑셀 파일은 BatchProcessingException")
    void corruptWorkbookIsFatal() throws Exception {
        Path file = tempDir.resolve("broken.xlsx");
        Files.writeString(file, "not a workbook");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(BatchProcessingException.class);
    }
}
