package com.example.bulkorder.domain;

import com.example.bulkorder.constants.ShoplineApiConstants;
import com.example.bulkorder.constants.ShoplineApiConstants.Column;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * 입력 파일 한 행의 원본 데이터
 * 모든 값은 문자열이며 누락된 컬럼/셀은 빈 문자열로 채워진다. (null 없음)
 */
@Getter
@Builder
@ToString
public class OrderRecord {

    /**
     * 데이터 행 번호 (헤더 제외, 1부터 시작)
     */
    private final int rowNumber;

    @Builder.Default
    private final String customerEmail = "";
    @Builder.Default
    private final String customerFirstName = "";
    @Builder.Default
    private final String customerLastName = "";

    @Builder.Default
    private final String shippingAddress1 = "";
    @Builder.Default
    private final String shippingCity = "";
    @Builder.Default
    private final String shippingState = "";
    @Builder.Default
    private final String shippingCountry = "";
    @Builder.Default
    private final String shippingZip = "";

    @Builder.Default
    private final String paymentMethod = "";

    /**
     * 상품 슬롯 1~5 (순서 유지)
     */
    @Singular
    private final List<ProductSlot> products;

    /**
     * 상품 슬롯 하나 (product_N_name / product_N_price / product_N_quantity)
     */
    @Getter
    @Builder
    @ToString
    public static class ProductSlot {
        private final int slot;
        @Builder.Default
        private final String name = "";
        @Builder.Default
        private final String price = "";
        @Builder.Default
        private final String quantity = "";
    }

    /**
     * 헤더명 -> 셀 값 맵에서 고정 컬럼만 골라 레코드를 생성
     * 맵에 없는 컬럼이나 null 값은 빈 문자열이 된다.
     *
     * @param rowNumber 데이터 행 번호
     * @param cells 헤더명 -> 셀 값
     * @return 주문 레코드
     */
    public static OrderRecord fromCells(int rowNumber, Map<String, String> cells) {
        OrderRecordBuilder builder = OrderRecord.builder()
                .rowNumber(rowNumber)
                .customerEmail(cell(cells, Column.CUSTOMER_EMAIL))
                .customerFirstName(cell(cells, Column.CUSTOMER_FIRST_NAME))
                .customerLastName(cell(cells, Column.CUSTOMER_LAST_NAME))
                .shippingAddress1(cell(cells, Column.SHIPPING_ADDRESS1))
                .shippingCity(cell(cells, Column.SHIPPING_CITY))
                .shippingState(cell(cells, Column.SHIPPING_STATE))
                .shippingCountry(cell(cells, Column.SHIPPING_COUNTRY))
                .shippingZip(cell(cells, Column.SHIPPING_ZIP))
                .paymentMethod(cell(cells, Column.PAYMENT_METHOD));

        for (int slot = 1; slot <= ShoplineApiConstants.PRODUCT_SLOT_COUNT; slot++) {
            builder.product(ProductSlot.builder()
                    .slot(slot)
                    .name(cell(cells, Column.productName(slot)))
                    .price(cell(cells, Column.productPrice(slot)))
                    .quantity(cell(cells, Column.productQuantity(slot)))
                    .build());
        }
        return builder.build();
    }

    private static String cell(Map<String, String> cells, String column) {
        String value = cells.get(column);
        return value != null ? value : "";
    }
}
