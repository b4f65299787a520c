package com.example.bulkorder.dto;

import com.example.bulkorder.constants.ShoplineApiConstants;
import com.example.bulkorder.domain.FinancialStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 주문 생성 요청 DTO (Shopline Admin OpenAPI orders.json 의 order 객체)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderPayload {

    private Customer customer;

    @JsonProperty("shipping_address")
    private ShippingAddress shippingAddress;

    /**
     * 주문 상품 목록 (상품 슬롯 1~5 순서 유지, 비어있을 수 있음)
     */
    @Builder.Default
    @JsonProperty("line_items")
    private List<LineItem> lineItems = new ArrayList<>();

    @JsonProperty("financial_status")
    private FinancialStatus financialStatus;

    @Builder.Default
    @JsonProperty("fulfillment_status")
    private String fulfillmentStatus = ShoplineApiConstants.FulfillmentStatus.UNSHIPPED;

    @Builder.Default
    @JsonProperty("send_receipt")
    private boolean sendReceipt = true;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Customer {
        private String email;

        @JsonProperty("first_name")
        private String firstName;

        @JsonProperty("last_name")
        private String lastName;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ShippingAddress {
        private String address1;
        private String city;

        /**
         * 주/도 (입력 파일의 shipping_state)
         */
        private String province;
        private String country;
        private String zip;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class LineItem {
        private String title;

        /**
         * 가격 (입력값 그대로의 10진수 문자열)
         */
        private String price;

        private int quantity;

        @Builder.Default
        @JsonProperty("requires_shipping")
        private boolean requiresShipping = true;

        @Builder.Default
        private boolean taxable = true;
    }
}
