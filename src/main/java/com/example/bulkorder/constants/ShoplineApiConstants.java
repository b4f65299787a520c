package com.example.bulkorder.constants;

import java.util.List;

/**
 * Shopline Admin OpenAPI 상수 클래스
 * 주문 생성 요청과 입력 파일 컬럼에 관련된 고정값을 관리
 */
public final class ShoplineApiConstants {

    private ShoplineApiConstants() {
        // 인스턴스화 방지
    }

    // ========== API ==========

    public static final String DEFAULT_API_VERSION = "v20251201";
    public static final String ADMIN_API_PATH = "/admin/openapi/";
    public static final String ORDERS_PATH = "/orders.json";
    public static final String DEFAULT_USER_AGENT = "ShoplineWeb/1.0";

    /**
     * 주문 상태값
     */
    public static final class FulfillmentStatus {
        public static final String UNSHIPPED = "unshipped"; // 미발송

        private FulfillmentStatus() {}
    }

    /**
     * 결제 수단 (입력 파일 값, 대문자 기준)
     */
    public static final class PaymentMethod {
        public static final String COD = "COD"; // 착불
        public static final String PAID = "PAID"; // 결제 완료

        private PaymentMethod() {}
    }

    // ========== 기본값 ==========

    public static final String DEFAULT_COUNTRY = "United States";
    public static final String DEFAULT_QUANTITY = "1";

    /**
     * 비어있는 값으로 취급하는 토큰 (대소문자 무시, 공백은 trim 후 빈 문자열)
     */
    public static final List<String> EMPTY_TOKENS = List.of("", "nan", "null");

    /**
     * 주문당 상품 슬롯 수 (product_1 ~ product_5)
     */
    public static final int PRODUCT_SLOT_COUNT = 5;

    // ========== 입력 파일 컬럼 ==========

    public static final class Column {
        public static final String CUSTOMER_EMAIL = "customer_email";
        public static final String CUSTOMER_FIRST_NAME = "customer_first_name";
        public static final String CUSTOMER_LAST_NAME = "customer_last_name";
        public static final String SHIPPING_ADDRESS1 = "shipping_address1";
        public static final String SHIPPING_CITY = "shipping_city";
        public static final String SHIPPING_STATE = "shipping_state";
        public static final String SHIPPING_COUNTRY = "shipping_country";
        public static final String SHIPPING_ZIP = "shipping_zip";
        public static final String PAYMENT_METHOD = "payment_method";

        private Column() {}

        public static String productName(int slot) {
            return "product_" + slot + "_name";
        }

        public static String productPrice(int slot) {
            return "product_" + slot + "_price";
        }

        public static String productQuantity(int slot) {
            return "product_" + slot + "_quantity";
        }
    }

    // ========== 결과 파일 ==========

    public static final String RESULT_FILE_PREFIX = "results_";
    public static final String RESULT_FILE_EXTENSION = ".json";
}
