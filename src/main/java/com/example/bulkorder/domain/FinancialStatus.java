package com.example.bulkorder.domain;

import com.example.bulkorder.constants.ShoplineApiConstants;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * 주문 결제 상태 (financial_status)
 */
public enum FinancialStatus {

    UNPAID("unpaid"),
    PAID("paid");

    // 결제 수단 -> 결제 상태
    private static final Map<String, FinancialStatus> PAYMENT_METHOD_MAPPING = Map.of(
            ShoplineApiConstants.PaymentMethod.COD, UNPAID,
            ShoplineApiConstants.PaymentMethod.PAID, PAID
    );

    private final String value;

    FinancialStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 입력 파일의 결제 수단을 결제 상태로 변환
     * COD -> unpaid, PAID -> paid, 그 외(빈 값 포함)는 모두 unpaid
     *
     * @param paymentMethod 결제 수단 (대소문자 무시)
     * @return 결제 상태
     */
    public static FinancialStatus fromPaymentMethod(String paymentMethod) {
        if (paymentMethod == null) {
            return UNPAID;
        }
        String normalized = paymentMethod.trim().toUpperCase(Locale.ROOT);
        return PAYMENT_METHOD_MAPPING.getOrDefault(normalized, UNPAID);
    }
}
