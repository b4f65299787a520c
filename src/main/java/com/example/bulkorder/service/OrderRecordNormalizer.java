package com.example.bulkorder.service;

import com.example.bulkorder.constants.ShoplineApiConstants;
import com.example.bulkorder.domain.FinancialStatus;
import com.example.bulkorder.domain.OrderRecord;
import com.example.bulkorder.dto.OrderPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 입력 파일 한 행(OrderRecord)을 주문 생성 요청(OrderPayload)으로 변환하는 컨버터
 * <p>
 * 값이 비어있거나 "nan"/"null" 이면 기본값으로 대체한다.
 * 수량만은 기본값으로 대체하지 않고 {@link InvalidQuantityException} 을 던진다.
 */
@Slf4j
@Component
public class OrderRecordNormalizer {

    /**
     * 주문 레코드를 주문 생성 요청으로 변환
     *
     * @param record 입력 파일 한 행
     * @return 주문 생성 요청 (상품이 하나도 없어도 생성됨)
     * @throws InvalidQuantityException 상품 수량이 양의 정수가 아닌 경우
     */
    public OrderPayload normalize(OrderRecord record) {
        OrderPayload.Customer customer = OrderPayload.Customer.builder()
                .email(clean(record.getCustomerEmail()))
                .firstName(clean(record.getCustomerFirstName()))
                .lastName(clean(record.getCustomerLastName()))
                .build();

        // 국가만 기본값이 있고 나머지 주소 필드는 빈 문자열
        OrderPayload.ShippingAddress shippingAddress = OrderPayload.ShippingAddress.builder()
                .address1(clean(record.getShippingAddress1()))
                .city(clean(record.getShippingCity()))
                .province(clean(record.getShippingState()))
                .country(clean(record.getShippingCountry(), ShoplineApiConstants.DEFAULT_COUNTRY))
                .zip(clean(record.getShippingZip()))
                .build();

        List<OrderPayload.LineItem> lineItems = new ArrayList<>();
        for (OrderRecord.ProductSlot product : record.getProducts()) {
            String name = clean(product.getName());
            String price = clean(product.getPrice());
            if (name.isEmpty() || price.isEmpty()) {
                continue;
            }
            String quantity = clean(product.getQuantity(), ShoplineApiConstants.DEFAULT_QUANTITY);
            lineItems.add(OrderPayload.LineItem.builder()
                    .title(name)
                    .price(price)
                    .quantity(parseQuantity(product.getSlot(), quantity))
                    .build());
        }

        if (lineItems.isEmpty()) {
            log.debug("행 {}: 유효한 상품이 없습니다. (상품명과 가격이 모두 있는 슬롯 없음)", record.getRowNumber());
        }

        return OrderPayload.builder()
                .customer(customer)
                .shippingAddress(shippingAddress)
                .lineItems(lineItems)
                .financialStatus(FinancialStatus.fromPaymentMethod(clean(record.getPaymentMethod())))
                .build();
    }

    /**
     * 값 정리: trim 후 빈 값/"nan"/"null" 이면 빈 문자열
     */
    static String clean(String value) {
        return clean(value, "");
    }

    /**
     * 값 정리: trim 후 빈 값/"nan"/"null" 이면 기본값
     */
    static String clean(String value, String defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if (ShoplineApiConstants.EMPTY_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return defaultValue;
        }
        return trimmed;
    }

    private int parseQuantity(int slot, String quantity) {
        try {
            int parsed = Integer.parseInt(quantity);
            if (parsed <= 0) {
                throw new InvalidQuantityException(slot, quantity);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new InvalidQuantityException(slot, quantity);
        }
    }
}
