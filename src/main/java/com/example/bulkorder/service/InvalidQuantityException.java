package com.example.bulkorder.service;

import lombok.Getter;

/**
 * 상품 수량이 양의 정수가 아닐 때 발생하는 행 단위 검증 에러
 */
@Getter
public class InvalidQuantityException extends IllegalArgumentException {

    private final int slot;
    private final String quantity;

    public InvalidQuantityException(int slot, String quantity) {
        super(String.format("invalid quantity '%s' for product_%d", quantity, slot));
        this.slot = slot;
        this.quantity = quantity;
    }
}
