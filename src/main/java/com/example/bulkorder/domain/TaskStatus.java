package com.example.bulkorder.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 일괄 주문 작업 상태
 */
public enum TaskStatus {

    PROCESSING("Processing"),
    COMPLETED("Completed"),
    FAILED("Failed");

    private final String displayName;

    TaskStatus(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public boolean isFinished() {
        return this != PROCESSING;
    }
}
