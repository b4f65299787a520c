package com.example.bulkorder.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 주문 한 건(입력 파일 한 행)의 처리 결과
 * 작업 로그에는 message 한 줄만 기록된다.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmissionOutcome {

    private final boolean success;
    private final String message;

    public static SubmissionOutcome success(String message) {
        return new SubmissionOutcome(true, message);
    }

    public static SubmissionOutcome failure(String message) {
        return new SubmissionOutcome(false, message);
    }
}
