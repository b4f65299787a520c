package com.example.bulkorder.service;

/**
 * 작업 전체를 중단시키는 에러 (입력 파일 읽기 실패, 결과 파일 저장 실패, 인터럽트)
 * 행 단위 에러는 이 예외로 올라오지 않고 로그 한 줄로 기록된다.
 */
public class BatchProcessingException extends RuntimeException {

    public BatchProcessingException(String message) {
        super(message);
    }

    public BatchProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
