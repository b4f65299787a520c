package com.example.bulkorder.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 결과 파일(results_*.json) 내용
 * 입력 행마다 한 줄씩, 입력 순서 그대로 기록된다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {

    private List<String> logs = new ArrayList<>();
}
