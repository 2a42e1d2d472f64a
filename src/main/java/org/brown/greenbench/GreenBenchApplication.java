package org.brown.greenbench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GreenBench - 에너지/자원 측정 에이전트
 *
 * 주요 기능:
 * - 시스템/가속기/외부 전력계 센서 동시 샘플링
 * - 유휴 기준선 차감
 * - 반복 측정과 재시도, 통계 집계
 * - 결과를 JSON 파일 / Redis 로 전달
 */
@SpringBootApplication
public class GreenBenchApplication {

    public static void main(String[] args) {
        SpringApplication.run(GreenBenchApplication.class, args);
    }

}
