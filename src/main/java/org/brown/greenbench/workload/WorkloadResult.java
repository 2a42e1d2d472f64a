package org.brown.greenbench.workload;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * 워크로드 1회 실행 결과
 */
@Value
@Builder
public class WorkloadResult {

    /**
     * 성공 여부 (프로세스라면 exitCode == 0)
     */
    boolean success;

    /**
     * 워크로드가 보고한 실행 시간. null 이면 측정 윈도우 길이를 쓴다.
     */
    Duration elapsed;

    /**
     * 실패 사유 또는 출력 꼬리
     */
    String diagnostic;

    /**
     * 유용한 작업량 (예: 통과한 테스트 수). 에너지 효율 계산에 쓴다.
     */
    Long usefulWork;

    public OptionalLong usefulWorkCount() {
        return usefulWork == null ? OptionalLong.empty() : OptionalLong.of(usefulWork);
    }

    public static WorkloadResult succeeded(Duration elapsed) {
        return WorkloadResult.builder().success(true).elapsed(elapsed).build();
    }

    public static WorkloadResult failed(Duration elapsed, String diagnostic) {
        return WorkloadResult.builder().success(false).elapsed(elapsed).diagnostic(diagnostic).build();
    }
}
