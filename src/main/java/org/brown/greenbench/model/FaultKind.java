package org.brown.greenbench.model;

/**
 * 측정 중 발생할 수 있는 장애 분류
 *
 * 센서 계열 장애는 메트릭 가용성 플래그로만 반영되고,
 * 반복 제어 흐름을 바꾸는 것은 WORKLOAD_FAILURE, CLOCK_ANOMALY 뿐이다.
 */
public enum FaultKind {
    /** 센서가 처음부터 없음 - 세션 동안 해당 메트릭 unavailable */
    SENSOR_UNAVAILABLE,
    /** 실행 중 샘플링 장애 - 해당 반복에서만 unavailable */
    SENSOR_DEGRADED,
    /** 워크로드 실패/타임아웃 - 재시도 */
    WORKLOAD_FAILURE,
    /** 경과 시간 <= 0 - 반복 PARTIAL, 에너지/전력만 제거 */
    CLOCK_ANOMALY,
    /** 카운터 감소 - 에너지 unavailable, 반복 PARTIAL */
    COUNTER_WRAP,
    /** 사용 가능한 센서가 하나도 없음 - 세션 실패 */
    SESSION_UNMEASURABLE
}
