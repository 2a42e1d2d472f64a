package org.brown.greenbench.model;

/**
 * 메트릭 값의 가용 상태
 */
public enum MetricStatus {
    OK,
    /** 일부 출처가 빠진 채로 계산된 값 */
    PARTIAL,
    /** 센서 부재/장애로 값이 없음 (0으로 대체하지 않는다) */
    UNAVAILABLE
}
