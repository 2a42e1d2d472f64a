package org.brown.greenbench.model;

/**
 * 센서가 기록하는 원시 샘플의 종류
 */
public enum MetricKind {
    CPU_UTILIZATION,
    RAM_USED_MB,
    /** RAPL 누적 카운터 (J) */
    CPU_ENERGY_COUNTER_J,
    ACCELERATOR_UTILIZATION,
    ACCELERATOR_MEMORY_MB,
    ACCELERATOR_MEMORY_PERCENT,
    ACCELERATOR_TEMPERATURE_C,
    ACCELERATOR_POWER_W,
    SYSTEM_POWER_W,
    /** 외부 전력계 누적 카운터 (J) */
    SYSTEM_ENERGY_COUNTER_J
}
