package org.brown.greenbench.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 세션 생성 시 오케스트레이터에 전달되는 불변 설정
 *
 * Spring 바인딩은 {@link MeasurementProperties} 가 맡고, 여기서는 값 검증만 한다.
 */
@Value
@Builder(toBuilder = true)
public class MeasurementConfig {

    @Builder.Default
    Duration samplingInterval = Duration.ofMillis(100);

    @Builder.Default
    Duration stopTimeout = Duration.ofSeconds(2);

    @Builder.Default
    Duration baselineDuration = Duration.ofSeconds(5);

    @Builder.Default
    int repetitions = 3;

    /**
     * 반복 슬롯 1개당 최대 시도 횟수
     */
    @Builder.Default
    int retryLimit = 3;

    /**
     * gCO2e/kWh (필수)
     */
    Double gridIntensityGPerKwh;

    /**
     * null = 자동 감지, false = 비활성화
     */
    Boolean acceleratorEnabled;

    /**
     * null 이면 외부 전력계 샘플러 비활성화
     */
    String powerMeterEndpoint;

    @Builder.Default
    int powerMeterOutputId = 1;

    @Builder.Default
    int powerMeterMaxConsecutiveFailures = 3;

    @Builder.Default
    Duration defaultWorkloadTimeout = Duration.ofSeconds(600);

    /**
     * @throws IllegalArgumentException 잘못된 값
     */
    public MeasurementConfig validate() {
        requirePositive(samplingInterval, "sampling interval");
        requirePositive(stopTimeout, "stop timeout");
        requirePositive(defaultWorkloadTimeout, "default workload timeout");
        if (baselineDuration == null || baselineDuration.isNegative()) {
            throw new IllegalArgumentException("baseline duration must be >= 0: " + baselineDuration);
        }
        if (repetitions < 1) {
            throw new IllegalArgumentException("repetitions must be >= 1: " + repetitions);
        }
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retry limit must be >= 1: " + retryLimit);
        }
        if (gridIntensityGPerKwh == null) {
            throw new IllegalArgumentException("grid intensity (g/kWh) is required");
        }
        if (!Double.isFinite(gridIntensityGPerKwh) || gridIntensityGPerKwh < 0) {
            throw new IllegalArgumentException("grid intensity must be >= 0: " + gridIntensityGPerKwh);
        }
        if (powerMeterMaxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("power meter max consecutive failures must be >= 1");
        }
        return this;
    }

    public boolean isPowerMeterConfigured() {
        return powerMeterEndpoint != null && !powerMeterEndpoint.isBlank();
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }
}
