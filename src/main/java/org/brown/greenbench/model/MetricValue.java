package org.brown.greenbench.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 단일 메트릭 값
 *
 * UNAVAILABLE 이면 value 는 null 이다. 숫자 0이 "값 없음"을 대신하지 않는다.
 *
 * @param value  측정값 (UNAVAILABLE 이면 null)
 * @param status 가용 상태
 * @param note   PARTIAL/UNAVAILABLE 사유 (선택)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricValue(@JsonInclude(JsonInclude.Include.ALWAYS) Double value,
                          MetricStatus status,
                          String note) {

    public MetricValue {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (status == MetricStatus.UNAVAILABLE) {
            value = null;
        } else if (value == null || value.isNaN() || value.isInfinite()) {
            throw new IllegalArgumentException("available metric needs a finite value: " + value);
        }
    }

    public static MetricValue of(double value) {
        return new MetricValue(value, MetricStatus.OK, null);
    }

    public static MetricValue partial(double value, String note) {
        return new MetricValue(value, MetricStatus.PARTIAL, note);
    }

    public static MetricValue unavailable(String note) {
        return new MetricValue(null, MetricStatus.UNAVAILABLE, note);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status != MetricStatus.UNAVAILABLE;
    }

    /**
     * 같은 상태를 유지한 채 값만 바꾼다.
     */
    public MetricValue withValue(double newValue) {
        if (!isAvailable()) {
            return this;
        }
        return new MetricValue(newValue, status, note);
    }
}
