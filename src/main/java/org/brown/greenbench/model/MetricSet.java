package org.brown.greenbench.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * 메트릭 이름 → 값 매핑 (불변)
 *
 * 각 센서는 서로 겹치지 않는 메트릭 영역을 소유하므로
 * {@link #merge(MetricSet)} 시 키 충돌은 오류로 취급한다.
 */
public final class MetricSet {

    private static final MetricSet EMPTY = new MetricSet(new EnumMap<>(Metric.class));

    private final Map<Metric, MetricValue> values;

    private MetricSet(EnumMap<Metric, MetricValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static MetricSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 주어진 메트릭들을 모두 UNAVAILABLE 로 채운 세트
     */
    public static MetricSet unavailable(Collection<Metric> metrics, String note) {
        Builder builder = builder();
        metrics.forEach(m -> builder.unavailable(m, note));
        return builder.build();
    }

    public Optional<MetricValue> get(Metric metric) {
        return Optional.ofNullable(values.get(metric));
    }

    /**
     * 값이 있고 UNAVAILABLE 이 아닐 때만 숫자를 돌려준다.
     */
    public OptionalDouble valueOf(Metric metric) {
        MetricValue v = values.get(metric);
        if (v == null || !v.isAvailable()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(v.value());
    }

    public boolean isAvailable(Metric metric) {
        return valueOf(metric).isPresent();
    }

    public boolean contains(Metric metric) {
        return values.containsKey(metric);
    }

    public Set<Metric> metrics() {
        return values.keySet();
    }

    public Map<Metric, MetricValue> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean hasUnavailable() {
        return values.values().stream().anyMatch(v -> !v.isAvailable());
    }

    /**
     * 두 세트를 합친다.
     *
     * @throws IllegalStateException 같은 메트릭이 양쪽에 있는 경우
     */
    public MetricSet merge(MetricSet other) {
        EnumMap<Metric, MetricValue> merged = copy();
        for (Map.Entry<Metric, MetricValue> e : other.values.entrySet()) {
            if (merged.putIfAbsent(e.getKey(), e.getValue()) != null) {
                throw new IllegalStateException("Metric collision on merge: " + e.getKey().key());
            }
        }
        return new MetricSet(merged);
    }

    /**
     * 지정한 메트릭을 덮어쓴 새 세트
     */
    public MetricSet with(Metric metric, MetricValue value) {
        EnumMap<Metric, MetricValue> copy = copy();
        copy.put(metric, value);
        return new MetricSet(copy);
    }

    public MetricSet without(Collection<Metric> metrics) {
        EnumMap<Metric, MetricValue> copy = copy();
        metrics.forEach(copy::remove);
        return new MetricSet(copy);
    }

    @JsonValue
    public Map<String, MetricValue> toJson() {
        Map<String, MetricValue> json = new LinkedHashMap<>();
        values.forEach((k, v) -> json.put(k.key(), v));
        return json;
    }

    private EnumMap<Metric, MetricValue> copy() {
        EnumMap<Metric, MetricValue> copy = new EnumMap<>(Metric.class);
        copy.putAll(values);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricSet other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MetricSet" + toJson();
    }

    public static final class Builder {

        private final EnumMap<Metric, MetricValue> values = new EnumMap<>(Metric.class);

        private Builder() {
        }

        public Builder put(Metric metric, MetricValue value) {
            values.put(metric, value);
            return this;
        }

        public Builder put(Metric metric, double value) {
            return put(metric, MetricValue.of(value));
        }

        public Builder unavailable(Metric metric, String note) {
            return put(metric, MetricValue.unavailable(note));
        }

        public Builder putAll(MetricSet other) {
            values.putAll(other.values);
            return this;
        }

        public MetricSet build() {
            return new MetricSet(new EnumMap<>(values));
        }
    }
}
