package org.brown.greenbench.accounting;

import org.brown.greenbench.model.BaselineProfile;
import org.brown.greenbench.model.Metric;
import org.brown.greenbench.model.MetricSet;
import org.brown.greenbench.model.MetricValue;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 원시 메트릭에서 유휴 기준선을 뺀다.
 *
 * - 사용률/메모리/전력/온도: 기준선 값을 그대로 뺀다
 * - 에너지: 기준선 에너지를 반복 시간에 맞게 환산해서 뺀다 (기준선 평균 전력 × 반복 시간)
 * - 시간: 빼지 않는다
 * - 결과는 0 미만이 되지 않는다
 * - 기준선 쪽이 unavailable 이면 원시 값을 그대로 둔다
 *
 * 파생 메트릭은 여기서 다루지 않는다. 호출자가 {@link EnergyAccounting#derive} 로 다시 계산한다.
 */
public final class BaselineSubtraction {

    private BaselineSubtraction() {
    }

    public static MetricSet subtract(MetricSet raw, Duration duration, BaselineProfile baseline) {
        double seconds = duration.toNanos() / 1e9;
        double baselineSeconds = baseline.idleDuration().toNanos() / 1e9;

        MetricSet.Builder net = MetricSet.builder();
        for (Map.Entry<Metric, MetricValue> e : raw.asMap().entrySet()) {
            Metric metric = e.getKey();
            MetricValue value = e.getValue();
            if (metric.source() == Metric.Source.DERIVED || metric.source() == Metric.Source.RUN) {
                continue;
            }
            net.put(metric, subtractOne(metric, value, baseline.metrics().valueOf(metric), seconds, baselineSeconds));
        }
        return net.build();
    }

    private static MetricValue subtractOne(Metric metric,
                                           MetricValue value,
                                           OptionalDouble baselineValue,
                                           double seconds,
                                           double baselineSeconds) {
        if (!value.isAvailable() || baselineValue.isEmpty()) {
            return value;
        }
        double base = baselineValue.getAsDouble();
        return switch (metric.kind()) {
            case TIME, CARBON, EFFICIENCY -> value;
            case ENERGY -> baselineSeconds > 0
                    ? value.withValue(Math.max(0.0, value.value() - base / baselineSeconds * seconds))
                    : value;
            case UTILIZATION, MEMORY, POWER, TEMPERATURE -> value.withValue(Math.max(0.0, value.value() - base));
        };
    }
}
