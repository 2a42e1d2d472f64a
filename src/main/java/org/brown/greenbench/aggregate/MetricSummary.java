package org.brown.greenbench.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.brown.greenbench.model.MetricStatus;

import java.util.List;

/**
 * 반복들에 걸친 메트릭 1개의 통계
 *
 * @param mean   평균 (UNAVAILABLE 이면 null)
 * @param std    표본 표준편차, 값이 1개면 0
 * @param count  통계에 들어간 반복 수
 * @param status 일부 반복에서만 값이 있으면 PARTIAL
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricSummary(@JsonInclude(JsonInclude.Include.ALWAYS) Double mean,
                            Double std,
                            Double min,
                            Double max,
                            int count,
                            MetricStatus status,
                            String note) {

    public static MetricSummary unavailable(String note) {
        return new MetricSummary(null, null, null, null, 0, MetricStatus.UNAVAILABLE, note);
    }

    public static MetricSummary of(List<Double> values, MetricStatus status, String note) {
        if (values.isEmpty()) {
            return unavailable(note);
        }
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.size();
        double std = 0.0;
        if (values.size() > 1) {
            double sq = 0;
            for (double v : values) {
                sq += (v - mean) * (v - mean);
            }
            std = Math.sqrt(sq / (values.size() - 1));
        }
        return new MetricSummary(mean, std, min, max, values.size(), status, note);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status != MetricStatus.UNAVAILABLE;
    }
}
