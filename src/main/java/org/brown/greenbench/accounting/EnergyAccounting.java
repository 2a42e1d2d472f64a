package org.brown.greenbench.accounting;

import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.model.FaultKind;
import org.brown.greenbench.model.Metric;
import org.brown.greenbench.model.MetricKind;
import org.brown.greenbench.model.MetricSet;
import org.brown.greenbench.model.MetricStatus;
import org.brown.greenbench.model.MetricValue;
import org.brown.greenbench.model.Sample;
import org.brown.greenbench.sensor.SampleBuffer;
import org.brown.greenbench.sensor.SensorReading;
import org.brown.greenbench.sensor.SensorType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * 샘플 버퍼 + 경과 시간 → 메트릭 계산 (상태 없음)
 *
 * 에너지 계산 우선순위:
 * 1. 누적 카운터 샘플이 2개 이상이면 마지막 - 처음을 샘플 구간 대비 경과 시간으로 환산
 *    (감소하면 wrap-around 로 보고 unavailable)
 * 2. 전력 샘플이 2개 이상이면 사다리꼴 적분으로 구한 평균 전력 × 경과 시간
 * 3. 전력 샘플이 1개면 순간 전력 × 경과 시간
 */
@Slf4j
public class EnergyAccounting {

    public static final String NOTE_CLOCK_ANOMALY = "clock-anomaly";
    public static final String NOTE_COUNTER_WRAP = "counter-wrap";

    private static final double JOULES_PER_KWH = 3_600_000.0;
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final double gridIntensityGPerKwh;

    public EnergyAccounting(double gridIntensityGPerKwh) {
        if (!Double.isFinite(gridIntensityGPerKwh) || gridIntensityGPerKwh < 0) {
            throw new IllegalArgumentException("Grid intensity must be a non-negative number: " + gridIntensityGPerKwh);
        }
        this.gridIntensityGPerKwh = gridIntensityGPerKwh;
    }

    public double gridIntensityGPerKwh() {
        return gridIntensityGPerKwh;
    }

    /**
     * 센서 1개의 측정 결과를 해당 센서 소유 메트릭으로 변환한다.
     * degraded 된 센서는 소유 메트릭 전체가 unavailable 이다.
     */
    public AccountingResult account(SensorReading reading, Duration duration) {
        SensorType type = reading.type();
        if (reading.degraded()) {
            return new AccountingResult(
                    unavailableFor(type, "sensor degraded: " + reading.degradedReason()),
                    Set.of(FaultKind.SENSOR_DEGRADED));
        }

        double seconds = toSeconds(duration);
        Set<FaultKind> faults = EnumSet.noneOf(FaultKind.class);
        MetricSet.Builder builder = MetricSet.builder();
        SampleBuffer buffer = reading.buffer();

        switch (type) {
            case SYSTEM_RESOURCE -> {
                List<Sample> cpu = buffer.samplesOf(MetricKind.CPU_UTILIZATION);
                List<Sample> ram = buffer.samplesOf(MetricKind.RAM_USED_MB);
                builder.put(Metric.CPU_USAGE_MEAN_PERCENT, mean(cpu))
                        .put(Metric.CPU_USAGE_PEAK_PERCENT, peak(cpu))
                        .put(Metric.RAM_USAGE_MEAN_MB, mean(ram))
                        .put(Metric.RAM_USAGE_PEAK_MB, peak(ram));
                energyAndMeanPower(builder, faults, seconds,
                        buffer.samplesOf(MetricKind.CPU_ENERGY_COUNTER_J), List.of(),
                        Metric.CPU_ENERGY_JOULES, Metric.CPU_POWER_MEAN_WATTS);
            }
            case ACCELERATOR -> {
                List<Sample> util = buffer.samplesOf(MetricKind.ACCELERATOR_UTILIZATION);
                List<Sample> mem = buffer.samplesOf(MetricKind.ACCELERATOR_MEMORY_MB);
                List<Sample> power = buffer.samplesOf(MetricKind.ACCELERATOR_POWER_W);
                builder.put(Metric.GPU_USAGE_MEAN_PERCENT, mean(util))
                        .put(Metric.GPU_USAGE_PEAK_PERCENT, peak(util))
                        .put(Metric.GPU_MEMORY_MEAN_MB, mean(mem))
                        .put(Metric.GPU_MEMORY_PEAK_MB, peak(mem))
                        .put(Metric.GPU_MEMORY_PEAK_PERCENT, peak(buffer.samplesOf(MetricKind.ACCELERATOR_MEMORY_PERCENT)))
                        .put(Metric.GPU_TEMPERATURE_PEAK_CELSIUS, peak(buffer.samplesOf(MetricKind.ACCELERATOR_TEMPERATURE_C)));
                builder.put(Metric.GPU_POWER_PEAK_WATTS, seconds > 0 ? peak(power) : clockAnomaly());
                energyAndMeanPower(builder, faults, seconds, List.of(), power,
                        Metric.GPU_ENERGY_JOULES, Metric.GPU_POWER_MEAN_WATTS);
            }
            case EXTERNAL_POWER -> {
                List<Sample> power = buffer.samplesOf(MetricKind.SYSTEM_POWER_W);
                builder.put(Metric.SYSTEM_POWER_PEAK_WATTS, seconds > 0 ? peak(power) : clockAnomaly());
                energyAndMeanPower(builder, faults, seconds,
                        buffer.samplesOf(MetricKind.SYSTEM_ENERGY_COUNTER_J), power,
                        Metric.SYSTEM_ENERGY_JOULES, Metric.SYSTEM_POWER_MEAN_WATTS);
            }
        }
        return new AccountingResult(builder.build(), faults);
    }

    /**
     * 센서가 없거나 측정하지 못한 경우의 메트릭 세트
     */
    public MetricSet unavailableFor(SensorType type, String note) {
        return MetricSet.unavailable(Metric.ofSource(type.metricSource()), note);
    }

    /**
     * 구성요소 메트릭에서 합계/탄소/효율과 duration 을 다시 계산한다.
     * 기존 파생 메트릭은 버린다.
     */
    public AccountingResult derive(MetricSet components, Duration duration, OptionalLong usefulWork) {
        double seconds = toSeconds(duration);
        MetricSet base = components
                .without(Metric.ofSource(Metric.Source.DERIVED))
                .without(Metric.ofSource(Metric.Source.RUN));

        MetricSet.Builder derived = MetricSet.builder();
        derived.put(Metric.DURATION_SECONDS, Math.max(seconds, 0.0));

        if (seconds <= 0) {
            for (Metric m : Metric.ofSource(Metric.Source.DERIVED)) {
                derived.put(m, clockAnomaly());
            }
            return new AccountingResult(base.merge(derived.build()), Set.of(FaultKind.CLOCK_ANOMALY));
        }

        MetricValue total = totalEnergy(base);
        derived.put(Metric.TOTAL_ENERGY_JOULES, total);
        derived.put(Metric.POWER_WATTS, scale(total, 1.0 / seconds));
        derived.put(Metric.CARBON_GRAMS, scale(total, gridIntensityGPerKwh / JOULES_PER_KWH));
        derived.put(Metric.CARBON_GRAMS_SYSTEM, scale(
                base.get(Metric.SYSTEM_ENERGY_JOULES).orElse(MetricValue.unavailable("no external power meter")),
                gridIntensityGPerKwh / JOULES_PER_KWH));
        derived.put(Metric.ENERGY_EFFICIENCY, efficiency(total, usefulWork));

        return AccountingResult.of(base.merge(derived.build()));
    }

    private MetricValue totalEnergy(MetricSet components) {
        double sum = 0;
        boolean partial = false;
        List<String> omitted = new ArrayList<>();
        int present = 0;
        for (Metric m : List.of(Metric.CPU_ENERGY_JOULES, Metric.GPU_ENERGY_JOULES)) {
            MetricValue v = components.get(m).orElse(null);
            if (v == null || !v.isAvailable()) {
                omitted.add(m.key());
                continue;
            }
            sum += v.value();
            partial |= v.status() == MetricStatus.PARTIAL;
            present++;
        }
        if (present == 0) {
            return MetricValue.unavailable("no component energy available");
        }
        if (!omitted.isEmpty()) {
            return MetricValue.partial(sum, "omitted: " + String.join(", ", omitted));
        }
        return partial ? MetricValue.partial(sum, "partial component energy") : MetricValue.of(sum);
    }

    private static MetricValue efficiency(MetricValue total, OptionalLong usefulWork) {
        if (usefulWork.isEmpty()) {
            return MetricValue.unavailable("no useful work reported");
        }
        if (!total.isAvailable()) {
            return MetricValue.unavailable("total energy unavailable");
        }
        if (total.value() <= 0) {
            return MetricValue.unavailable("zero total energy");
        }
        return new MetricValue(usefulWork.getAsLong() / total.value(), total.status(), total.note());
    }

    private static void energyAndMeanPower(MetricSet.Builder builder,
                                           Set<FaultKind> faults,
                                           double seconds,
                                           List<Sample> counter,
                                           List<Sample> power,
                                           Metric energyMetric,
                                           Metric meanPowerMetric) {
        if (seconds <= 0) {
            faults.add(FaultKind.CLOCK_ANOMALY);
            builder.put(energyMetric, clockAnomaly());
            builder.put(meanPowerMetric, clockAnomaly());
            return;
        }
        MetricValue energy = energy(counter, power, seconds);
        if (NOTE_COUNTER_WRAP.equals(energy.note())) {
            faults.add(FaultKind.COUNTER_WRAP);
        }
        builder.put(energyMetric, energy);
        builder.put(meanPowerMetric, scale(energy, 1.0 / seconds));
    }

    static MetricValue energy(List<Sample> counter, List<Sample> power, double seconds) {
        if (counter.size() >= 2) {
            double delta = counter.get(counter.size() - 1).value() - counter.get(0).value();
            if (delta < 0) {
                log.warn("[ACCOUNTING][COUNTER] energy counter decreased by {} J, treating as wrap-around", -delta);
                return MetricValue.unavailable(NOTE_COUNTER_WRAP);
            }
            // 카운터 갱신 주기가 윈도우보다 길면 delta 가 0 으로 나온다
            if (delta > 0 || power.isEmpty()) {
                return MetricValue.of(rescale(delta, counter, seconds));
            }
        }
        if (power.size() >= 2) {
            return MetricValue.of(integrate(power, seconds));
        }
        if (power.size() == 1) {
            return MetricValue.of(Math.max(0.0, power.get(0).value()) * seconds);
        }
        return MetricValue.unavailable(counter.size() == 1 ? "single energy counter sample" : "no samples");
    }

    /**
     * 카운터 샘플 구간의 에너지를 경과 시간 기준으로 환산한다 (구간 평균 전력 × 경과 시간).
     * 구간 길이가 0이면 차이를 그대로 쓴다.
     */
    static double rescale(double delta, List<Sample> counter, double seconds) {
        double span = (counter.get(counter.size() - 1).monotonicNanos() - counter.get(0).monotonicNanos())
                / NANOS_PER_SECOND;
        return span > 0 ? delta / span * seconds : delta;
    }

    /**
     * 사다리꼴 적분으로 샘플 구간의 평균 전력을 구해 경과 시간에 곱한다.
     * 샘플 구간 길이가 0이면 산술 평균을 쓴다.
     */
    static double integrate(List<Sample> power, double seconds) {
        double area = 0;
        for (int i = 1; i < power.size(); i++) {
            Sample a = power.get(i - 1);
            Sample b = power.get(i);
            double dt = (b.monotonicNanos() - a.monotonicNanos()) / NANOS_PER_SECOND;
            area += (a.value() + b.value()) / 2.0 * dt;
        }
        double span = (power.get(power.size() - 1).monotonicNanos() - power.get(0).monotonicNanos()) / NANOS_PER_SECOND;
        double meanPower = span > 0
                ? area / span
                : power.stream().mapToDouble(Sample::value).average().orElse(0);
        return Math.max(0.0, meanPower) * seconds;
    }

    private static MetricValue mean(List<Sample> samples) {
        if (samples.isEmpty()) {
            return MetricValue.unavailable("no samples");
        }
        return MetricValue.of(samples.stream().mapToDouble(Sample::value).average().orElseThrow());
    }

    private static MetricValue peak(List<Sample> samples) {
        if (samples.isEmpty()) {
            return MetricValue.unavailable("no samples");
        }
        return MetricValue.of(samples.stream().mapToDouble(Sample::value).max().orElseThrow());
    }

    private static MetricValue scale(MetricValue value, double factor) {
        if (!value.isAvailable()) {
            return value;
        }
        return value.withValue(value.value() * factor);
    }

    private static MetricValue clockAnomaly() {
        return MetricValue.unavailable(NOTE_CLOCK_ANOMALY);
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / NANOS_PER_SECOND;
    }
}
