package org.brown.greenbench.sensor;

import org.brown.greenbench.model.MetricKind;
import org.brown.greenbench.sensor.probe.SystemProbe;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 시스템 CPU 사용률 / 사용 메모리 / (선택) RAPL 에너지 카운터 샘플러
 */
public class SystemResourceSampler extends AbstractSamplingSensor {

    private final SystemProbe probe;

    public SystemResourceSampler(SystemProbe probe, Duration interval, Duration stopTimeout, MonotonicClock clock) {
        super(SensorType.SYSTEM_RESOURCE, safeDetect(probe), interval, stopTimeout, 1, clock);
        this.probe = probe;
    }

    @Override
    protected Map<MetricKind, Double> sampleOnce() throws SensorProbeException {
        Map<MetricKind, Double> values = new EnumMap<>(MetricKind.class);
        OptionalDouble cpu = probe.cpuUtilizationPercent();
        cpu.ifPresent(v -> values.put(MetricKind.CPU_UTILIZATION, v));
        values.put(MetricKind.RAM_USED_MB, probe.usedMemoryMb());
        OptionalDouble counter = probe.energyCounterJoules();
        counter.ifPresent(v -> values.put(MetricKind.CPU_ENERGY_COUNTER_J, v));
        return values;
    }

    private static SensorAvailability safeDetect(SystemProbe probe) {
        try {
            return probe.detect();
        } catch (RuntimeException e) {
            return SensorAvailability.unavailable("system probe failed: " + e.getMessage());
        }
    }
}
