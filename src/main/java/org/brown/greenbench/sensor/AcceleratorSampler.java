package org.brown.greenbench.sensor;

import org.brown.greenbench.model.MetricKind;
import org.brown.greenbench.sensor.probe.AcceleratorProbe;
import org.brown.greenbench.sensor.probe.AcceleratorSnapshot;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 가속기 사용률 / 메모리 / 온도 / 순간 전력 샘플러
 *
 * 시작 시 장치가 없거나 설정으로 꺼져 있으면 아무 것도 하지 않는 센서가 된다.
 */
public class AcceleratorSampler extends AbstractSamplingSensor {

    private final AcceleratorProbe probe;

    /**
     * @param enabled null 이면 자동 감지, false 이면 강제 비활성화
     */
    public AcceleratorSampler(AcceleratorProbe probe,
                              Boolean enabled,
                              Duration interval,
                              Duration stopTimeout,
                              MonotonicClock clock) {
        super(SensorType.ACCELERATOR, detect(probe, enabled), interval, stopTimeout, 1, clock);
        this.probe = probe;
    }

    @Override
    protected Map<MetricKind, Double> sampleOnce() throws SensorProbeException {
        AcceleratorSnapshot s = probe.read();
        Map<MetricKind, Double> values = new EnumMap<>(MetricKind.class);
        values.put(MetricKind.ACCELERATOR_UTILIZATION, s.utilizationPercent());
        values.put(MetricKind.ACCELERATOR_MEMORY_MB, s.memoryUsedMb());
        values.put(MetricKind.ACCELERATOR_MEMORY_PERCENT, s.memoryPercent());
        if (s.temperatureCelsius() != null) {
            values.put(MetricKind.ACCELERATOR_TEMPERATURE_C, s.temperatureCelsius());
        }
        if (s.powerWatts() != null) {
            values.put(MetricKind.ACCELERATOR_POWER_W, s.powerWatts());
        }
        return values;
    }

    private static SensorAvailability detect(AcceleratorProbe probe, Boolean enabled) {
        if (Boolean.FALSE.equals(enabled)) {
            return SensorAvailability.unavailable("accelerator disabled by configuration");
        }
        if (probe == null) {
            return SensorAvailability.unavailable("no accelerator probe");
        }
        try {
            return probe.detect();
        } catch (RuntimeException e) {
            return SensorAvailability.unavailable("accelerator probe failed: " + e.getMessage());
        }
    }
}
