package org.brown.greenbench.sensor;

import org.brown.greenbench.model.MetricKind;
import org.brown.greenbench.sensor.probe.PowerMeterClient;
import org.brown.greenbench.sensor.probe.PowerMeterSnapshot;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * 외부 전력계 폴링 샘플러
 *
 * 폴링 실패 1회는 드롭된 샘플이고, 연속 실패가 maxConsecutiveFailures 에 닿으면
 * 해당 윈도우의 남은 시간 동안 degraded 상태가 된다.
 */
public class ExternalPowerSampler extends AbstractSamplingSensor {

    private final PowerMeterClient client;

    /**
     * @param client null 이면 (엔드포인트 미설정) 비활성 센서
     */
    public ExternalPowerSampler(PowerMeterClient client,
                                int maxConsecutiveFailures,
                                Duration interval,
                                Duration stopTimeout,
                                MonotonicClock clock) {
        super(SensorType.EXTERNAL_POWER, detect(client), interval, stopTimeout, maxConsecutiveFailures, clock);
        this.client = client;
    }

    @Override
    protected Map<MetricKind, Double> sampleOnce() throws SensorProbeException {
        PowerMeterSnapshot s = client.poll();
        Map<MetricKind, Double> values = new EnumMap<>(MetricKind.class);
        values.put(MetricKind.SYSTEM_POWER_W, s.loadWatts());
        if (s.energyJoules() != null) {
            values.put(MetricKind.SYSTEM_ENERGY_COUNTER_J, s.energyJoules());
        }
        return values;
    }

    private static SensorAvailability detect(PowerMeterClient client) {
        if (client == null) {
            return SensorAvailability.unavailable("no power meter endpoint configured");
        }
        try {
            PowerMeterSnapshot s = client.poll();
            return SensorAvailability.available(client.endpoint() + " (load " + s.loadWatts() + " W)");
        } catch (SensorProbeException | RuntimeException e) {
            return SensorAvailability.unavailable("power meter probe failed: " + e.getMessage());
        }
    }
}
