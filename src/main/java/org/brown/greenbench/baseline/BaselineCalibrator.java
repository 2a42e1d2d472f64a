package org.brown.greenbench.baseline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.accounting.AccountingResult;
import org.brown.greenbench.accounting.EnergyAccounting;
import org.brown.greenbench.model.BaselineProfile;
import org.brown.greenbench.model.Metric;
import org.brown.greenbench.model.MetricSet;
import org.brown.greenbench.model.MetricValue;
import org.brown.greenbench.sensor.MonotonicClock;
import org.brown.greenbench.sensor.SensorReading;
import org.brown.greenbench.sensor.SensorSuite;
import org.brown.greenbench.sensor.SensorType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

/**
 * 유휴 기준선 측정
 *
 * 반복 측정과 같은 센서, 같은 주기로 워크로드 없이 idle 구간을 측정한다.
 * 측정하지 못한 센서의 메트릭은 unavailable 로 남아 이후 차감에서 건너뛴다.
 */
@Slf4j
@RequiredArgsConstructor
public class BaselineCalibrator {

    private final SensorSuite suite;
    private final EnergyAccounting accounting;
    private final MonotonicClock clock;

    public BaselineProfile calibrate(Duration idleDuration) throws InterruptedException {
        log.info("Baseline calibration start: idle {} ms, sensors={}",
                idleDuration.toMillis(), suite.active().stream().map(s -> s.type().id()).toList());

        long startNanos;
        long endNanos;
        List<SensorReading> readings;
        try (SensorSuite.SamplingRun run = suite.startAll()) {
            startNanos = clock.nanoTime();
            Thread.sleep(idleDuration.toMillis());
            endNanos = clock.nanoTime();
            readings = run.stopAll();
        }

        Duration measured = Duration.ofNanos(endNanos - startNanos);
        MetricSet.Builder components = MetricSet.builder();
        for (SensorReading reading : readings) {
            AccountingResult result = accounting.account(reading, measured);
            components.putAll(result.metrics());
            if (!result.faults().isEmpty()) {
                log.warn("[BASELINE] {} faults during calibration: {}", reading.type().id(), result.faults());
            }
        }
        for (SensorType inactive : suite.inactiveTypes()) {
            components.putAll(accounting.unavailableFor(inactive, "sensor unavailable"));
        }

        MetricSet metrics = accounting.derive(components.build(), measured, OptionalLong.empty()).metrics()
                .with(Metric.ENERGY_EFFICIENCY, MetricValue.unavailable("not applicable to idle baseline"));

        List<String> sensorIds = readings.stream().map(r -> r.type().id()).toList();
        log.info("Baseline calibration done: {} s, sensors={}", measured.toMillis() / 1000.0, sensorIds);
        return new BaselineProfile(metrics, measured, Instant.now(), sensorIds);
    }
}
