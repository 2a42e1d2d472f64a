package org.brown.greenbench.baseline;

import org.brown.greenbench.accounting.EnergyAccounting;
import org.brown.greenbench.model.BaselineProfile;
import org.brown.greenbench.model.Metric;
import org.brown.greenbench.sensor.FakeProbes;
import org.brown.greenbench.sensor.MonotonicClock;
import org.brown.greenbench.sensor.Sensor;
import org.brown.greenbench.sensor.SensorSuite;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BaselineCalibrator Tests")
class BaselineCalibratorTest {

    private final FakeProbes.Load idle = new FakeProbes.Load();

    private BaselineCalibrator calibrator(SensorSuite suite) {
        return new BaselineCalibrator(suite, new EnergyAccounting(250.0), MonotonicClock.SYSTEM);
    }

    @Test
    @DisplayName("Should capture idle metrics from every available sensor")
    void testCapturesIdleMetrics() throws Exception {
        SensorSuite suite = new SensorSuite(List.of(
                FakeProbes.systemSampler(idle),
                FakeProbes.acceleratorSampler(idle, true),
                FakeProbes.powerSampler(new FakeProbes.FakePowerMeter(idle))));

        BaselineProfile profile = calibrator(suite).calibrate(Duration.ofMillis(80));

        assertEquals(List.of("system", "accelerator", "power-meter"), profile.activeSensors());
        assertTrue(profile.idleDuration().toMillis() >= 80);
        assertEquals(5.0, profile.metrics().valueOf(Metric.CPU_USAGE_MEAN_PERCENT).getAsDouble(), 1e-9);
        assertEquals(20.0, profile.metrics().valueOf(Metric.GPU_POWER_PEAK_WATTS).getAsDouble(), 1e-9);
        assertTrue(profile.metrics().isAvailable(Metric.SYSTEM_ENERGY_JOULES));
        assertTrue(profile.metrics().isAvailable(Metric.TOTAL_ENERGY_JOULES));
        assertFalse(profile.metrics().isAvailable(Metric.ENERGY_EFFICIENCY));
        for (Sensor sensor : suite.all()) {
            assertFalse(sensor.isRunning());
        }
    }

    @Test
    @DisplayName("Should mark metrics of unavailable sensors as unavailable")
    void testUnavailableSensors() throws Exception {
        SensorSuite suite = new SensorSuite(List.of(
                FakeProbes.systemSampler(idle),
                FakeProbes.acceleratorSampler(idle, false),
                FakeProbes.powerSampler(null)));

        BaselineProfile profile = calibrator(suite).calibrate(Duration.ofMillis(50));

        for (Metric m : Metric.ofSource(Metric.Source.ACCELERATOR)) {
            assertTrue(profile.metrics().contains(m), m.key());
            assertFalse(profile.metrics().isAvailable(m), m.key());
        }
        for (Metric m : Metric.ofSource(Metric.Source.EXTERNAL_POWER)) {
            assertFalse(profile.metrics().isAvailable(m), m.key());
        }
        assertTrue(profile.metrics().isAvailable(Metric.RAM_USAGE_PEAK_MB));
    }

    @Test
    @DisplayName("Should produce comparable profiles when run twice under identical idle conditions")
    void testIdempotence() throws Exception {
        SensorSuite suite = new SensorSuite(List.of(
                FakeProbes.systemSampler(idle),
                FakeProbes.acceleratorSampler(idle, true),
                FakeProbes.powerSampler(new FakeProbes.FakePowerMeter(idle))));
        BaselineCalibrator calibrator = calibrator(suite);

        BaselineProfile first = calibrator.calibrate(Duration.ofMillis(100));
        BaselineProfile second = calibrator.calibrate(Duration.ofMillis(100));

        for (Metric m : List.of(Metric.CPU_USAGE_MEAN_PERCENT, Metric.RAM_USAGE_PEAK_MB,
                Metric.GPU_USAGE_MEAN_PERCENT, Metric.GPU_POWER_MEAN_WATTS, Metric.SYSTEM_POWER_PEAK_WATTS)) {
            assertEquals(first.metrics().valueOf(m).getAsDouble(), second.metrics().valueOf(m).getAsDouble(),
                    1e-6, m.key());
        }
        // idle power derived from counters depends on sampling jitter
        double p1 = first.metrics().valueOf(Metric.CPU_POWER_MEAN_WATTS).getAsDouble();
        double p2 = second.metrics().valueOf(Metric.CPU_POWER_MEAN_WATTS).getAsDouble();
        assertEquals(p1, p2, 5.0);
    }
}
