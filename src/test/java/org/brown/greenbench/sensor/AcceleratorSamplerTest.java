package org.brown.greenbench.sensor;

import org.brown.greenbench.model.MetricKind;
import org.brown.greenbench.sensor.probe.AcceleratorProbe;
import org.brown.greenbench.sensor.probe.AcceleratorSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AcceleratorSampler Tests")
class AcceleratorSamplerTest {

    @Test
    @DisplayName("Should record utilization, memory, temperature and power")
    void testSamples() throws Exception {
        AcceleratorSampler sampler = FakeProbes.acceleratorSampler(new FakeProbes.Load(), true);
        sampler.start();
        Thread.sleep(40);
        SensorReading reading = sampler.stop();

        for (MetricKind kind : new MetricKind[]{
                MetricKind.ACCELERATOR_UTILIZATION, MetricKind.ACCELERATOR_MEMORY_MB,
                MetricKind.ACCELERATOR_MEMORY_PERCENT, MetricKind.ACCELERATOR_TEMPERATURE_C,
                MetricKind.ACCELERATOR_POWER_W}) {
            assertFalse(reading.buffer().samplesOf(kind).isEmpty(), kind.name());
        }
    }

    @Test
    @DisplayName("Should skip optional fields the device does not report")
    void testOptionalFields() {
        AcceleratorProbe noPower = new AcceleratorProbe() {
            @Override
            public SensorAvailability detect() {
                return SensorAvailability.available("GPU 0");
            }

            @Override
            public AcceleratorSnapshot read() {
                return new AcceleratorSnapshot(10, 100, 1000, null, null);
            }
        };
        AcceleratorSampler sampler = new AcceleratorSampler(noPower, null,
                FakeProbes.INTERVAL, FakeProbes.STOP_TIMEOUT, MonotonicClock.SYSTEM);
        sampler.start();
        SensorReading reading = sampler.stop();

        assertFalse(reading.buffer().samplesOf(MetricKind.ACCELERATOR_UTILIZATION).isEmpty());
        assertTrue(reading.buffer().samplesOf(MetricKind.ACCELERATOR_POWER_W).isEmpty());
        assertTrue(reading.buffer().samplesOf(MetricKind.ACCELERATOR_TEMPERATURE_C).isEmpty());
    }

    @Test
    @DisplayName("Should be unavailable when no device is detected")
    void testAbsentDevice() {
        AcceleratorSampler sampler = FakeProbes.acceleratorSampler(new FakeProbes.Load(), false);
        assertFalse(sampler.isAvailable());
        sampler.start();
        assertFalse(sampler.isRunning());
    }

    @Test
    @DisplayName("Should be unavailable when disabled by configuration even if a device exists")
    void testDisabledByConfig() {
        AcceleratorSampler sampler = new AcceleratorSampler(
                new FakeProbes.FakeAcceleratorProbe(new FakeProbes.Load(), true), false,
                FakeProbes.INTERVAL, FakeProbes.STOP_TIMEOUT, MonotonicClock.SYSTEM);
        assertFalse(sampler.isAvailable());
        assertTrue(sampler.availabilityReason().contains("disabled"));
    }

    @Test
    @DisplayName("Should degrade at the first failed read")
    void testDegradesOnFailure() {
        AcceleratorProbe failing = new AcceleratorProbe() {
            @Override
            public SensorAvailability detect() {
                return SensorAvailability.available("GPU 0");
            }

            @Override
            public AcceleratorSnapshot read() throws SensorProbeException {
                throw new SensorProbeException("nvidia-smi query failed");
            }
        };
        AcceleratorSampler sampler = new AcceleratorSampler(failing, null,
                FakeProbes.INTERVAL, FakeProbes.STOP_TIMEOUT, MonotonicClock.SYSTEM);
        sampler.start();
        SensorReading reading = sampler.stop();

        assertTrue(reading.degraded());
        assertEquals(1, reading.droppedSamples());
    }
}
