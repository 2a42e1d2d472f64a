package org.brown.greenbench.sensor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SensorSuite Tests")
class SensorSuiteTest {

    @Test
    @DisplayName("Should start in fixed order and stop in reverse order")
    void testStartStopOrder() {
        List<String> events = new ArrayList<>();
        SensorSuite suite = new SensorSuite(List.of(
                new RecordingSensor(SensorType.EXTERNAL_POWER, events),
                new RecordingSensor(SensorType.SYSTEM_RESOURCE, events),
                new RecordingSensor(SensorType.ACCELERATOR, events)));

        SensorSuite.SamplingRun run = suite.startAll();
        List<SensorReading> readings = run.stopAll();

        assertEquals(List.of(
                "start:system", "start:accelerator", "start:power-meter",
                "stop:power-meter", "stop:accelerator", "stop:system"), events);
        assertEquals(SensorType.SYSTEM_RESOURCE, readings.get(0).type());
        assertEquals(SensorType.EXTERNAL_POWER, readings.get(2).type());
    }

    @Test
    @DisplayName("Should stop only once even when closed repeatedly")
    void testIdempotentStop() {
        List<String> events = new ArrayList<>();
        SensorSuite suite = new SensorSuite(List.of(new RecordingSensor(SensorType.SYSTEM_RESOURCE, events)));
        try (SensorSuite.SamplingRun run = suite.startAll()) {
            run.stopAll();
        }
        assertEquals(List.of("start:system", "stop:system"), events);
    }

    @Test
    @DisplayName("Should exclude unavailable sensors and report them as inactive")
    void testInactiveTypes() {
        SensorSuite suite = new SensorSuite(List.of(
                FakeProbes.systemSampler(new FakeProbes.Load()),
                FakeProbes.acceleratorSampler(new FakeProbes.Load(), false),
                FakeProbes.powerSampler(null)));

        assertEquals(1, suite.active().size());
        assertTrue(suite.isMeasurable());
        assertTrue(suite.inactiveTypes().contains(SensorType.ACCELERATOR));
        assertTrue(suite.inactiveTypes().contains(SensorType.EXTERNAL_POWER));
    }

    @Test
    @DisplayName("Should reject duplicate sensor types")
    void testDuplicates() {
        List<String> events = new ArrayList<>();
        assertThrows(IllegalArgumentException.class, () -> new SensorSuite(List.of(
                new RecordingSensor(SensorType.SYSTEM_RESOURCE, events),
                new RecordingSensor(SensorType.SYSTEM_RESOURCE, events))));
    }

    @Test
    @DisplayName("Should stop already started sensors when a later start fails")
    void testStartFailureRollsBack() {
        List<String> events = new ArrayList<>();
        RecordingSensor broken = new RecordingSensor(SensorType.ACCELERATOR, events) {
            @Override
            public void start() {
                throw new IllegalStateException("boom");
            }
        };
        SensorSuite suite = new SensorSuite(List.of(new RecordingSensor(SensorType.SYSTEM_RESOURCE, events), broken));

        assertThrows(IllegalStateException.class, suite::startAll);
        assertEquals(List.of("start:system", "stop:system"), events);
    }

    private static class RecordingSensor implements Sensor {

        private final SensorType type;
        private final List<String> events;
        private boolean running;

        RecordingSensor(SensorType type, List<String> events) {
            this.type = type;
            this.events = events;
        }

        @Override
        public SensorType type() {
            return type;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public String availabilityReason() {
            return "recording";
        }

        @Override
        public void start() {
            events.add("start:" + type.id());
            running = true;
        }

        @Override
        public SensorReading stop() {
            events.add("stop:" + type.id());
            running = false;
            return new SensorReading(type, SampleBuffer.closedEmpty(), null, 0, 1, 0);
        }

        @Override
        public boolean isRunning() {
            return running;
        }
    }
}
