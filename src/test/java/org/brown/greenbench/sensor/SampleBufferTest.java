package org.brown.greenbench.sensor;

import org.brown.greenbench.model.MetricKind;
import org.brown.greenbench.model.Sample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SampleBuffer Tests")
class SampleBufferTest {

    @Test
    @DisplayName("Should keep samples in append order and filter by kind after close")
    void testAppendAndFilter() {
        SampleBuffer buffer = new SampleBuffer();
        assertTrue(buffer.append(new Sample(10, 1.0, MetricKind.CPU_UTILIZATION)));
        assertTrue(buffer.append(new Sample(10, 512.0, MetricKind.RAM_USED_MB)));
        assertTrue(buffer.append(new Sample(20, 3.0, MetricKind.CPU_UTILIZATION)));
        buffer.close();

        assertEquals(3, buffer.size());
        assertEquals(2, buffer.samplesOf(MetricKind.CPU_UTILIZATION).size());
        assertEquals(3.0, buffer.samplesOf(MetricKind.CPU_UTILIZATION).get(1).value());
        assertTrue(buffer.samplesOf(MetricKind.SYSTEM_POWER_W).isEmpty());
    }

    @Test
    @DisplayName("Should reject out-of-order timestamps")
    void testOutOfOrder() {
        SampleBuffer buffer = new SampleBuffer();
        buffer.append(new Sample(100, 1.0, MetricKind.CPU_UTILIZATION));
        assertThrows(IllegalArgumentException.class,
                () -> buffer.append(new Sample(99, 1.0, MetricKind.CPU_UTILIZATION)));
        assertEquals(1, buffer.size());
    }

    @Test
    @DisplayName("Should refuse appends after close")
    void testClosedBufferRejectsAppend() {
        SampleBuffer buffer = new SampleBuffer();
        buffer.close();
        assertFalse(buffer.append(new Sample(1, 1.0, MetricKind.CPU_UTILIZATION)));
        assertEquals(0, buffer.size());
    }

    @Test
    @DisplayName("Should not allow reading an open buffer")
    void testReadOpenBuffer() {
        SampleBuffer buffer = new SampleBuffer();
        assertThrows(IllegalStateException.class, () -> buffer.samplesOf(MetricKind.CPU_UTILIZATION));
    }
}
