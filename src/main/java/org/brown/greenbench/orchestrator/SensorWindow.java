package org.brown.greenbench.orchestrator;

import org.brown.greenbench.sensor.SensorReading;

/**
 * 반복 1회에서 센서 1개의 샘플링 구간 (단조 시계 기준)
 */
public record SensorWindow(String sensor,
                           long startedNanos,
                           long stoppedNanos,
                           int samples,
                           int droppedSamples,
                           String degradedReason) {

    public static SensorWindow of(SensorReading reading) {
        return new SensorWindow(
                reading.type().id(),
                reading.startedNanos(),
                reading.stoppedNanos(),
                reading.buffer().size(),
                reading.droppedSamples(),
                reading.degradedReason());
    }

    /**
     * 워크로드 구간을 완전히 감싸는지
     */
    public boolean encloses(long workloadStartNanos, long workloadEndNanos) {
        return startedNanos <= workloadStartNanos && workloadEndNanos <= stoppedNanos;
    }
}
