package org.brown.greenbench.sensor;

/**
 * 센서 1회 측정 윈도우의 결과. {@link Sensor#stop()} 이 반환한다.
 *
 * @param type           센서 종류
 * @param buffer         닫힌 샘플 버퍼
 * @param degradedReason 윈도우 중 센서가 degraded 되었으면 사유, 아니면 null
 * @param startedNanos   샘플링 시작 시각
 * @param stoppedNanos   샘플링 루프 종료가 확인된 시각
 * @param droppedSamples 드롭된 샘플 수
 */
public record SensorReading(SensorType type,
                            SampleBuffer buffer,
                            String degradedReason,
                            long startedNanos,
                            long stoppedNanos,
                            int droppedSamples) {

    public SensorReading {
        if (!buffer.isClosed()) {
            throw new IllegalArgumentException("Reading requires a closed buffer");
        }
    }

    public boolean degraded() {
        return degradedReason != null;
    }
}
