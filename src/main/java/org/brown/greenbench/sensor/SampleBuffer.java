package org.brown.greenbench.sensor;

import org.brown.greenbench.model.MetricKind;
import org.brown.greenbench.model.Sample;

import java.util.ArrayList;
import java.util.List;

/**
 * 센서 1개의 시계열 버퍼
 *
 * - 열려 있는 동안 append-only (샘플링 스레드만 쓴다)
 * - {@link #close()} 이후에는 어떤 append 도 받지 않는 읽기 전용 스냅샷
 * - 타임스탬프는 감소하지 않는다
 */
public final class SampleBuffer {

    private final List<Sample> samples = new ArrayList<>();
    private boolean closed;
    private long lastNanos = Long.MIN_VALUE;

    /**
     * 샘플 추가
     *
     * @return 추가되었으면 true, 이미 닫힌 버퍼이면 false
     * @throws IllegalArgumentException 직전 샘플보다 이른 타임스탬프
     */
    public synchronized boolean append(Sample sample) {
        if (closed) {
            return false;
        }
        if (sample.monotonicNanos() < lastNanos) {
            throw new IllegalArgumentException(
                    "Out-of-order sample: " + sample.monotonicNanos() + " < " + lastNanos);
        }
        samples.add(sample);
        lastNanos = sample.monotonicNanos();
        return true;
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int size() {
        return samples.size();
    }

    public synchronized List<Sample> snapshot() {
        return List.copyOf(samples);
    }

    /**
     * 닫힌 버퍼에서 특정 종류의 샘플만 꺼낸다.
     *
     * @throws IllegalStateException 버퍼가 아직 열려 있는 경우
     */
    public synchronized List<Sample> samplesOf(MetricKind kind) {
        if (!closed) {
            throw new IllegalStateException("Buffer must be closed before it is read");
        }
        List<Sample> result = new ArrayList<>();
        for (Sample s : samples) {
            if (s.kind() == kind) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * 이미 닫힌 빈 버퍼 (측정하지 않은 센서용)
     */
    public static SampleBuffer closedEmpty() {
        SampleBuffer buffer = new SampleBuffer();
        buffer.close();
        return buffer;
    }
}
