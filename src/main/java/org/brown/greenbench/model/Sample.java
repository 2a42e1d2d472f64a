package org.brown.greenbench.model;

/**
 * 센서 샘플 1건 (불변)
 *
 * @param monotonicNanos 단조 시계 기준 시각 ({@link System#nanoTime()} 계열)
 * @param value          측정값
 * @param kind           샘플 종류
 */
public record Sample(long monotonicNanos, double value, MetricKind kind) {

    public Sample {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
    }
}
