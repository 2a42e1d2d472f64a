package org.brown.greenbench.sensor.probe;

/**
 * 외부 전력계 1회 폴링 결과
 *
 * @param loadWatts     순간 부하 (W)
 * @param energyJoules  누적 에너지 카운터 (J), 제공하지 않으면 null
 */
public record PowerMeterSnapshot(double loadWatts, Double energyJoules) {
}
