package org.brown.greenbench.sensor.probe;

/**
 * 가속기 1회 조회 결과
 *
 * @param utilizationPercent 연산 사용률 (%)
 * @param memoryUsedMb       사용 메모리 (MB)
 * @param memoryTotalMb      전체 메모리 (MB)
 * @param temperatureCelsius 온도, 지원하지 않으면 null
 * @param powerWatts         순간 전력, 지원하지 않으면 null
 */
public record AcceleratorSnapshot(double utilizationPercent,
                                  double memoryUsedMb,
                                  double memoryTotalMb,
                                  Double temperatureCelsius,
                                  Double powerWatts) {

    public double memoryPercent() {
        return memoryTotalMb > 0 ? memoryUsedMb / memoryTotalMb * 100.0 : 0.0;
    }
}
