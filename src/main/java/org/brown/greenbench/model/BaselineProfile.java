package org.brown.greenbench.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 유휴 상태 기준선. 세션당 한 번 측정되어 모든 반복에서 재사용된다.
 *
 * @param metrics       유휴 구간 메트릭 (측정 불가 항목은 UNAVAILABLE)
 * @param idleDuration  실제 유휴 측정 길이
 * @param capturedAt    측정 시각
 * @param activeSensors 기준선 측정에 사용한 센서 id
 */
public record BaselineProfile(MetricSet metrics,
                              Duration idleDuration,
                              Instant capturedAt,
                              List<String> activeSensors) {

    public BaselineProfile {
        activeSensors = List.copyOf(activeSensors);
    }
}
