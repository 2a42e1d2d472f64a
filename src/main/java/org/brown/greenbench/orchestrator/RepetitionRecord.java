package org.brown.greenbench.orchestrator;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.brown.greenbench.model.FaultKind;
import org.brown.greenbench.model.MetricSet;
import org.brown.greenbench.model.RepetitionStatus;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * 반복 슬롯 1개의 결과 (불변)
 *
 * FAILED 레코드는 메트릭이 비어 있고 진단 정보만 가진다.
 * 실패한 시도의 데이터는 어디에도 남지 않는다.
 */
@Value
@Builder
public class RepetitionRecord {

    /**
     * 1부터 시작하는 슬롯 번호
     */
    int index;

    /**
     * 이 슬롯에서 사용한 시도 횟수
     */
    int attempts;

    RepetitionStatus status;

    Duration duration;

    /**
     * 기준선 차감 전
     */
    @Builder.Default
    MetricSet raw = MetricSet.empty();

    /**
     * 기준선 차감 후
     */
    @Builder.Default
    MetricSet net = MetricSet.empty();

    String diagnostic;

    @Singular
    Set<FaultKind> faults;

    long workloadStartNanos;

    long workloadEndNanos;

    @Singular
    List<SensorWindow> sensorWindows;

    public boolean isOk() {
        return status == RepetitionStatus.OK;
    }
}
