package org.brown.greenbench.aggregate;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.brown.greenbench.model.BaselineProfile;
import org.brown.greenbench.model.SessionKey;

import java.util.List;
import java.util.Map;

/**
 * 세션 1건당 정확히 1개 생성되어 싱크로 전달되는 최종 결과
 *
 * FAILED 인 경우에도 생성된다. "결과 없음"은 항상 실패 레코드로 남는다.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MeasurementOutcome {

    SessionKey key;

    OutcomeStatus status;

    /**
     * FAILED 일 때만 값이 있다
     */
    String failureReason;

    BaselineProfile baseline;

    /**
     * 기준선 차감 후 메트릭 통계 (OK 반복만)
     */
    Map<String, MetricSummary> aggregated;

    /**
     * 기준선 차감 전 메트릭 통계 (OK 반복만)
     */
    Map<String, MetricSummary> aggregatedRaw;

    List<RepetitionSummary> repetitions;

    OutcomeMetadata metadata;

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }
}
