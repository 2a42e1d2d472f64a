package org.brown.greenbench.aggregate;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.brown.greenbench.model.FaultKind;
import org.brown.greenbench.model.MetricSet;
import org.brown.greenbench.model.RepetitionStatus;
import org.brown.greenbench.orchestrator.RepetitionRecord;

import java.util.Set;

/**
 * 결과 파일에 남기는 반복 1회의 진단 정보
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RepetitionSummary(int index,
                                int attempts,
                                RepetitionStatus status,
                                Double durationSeconds,
                                String diagnostic,
                                Set<FaultKind> faults,
                                MetricSet net) {

    public static RepetitionSummary of(RepetitionRecord record) {
        return new RepetitionSummary(
                record.getIndex(),
                record.getAttempts(),
                record.getStatus(),
                record.getDuration() != null ? record.getDuration().toNanos() / 1e9 : null,
                record.getDiagnostic(),
                record.getFaults(),
                record.getNet().isEmpty() ? null : record.getNet());
    }
}
