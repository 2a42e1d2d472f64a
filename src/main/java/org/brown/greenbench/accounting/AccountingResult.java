package org.brown.greenbench.accounting;

import org.brown.greenbench.model.FaultKind;
import org.brown.greenbench.model.MetricSet;

import java.util.EnumSet;
import java.util.Set;

/**
 * 회계 결과: 메트릭과, 반복 상태에 영향을 주는 장애 표시
 */
public record AccountingResult(MetricSet metrics, Set<FaultKind> faults) {

    public AccountingResult {
        faults = faults.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(faults));
    }

    public static AccountingResult of(MetricSet metrics) {
        return new AccountingResult(metrics, Set.of());
    }

    public boolean has(FaultKind fault) {
        return faults.contains(fault);
    }
}
