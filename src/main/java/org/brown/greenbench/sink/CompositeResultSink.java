package org.brown.greenbench.sink;

import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.aggregate.MeasurementOutcome;

import java.util.List;

/**
 * 같은 결과를 여러 싱크에 순서대로 넘긴다. 첫 실패가 그대로 전파된다.
 */
@Slf4j
public class CompositeResultSink implements ResultSink {

    private final List<ResultSink> sinks;

    public CompositeResultSink(List<ResultSink> sinks) {
        this.sinks = List.copyOf(sinks);
        if (this.sinks.isEmpty()) {
            log.warn("[SINK] No result sink enabled, outcomes will only be logged");
        }
    }

    @Override
    public void accept(MeasurementOutcome outcome) {
        if (sinks.isEmpty()) {
            log.info("[SINK] Outcome {} for {} (no sink enabled)", outcome.getStatus(), outcome.getKey());
            return;
        }
        for (ResultSink sink : sinks) {
            sink.accept(outcome);
        }
    }

    public int size() {
        return sinks.size();
    }
}
