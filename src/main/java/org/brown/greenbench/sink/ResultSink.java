package org.brown.greenbench.sink;

import org.brown.greenbench.aggregate.MeasurementOutcome;

/**
 * 세션 결과 저장소
 */
public interface ResultSink {

    /**
     * @throws ResultPersistenceException 결과를 저장하지 못한 경우
     */
    void accept(MeasurementOutcome outcome);
}
