package org.brown.greenbench.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.aggregate.MeasurementOutcome;
import org.brown.greenbench.aggregate.ResultAggregator;
import org.brown.greenbench.config.MeasurementConfig;
import org.brown.greenbench.model.SessionKey;
import org.brown.greenbench.orchestrator.MeasurementOrchestrator;
import org.brown.greenbench.orchestrator.MeasurementSession;
import org.brown.greenbench.sensor.MonotonicClock;
import org.brown.greenbench.sensor.SensorSuite;
import org.brown.greenbench.workload.Workload;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 측정 세션 실행 서비스
 *
 * 외부 전력계는 공유 자원이므로 세션은 한 번에 하나만 실행한다.
 * 세션마다 결과는 정확히 하나 싱크로 전달된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeasurementService {

    private final SensorSuite sensorSuite;
    private final MeasurementConfig config;
    private final ResultAggregator aggregator;
    private final MonotonicClock clock;

    private final ReentrantLock sessionLock = new ReentrantLock();

    private volatile SessionKey currentSession;
    private volatile MeasurementOutcome lastOutcome;

    public MeasurementOutcome measure(SessionKey key, Workload workload, Duration timeout) {
        Duration effectiveTimeout = timeout != null ? timeout : config.getDefaultWorkloadTimeout();

        sessionLock.lock();
        MDC.put("instanceId", key.instanceId());
        MDC.put("variantId", key.variantId());
        MDC.put("testName", key.testName());
        try {
            currentSession = key;
            log.info("Measurement session start: {} (timeout {}s)", key, effectiveTimeout.toSeconds());

            MeasurementOrchestrator orchestrator = new MeasurementOrchestrator(sensorSuite, config, clock);
            MeasurementSession session = orchestrator.run(key, workload, effectiveTimeout);
            MeasurementOutcome outcome = aggregator.publish(session);

            lastOutcome = outcome;
            return outcome;
        } finally {
            currentSession = null;
            MDC.remove("instanceId");
            MDC.remove("variantId");
            MDC.remove("testName");
            sessionLock.unlock();
        }
    }

    public boolean isBusy() {
        return sessionLock.isLocked();
    }

    public SessionKey currentSession() {
        return currentSession;
    }

    public MeasurementOutcome lastOutcome() {
        return lastOutcome;
    }
}
