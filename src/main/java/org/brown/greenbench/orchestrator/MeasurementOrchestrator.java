package org.brown.greenbench.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.accounting.AccountingResult;
import org.brown.greenbench.accounting.BaselineSubtraction;
import org.brown.greenbench.accounting.EnergyAccounting;
import org.brown.greenbench.baseline.BaselineCalibrator;
import org.brown.greenbench.config.MeasurementConfig;
import org.brown.greenbench.model.BaselineProfile;
import org.brown.greenbench.model.FaultKind;
import org.brown.greenbench.model.MetricSet;
import org.brown.greenbench.model.RepetitionStatus;
import org.brown.greenbench.model.SessionKey;
import org.brown.greenbench.sensor.MonotonicClock;
import org.brown.greenbench.sensor.Sensor;
import org.brown.greenbench.sensor.SensorReading;
import org.brown.greenbench.sensor.SensorSuite;
import org.brown.greenbench.sensor.SensorType;
import org.brown.greenbench.workload.Workload;
import org.brown.greenbench.workload.WorkloadResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 측정 세션 상태 머신
 *
 * 흐름:
 * 1. 가용 센서가 없으면 즉시 실패 (SESSION_UNMEASURABLE)
 * 2. 기준선 측정 1회
 * 3. 슬롯마다: 센서 시작(고정 순서) → 워크로드 실행(타임아웃) → 센서 정지(역순) → 회계
 *    워크로드 실패 시 해당 시도의 데이터를 버리고 재시도, 한도 초과 시 FAILED 레코드
 * 4. 완료된 세션을 반환 (싱크에는 쓰지 않는다)
 *
 * 센서 장애는 메트릭 가용성 플래그로만 반영되고 제어 흐름을 바꾸지 않는다.
 */
@Slf4j
public class MeasurementOrchestrator {

    private final SensorSuite suite;
    private final MeasurementConfig config;
    private final EnergyAccounting accounting;
    private final BaselineCalibrator calibrator;
    private final MonotonicClock clock;

    private final List<OrchestratorState> stateHistory = Collections.synchronizedList(new ArrayList<>());
    private volatile OrchestratorState state = OrchestratorState.IDLE;

    public MeasurementOrchestrator(SensorSuite suite, MeasurementConfig config, MonotonicClock clock) {
        this.suite = suite;
        this.config = config.validate();
        this.accounting = new EnergyAccounting(config.getGridIntensityGPerKwh());
        this.clock = clock;
        this.calibrator = new BaselineCalibrator(suite, accounting, clock);
    }

    public OrchestratorState state() {
        return state;
    }

    /**
     * 마지막 세션에서 거친 상태 목록
     */
    public List<OrchestratorState> stateHistory() {
        synchronized (stateHistory) {
            return List.copyOf(stateHistory);
        }
    }

    /**
     * 세션 1건을 끝까지 실행한다. 어떤 경우에도 완료된 세션을 돌려준다.
     * 호출 스레드가 인터럽트되면 센서를 모두 정지한 뒤 실패한 세션을 돌려주고 인터럽트 상태를 유지한다.
     */
    public MeasurementSession run(SessionKey key, Workload workload, Duration timeout) {
        stateHistory.clear();
        transition(OrchestratorState.IDLE);

        List<String> activeIds = suite.active().stream().map(s -> s.type().id()).toList();
        MeasurementSession session = new MeasurementSession(key, config, activeIds);
        for (SensorType inactive : suite.inactiveTypes()) {
            session.addFault(FaultKind.SENSOR_UNAVAILABLE);
            log.info("Sensor {} inactive for session {}: {}", inactive.id(), key, inactiveReason(inactive));
        }

        if (!suite.isMeasurable()) {
            log.error("[FAIL][SESSION] {} has no available sensor, nothing to measure", key);
            session.fail(FaultKind.SESSION_UNMEASURABLE, "no sensor available");
            finish(session);
            return session;
        }

        try {
            transition(OrchestratorState.CALIBRATING);
            session.baseline(calibrator.calibrate(config.getBaselineDuration()));

            for (int slot = 1; slot <= config.getRepetitions(); slot++) {
                transition(OrchestratorState.AWAITING_REPETITION);
                RepetitionRecord record = runSlot(session, slot, workload, timeout);
                session.addRecord(record);
                transition(OrchestratorState.REPETITION_COMPLETE);
                log.info("Repetition {}/{} of {} finished: status={}, attempts={}",
                        slot, config.getRepetitions(), key, record.getStatus(), record.getAttempts());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[FAIL][SESSION] {} interrupted", key);
            session.fail("session interrupted");
        } catch (RuntimeException e) {
            log.error("[FAIL][SESSION] {} aborted", key, e);
            session.fail(FaultKind.SESSION_UNMEASURABLE, "session aborted: " + e.getMessage());
        }

        finish(session);
        return session;
    }

    private RepetitionRecord runSlot(MeasurementSession session, int slot, Workload workload, Duration timeout)
            throws InterruptedException {
        String lastDiagnostic = null;
        for (int attempt = 1; attempt <= config.getRetryLimit(); attempt++) {
            transition(OrchestratorState.RUNNING);
            Attempt a = runAttempt(session.key(), workload, timeout);

            transition(OrchestratorState.ACCOUNTING);
            if (a.succeeded()) {
                return account(session.baseline(), slot, attempt, a);
            }

            lastDiagnostic = a.failureDiagnostic();
            log.warn("[FAIL][WORKLOAD] {} repetition {} attempt {}/{} failed: {}",
                    session.key(), slot, attempt, config.getRetryLimit(), lastDiagnostic);
            if (attempt < config.getRetryLimit()) {
                transition(OrchestratorState.RETRY_PENDING);
            }
        }

        log.error("[FAIL][REPETITION] {} repetition {} failed after {} attempts",
                session.key(), slot, config.getRetryLimit());
        return RepetitionRecord.builder()
                .index(slot)
                .attempts(config.getRetryLimit())
                .status(RepetitionStatus.FAILED)
                .diagnostic(lastDiagnostic)
                .fault(FaultKind.WORKLOAD_FAILURE)
                .build();
    }

    /**
     * 센서 시작 → 워크로드 → 센서 정지. 워크로드 결과와 관계없이 센서는 항상 역순으로 정지된다.
     */
    private Attempt runAttempt(SessionKey key, Workload workload, Duration timeout) throws InterruptedException {
        SensorSuite.SamplingRun run = suite.startAll();
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "workload-" + key.testName());
            t.setDaemon(true);
            return t;
        });
        WorkloadResult result = null;
        String failure = null;
        long workloadStart;
        long workloadEnd;
        List<SensorReading> readings;
        try {
            workloadStart = clock.nanoTime();
            Future<WorkloadResult> future = executor.submit(() -> workload.run(timeout));
            try {
                result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (result == null) {
                    failure = "workload returned no result";
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                failure = "timed out after " + timeout.toMillis() + " ms";
            } catch (ExecutionException e) {
                failure = "workload raised " + e.getCause();
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            }
            workloadEnd = clock.nanoTime();
        } finally {
            readings = run.stopAll();
            executor.shutdownNow();
        }
        return new Attempt(result, failure, workloadStart, workloadEnd, readings, run.startedTypes());
    }

    private RepetitionRecord account(BaselineProfile baseline, int slot, int attempt, Attempt a) {
        Duration measuredWindow = Duration.ofNanos(a.workloadEnd() - a.workloadStart());
        Duration duration = a.result().getElapsed() != null ? a.result().getElapsed() : measuredWindow;
        OptionalLong usefulWork = a.result().usefulWorkCount();

        Set<FaultKind> faults = EnumSet.noneOf(FaultKind.class);
        MetricSet.Builder components = MetricSet.builder();
        Set<SensorType> accounted = EnumSet.noneOf(SensorType.class);

        for (SensorReading reading : a.readings()) {
            AccountingResult r = accounting.account(reading, duration);
            components.putAll(r.metrics());
            faults.addAll(r.faults());
            accounted.add(reading.type());
        }
        for (SensorType started : a.startedTypes()) {
            if (!accounted.contains(started)) {
                components.putAll(accounting.unavailableFor(started, "sensor did not stop cleanly"));
                faults.add(FaultKind.SENSOR_DEGRADED);
            }
        }
        for (SensorType inactive : suite.inactiveTypes()) {
            components.putAll(accounting.unavailableFor(inactive, "sensor unavailable: " + inactiveReason(inactive)));
            faults.add(FaultKind.SENSOR_UNAVAILABLE);
        }

        AccountingResult raw = accounting.derive(components.build(), duration, usefulWork);
        faults.addAll(raw.faults());
        MetricSet netComponents = BaselineSubtraction.subtract(raw.metrics(), duration, baseline);
        MetricSet net = accounting.derive(netComponents, duration, usefulWork).metrics();

        boolean partial = faults.contains(FaultKind.CLOCK_ANOMALY) || faults.contains(FaultKind.COUNTER_WRAP);
        if (faults.contains(FaultKind.CLOCK_ANOMALY)) {
            log.warn("[ACCOUNTING][CLOCK] repetition {} has non-positive duration {}, energy metrics suppressed",
                    slot, duration);
        }

        RepetitionRecord.RepetitionRecordBuilder builder = RepetitionRecord.builder()
                .index(slot)
                .attempts(attempt)
                .status(partial ? RepetitionStatus.PARTIAL : RepetitionStatus.OK)
                .duration(duration)
                .raw(raw.metrics())
                .net(net)
                .diagnostic(a.result().getDiagnostic())
                .faults(faults)
                .workloadStartNanos(a.workloadStart())
                .workloadEndNanos(a.workloadEnd());
        a.readings().forEach(r -> builder.sensorWindow(SensorWindow.of(r)));
        return builder.build();
    }

    private String inactiveReason(SensorType type) {
        return suite.all().stream()
                .filter(s -> s.type() == type)
                .map(Sensor::availabilityReason)
                .findFirst()
                .orElse("not configured");
    }

    private void finish(MeasurementSession session) {
        session.complete();
        transition(OrchestratorState.SESSION_COMPLETE);
        log.info("Session {} complete: {} ok / {} repetitions{}",
                session.key(), session.okRecords().size(), session.records().size(),
                session.isFailed() ? ", failed: " + session.failureReason() : "");
    }

    private void transition(OrchestratorState next) {
        log.debug("State {} -> {}", state, next);
        state = next;
        stateHistory.add(next);
    }

    private record Attempt(WorkloadResult result,
                           String failure,
                           long workloadStart,
                           long workloadEnd,
                           List<SensorReading> readings,
                           List<SensorType> startedTypes) {

        boolean succeeded() {
            return failure == null && result.isSuccess();
        }

        String failureDiagnostic() {
            if (failure != null) {
                return failure;
            }
            return result.getDiagnostic() != null ? result.getDiagnostic() : "workload reported failure";
        }
    }
}
