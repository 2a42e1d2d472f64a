package org.brown.greenbench.aggregate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.model.Metric;
import org.brown.greenbench.model.MetricSet;
import org.brown.greenbench.model.MetricStatus;
import org.brown.greenbench.model.MetricValue;
import org.brown.greenbench.model.RepetitionStatus;
import org.brown.greenbench.orchestrator.MeasurementSession;
import org.brown.greenbench.orchestrator.RepetitionRecord;
import org.brown.greenbench.sink.ResultSink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 완료된 세션을 통계로 집계해 싱크에 정확히 한 번 넘긴다.
 *
 * - 통계는 OK 반복만 사용 (FAILED/PARTIAL 은 진단용으로만 남김)
 * - OK 반복이 하나도 없거나 세션 자체가 실패했으면 FAILED 결과
 */
@Slf4j
@RequiredArgsConstructor
public class ResultAggregator {

    private final ResultSink sink;

    /**
     * 집계 후 싱크로 전달한다.
     */
    public MeasurementOutcome publish(MeasurementSession session) {
        MeasurementOutcome outcome = aggregate(session);
        sink.accept(outcome);
        log.info("Outcome for {} handed to sink: {}", session.key(), outcome.getStatus());
        return outcome;
    }

    public MeasurementOutcome aggregate(MeasurementSession session) {
        if (!session.isComplete()) {
            throw new IllegalStateException("Session " + session.key() + " is not complete");
        }
        List<RepetitionRecord> ok = session.okRecords();

        String failureReason = null;
        if (session.isFailed()) {
            failureReason = session.failureReason();
        } else if (ok.isEmpty()) {
            failureReason = describeNoSuccess(session.records());
        }
        OutcomeStatus status = failureReason == null ? OutcomeStatus.SUCCESS : OutcomeStatus.FAILED;
        if (status == OutcomeStatus.FAILED) {
            log.warn("[FAIL][SESSION] {}: {}", session.key(), failureReason);
        }

        OutcomeMetadata metadata = OutcomeMetadata.builder()
                .timestamp(Instant.now())
                .gridIntensityGPerKwh(session.config().getGridIntensityGPerKwh())
                .samplingIntervalMs(session.config().getSamplingInterval().toMillis())
                .baselineDurationSeconds(session.config().getBaselineDuration().toMillis() / 1000.0)
                .repetitionsRequested(session.config().getRepetitions())
                .repetitionsOk(ok.size())
                .retryLimit(session.config().getRetryLimit())
                .activeSensors(session.activeSensors())
                .sessionFaults(session.sessionFaults())
                .build();

        return MeasurementOutcome.builder()
                .key(session.key())
                .status(status)
                .failureReason(failureReason)
                .baseline(session.baseline())
                .aggregated(status == OutcomeStatus.SUCCESS ? summarize(ok, RepetitionRecord::getNet) : Map.of())
                .aggregatedRaw(status == OutcomeStatus.SUCCESS ? summarize(ok, RepetitionRecord::getRaw) : Map.of())
                .repetitions(session.records().stream().map(RepetitionSummary::of).toList())
                .metadata(metadata)
                .build();
    }

    /**
     * 메트릭별 통계. 일부 반복에서만 값이 있으면 PARTIAL, 전부 없으면 UNAVAILABLE.
     */
    static Map<String, MetricSummary> summarize(List<RepetitionRecord> records,
                                                Function<RepetitionRecord, MetricSet> selector) {
        Map<String, MetricSummary> result = new LinkedHashMap<>();
        for (Metric metric : Metric.values()) {
            List<Double> values = new ArrayList<>();
            boolean seen = false;
            boolean partialValue = false;
            String note = null;
            for (RepetitionRecord record : records) {
                MetricValue v = selector.apply(record).get(metric).orElse(null);
                if (v == null) {
                    continue;
                }
                seen = true;
                if (v.isAvailable()) {
                    values.add(v.value());
                    partialValue |= v.status() == MetricStatus.PARTIAL;
                }
                if (note == null && v.note() != null) {
                    note = v.note();
                }
            }
            if (!seen) {
                continue;
            }
            if (values.isEmpty()) {
                result.put(metric.key(), MetricSummary.unavailable(note));
            } else if (values.size() < records.size() || partialValue) {
                result.put(metric.key(), MetricSummary.of(values, MetricStatus.PARTIAL, note));
            } else {
                result.put(metric.key(), MetricSummary.of(values, MetricStatus.OK, null));
            }
        }
        return result;
    }

    private static String describeNoSuccess(List<RepetitionRecord> records) {
        long failed = records.stream().filter(r -> r.getStatus() == RepetitionStatus.FAILED).count();
        long partial = records.stream().filter(r -> r.getStatus() == RepetitionStatus.PARTIAL).count();
        return "no successful repetition (" + failed + " failed, " + partial + " partial)";
    }
}
