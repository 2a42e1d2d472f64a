package org.brown.greenbench.orchestrator;

import org.brown.greenbench.config.MeasurementConfig;
import org.brown.greenbench.model.BaselineProfile;
import org.brown.greenbench.model.FaultKind;
import org.brown.greenbench.model.SessionKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * (instance, variant, test) 1건의 측정 세션
 *
 * 기준선 1회 + 반복 N회. 오케스트레이터만 변경하며, 완료 후 집계기에 넘겨진다.
 */
public class MeasurementSession {

    private final SessionKey key;
    private final MeasurementConfig config;
    private final List<String> activeSensors;
    private final Instant startedAt;
    private final List<RepetitionRecord> records = new ArrayList<>();
    private final Set<FaultKind> sessionFaults = EnumSet.noneOf(FaultKind.class);

    private BaselineProfile baseline;
    private String failureReason;
    private Instant finishedAt;

    MeasurementSession(SessionKey key, MeasurementConfig config, List<String> activeSensors) {
        this.key = key;
        this.config = config;
        this.activeSensors = List.copyOf(activeSensors);
        this.startedAt = Instant.now();
    }

    public SessionKey key() {
        return key;
    }

    public MeasurementConfig config() {
        return config;
    }

    public List<String> activeSensors() {
        return activeSensors;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public BaselineProfile baseline() {
        return baseline;
    }

    public List<RepetitionRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public List<RepetitionRecord> okRecords() {
        return records.stream().filter(RepetitionRecord::isOk).toList();
    }

    public Set<FaultKind> sessionFaults() {
        return Collections.unmodifiableSet(sessionFaults);
    }

    /**
     * 세션 전체 실패 사유. 실패하지 않았으면 null.
     */
    public String failureReason() {
        return failureReason;
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public boolean isComplete() {
        return finishedAt != null;
    }

    void baseline(BaselineProfile baseline) {
        this.baseline = baseline;
    }

    void addRecord(RepetitionRecord record) {
        records.add(record);
    }

    void addFault(FaultKind fault) {
        sessionFaults.add(fault);
    }

    void fail(FaultKind fault, String reason) {
        sessionFaults.add(fault);
        fail(reason);
    }

    void fail(String reason) {
        if (failureReason == null) {
            failureReason = reason;
        }
    }

    void complete() {
        finishedAt = Instant.now();
    }
}
