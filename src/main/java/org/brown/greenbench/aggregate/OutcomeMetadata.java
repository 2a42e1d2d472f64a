package org.brown.greenbench.aggregate;

import lombok.Builder;
import lombok.Value;
import org.brown.greenbench.model.FaultKind;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@Value
@Builder
public class OutcomeMetadata {

    Instant timestamp;

    double gridIntensityGPerKwh;

    long samplingIntervalMs;

    double baselineDurationSeconds;

    int repetitionsRequested;

    int repetitionsOk;

    int retryLimit;

    List<String> activeSensors;

    Set<FaultKind> sessionFaults;
}
