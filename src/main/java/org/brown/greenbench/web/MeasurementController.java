package org.brown.greenbench.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.aggregate.MeasurementOutcome;
import org.brown.greenbench.config.MeasurementConfig;
import org.brown.greenbench.model.SessionKey;
import org.brown.greenbench.sensor.Sensor;
import org.brown.greenbench.sensor.SensorSuite;
import org.brown.greenbench.service.MeasurementService;
import org.brown.greenbench.sink.ResultPersistenceException;
import org.brown.greenbench.workload.Workload;
import org.brown.greenbench.workload.WorkloadFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 측정 API
 *
 * 엔드포인트:
 * - POST /measurements: 세션 1건 실행 (동기, 세션은 직렬 실행)
 * - GET /health: 간단한 헬스체크
 * - GET /status: 센서 가용성과 유효 설정
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class MeasurementController {

    private final MeasurementService measurementService;
    private final WorkloadFactory workloadFactory;
    private final SensorSuite sensorSuite;
    private final MeasurementConfig config;

    @PostMapping("/measurements")
    public MeasurementOutcome measure(@Valid @RequestBody MeasurementRequest request) {
        SessionKey key = new SessionKey(request.getInstanceId(), request.getVariantId(), request.getTestName());
        Workload workload = workloadFactory.create(
                request.getCommand(), request.getWorkingDir(), request.getContainerId(), request.getUsefulWork());
        Duration timeout = request.getTimeoutSeconds() != null ? Duration.ofSeconds(request.getTimeoutSeconds()) : null;

        log.info("Measurement requested: {}", key);
        return measurementService.measure(key, workload, timeout);
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("application", "GreenBench Measurement Agent");
        status.put("busy", measurementService.isBusy());
        if (measurementService.currentSession() != null) {
            status.put("currentSession", measurementService.currentSession().toString());
        }

        Map<String, Object> sensors = new LinkedHashMap<>();
        for (Sensor sensor : sensorSuite.all()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("available", sensor.isAvailable());
            info.put("reason", sensor.availabilityReason());
            sensors.put(sensor.type().id(), info);
        }
        status.put("sensors", sensors);

        Map<String, Object> measurement = new LinkedHashMap<>();
        measurement.put("samplingIntervalMs", config.getSamplingInterval().toMillis());
        measurement.put("baselineDurationSeconds", config.getBaselineDuration().toMillis() / 1000.0);
        measurement.put("repetitions", config.getRepetitions());
        measurement.put("retryLimit", config.getRetryLimit());
        measurement.put("gridIntensityGPerKwh", config.getGridIntensityGPerKwh());
        measurement.put("powerMeterEndpoint", maskSensitiveUrl(config.getPowerMeterEndpoint()));
        status.put("measurement", measurement);

        MeasurementOutcome last = measurementService.lastOutcome();
        if (last != null) {
            status.put("lastOutcome", Map.of("session", last.getKey().toString(), "status", last.getStatus()));
        }

        log.debug("Status check requested");
        return status;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("[FAIL][REQUEST] {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ResultPersistenceException.class)
    public ResponseEntity<Map<String, String>> persistenceFailed(ResultPersistenceException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }

    /**
     * 민감한 URL 마스킹 (호스트까지만 노출)
     */
    private String maskSensitiveUrl(String url) {
        if (url == null || url.isBlank()) return "N/A";
        int schemeEnd = url.indexOf("://");
        int pathStart = url.indexOf('/', schemeEnd >= 0 ? schemeEnd + 3 : 0);
        if (pathStart > 0) {
            return url.substring(0, pathStart + 1) + "***";
        }
        return url;
    }
}
