package org.brown.greenbench.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 측정 설정 프로퍼티
 *
 * application.yml 의 measurement.* 설정을 바인딩
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "measurement")
public class MeasurementProperties {

    @Valid
    private SamplingConfig sampling = new SamplingConfig();
    @Valid
    private BaselineConfig baseline = new BaselineConfig();
    @Valid
    private CarbonConfig carbon = new CarbonConfig();
    private AcceleratorConfig accelerator = new AcceleratorConfig();
    @Valid
    private PowerMeterConfig powerMeter = new PowerMeterConfig();
    @Valid
    private WorkloadConfig workload = new WorkloadConfig();
    private SinkConfig sink = new SinkConfig();
    private DockerConfig docker = new DockerConfig();

    @Min(1)
    private int repetitions = 3;

    /**
     * 반복 슬롯 1개당 최대 시도 횟수
     */
    @Min(1)
    private int retryLimit = 3;

    @Data
    public static class SamplingConfig {
        @Min(1)
        private long intervalMs = 100;
        @Min(1)
        private long stopTimeoutMs = 2000;
    }

    @Data
    public static class BaselineConfig {
        @PositiveOrZero
        private double durationSeconds = 5;
    }

    @Data
    public static class CarbonConfig {
        @NotNull
        @PositiveOrZero
        private Double gridIntensityGPerKwh;
    }

    @Data
    public static class AcceleratorConfig {
        /**
         * 미설정 = 자동 감지, false = 비활성화
         */
        private Boolean enabled;
        private int deviceIndex = 0;
        private String executable = "nvidia-smi";
    }

    @Data
    public static class PowerMeterConfig {
        /**
         * NETIO JSON API URL (예: http://192.168.1.50/netio.json). 미설정 시 비활성화
         */
        private String endpoint;
        private int outputId = 1;
        @Min(1)
        private int maxConsecutiveFailures = 3;
        @Min(1)
        private long requestTimeoutMs = 1000;
    }

    @Data
    public static class WorkloadConfig {
        @Min(1)
        private long defaultTimeoutSeconds = 600;
    }

    @Data
    public static class SinkConfig {
        private FileSinkConfig file = new FileSinkConfig();
        private RedisSinkConfig redis = new RedisSinkConfig();
    }

    @Data
    public static class FileSinkConfig {
        private boolean enabled = true;
        private String outputDir = "results";
    }

    @Data
    public static class RedisSinkConfig {
        private boolean enabled = false;
        private String host = "127.0.0.1";
        private int port = 6379;
        private String password = "";
        private String channelPrefix = "measurement:";
    }

    @Data
    public static class DockerConfig {
        private boolean enabled = false;
        private String workDir = "/workspace";
    }

    /**
     * 오케스트레이터용 불변 설정으로 변환 (검증 포함)
     */
    public MeasurementConfig toMeasurementConfig() {
        return MeasurementConfig.builder()
                .samplingInterval(Duration.ofMillis(sampling.getIntervalMs()))
                .stopTimeout(Duration.ofMillis(sampling.getStopTimeoutMs()))
                .baselineDuration(Duration.ofMillis(Math.round(baseline.getDurationSeconds() * 1000)))
                .repetitions(repetitions)
                .retryLimit(retryLimit)
                .gridIntensityGPerKwh(carbon.getGridIntensityGPerKwh())
                .acceleratorEnabled(accelerator.getEnabled())
                .powerMeterEndpoint(powerMeter.getEndpoint())
                .powerMeterOutputId(powerMeter.getOutputId())
                .powerMeterMaxConsecutiveFailures(powerMeter.getMaxConsecutiveFailures())
                .defaultWorkloadTimeout(Duration.ofSeconds(workload.getDefaultTimeoutSeconds()))
                .build()
                .validate();
    }
}
