package org.brown.greenbench.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.sensor.AcceleratorSampler;
import org.brown.greenbench.sensor.ExternalPowerSampler;
import org.brown.greenbench.sensor.MonotonicClock;
import org.brown.greenbench.sensor.SensorSuite;
import org.brown.greenbench.sensor.SystemResourceSampler;
import org.brown.greenbench.sensor.probe.NetioPowerMeterClient;
import org.brown.greenbench.sensor.probe.NvidiaSmiProbe;
import org.brown.greenbench.sensor.probe.OsBeanSystemProbe;
import org.brown.greenbench.sensor.probe.PowerMeterClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * 센서 구성
 *
 * 가용성은 애플리케이션 시작 시 한 번만 판정한다.
 */
@Slf4j
@Configuration
public class SensorConfig {

    @Bean
    public MeasurementConfig measurementConfig(MeasurementProperties properties) {
        MeasurementConfig config = properties.toMeasurementConfig();
        log.info("Measurement config: interval={}ms, baseline={}s, repetitions={}, retryLimit={}, grid={} g/kWh",
                config.getSamplingInterval().toMillis(), config.getBaselineDuration().toMillis() / 1000.0,
                config.getRepetitions(), config.getRetryLimit(), config.getGridIntensityGPerKwh());
        return config;
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.SYSTEM;
    }

    @Bean
    public SensorSuite sensorSuite(MeasurementConfig config,
                                   MeasurementProperties properties,
                                   ObjectMapper objectMapper,
                                   MonotonicClock clock) {
        Duration interval = config.getSamplingInterval();
        Duration stopTimeout = config.getStopTimeout();
        MeasurementProperties.AcceleratorConfig accelerator = properties.getAccelerator();
        MeasurementProperties.PowerMeterConfig powerMeter = properties.getPowerMeter();

        PowerMeterClient powerMeterClient = config.isPowerMeterConfigured()
                ? new NetioPowerMeterClient(config.getPowerMeterEndpoint(), config.getPowerMeterOutputId(),
                        Duration.ofMillis(powerMeter.getRequestTimeoutMs()), objectMapper)
                : null;

        SensorSuite suite = new SensorSuite(List.of(
                new SystemResourceSampler(new OsBeanSystemProbe(), interval, stopTimeout, clock),
                new AcceleratorSampler(
                        new NvidiaSmiProbe(accelerator.getExecutable(), accelerator.getDeviceIndex(), Duration.ofSeconds(5)),
                        config.getAcceleratorEnabled(), interval, stopTimeout, clock),
                new ExternalPowerSampler(powerMeterClient, config.getPowerMeterMaxConsecutiveFailures(),
                        interval, stopTimeout, clock)
        ));
        log.info("Active sensors: {}, inactive: {}",
                suite.active().stream().map(s -> s.type().id()).toList(), suite.inactiveTypes());
        return suite;
    }
}
