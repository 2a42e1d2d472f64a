package org.brown.greenbench.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MeasurementProperties Tests")
class MeasurementPropertiesTest {

    private static MeasurementProperties withIntensity(Double intensity) {
        MeasurementProperties properties = new MeasurementProperties();
        properties.getCarbon().setGridIntensityGPerKwh(intensity);
        return properties;
    }

    @Test
    @DisplayName("Should convert defaults into an orchestrator config")
    void testDefaults() {
        MeasurementConfig config = withIntensity(250.0).toMeasurementConfig();

        assertEquals(Duration.ofMillis(100), config.getSamplingInterval());
        assertEquals(Duration.ofSeconds(2), config.getStopTimeout());
        assertEquals(Duration.ofSeconds(5), config.getBaselineDuration());
        assertEquals(3, config.getRepetitions());
        assertEquals(3, config.getRetryLimit());
        assertEquals(250.0, config.getGridIntensityGPerKwh());
        assertEquals(Duration.ofSeconds(600), config.getDefaultWorkloadTimeout());
        assertNull(config.getAcceleratorEnabled());
        assertFalse(config.isPowerMeterConfigured());
    }

    @Test
    @DisplayName("Should reject a missing grid intensity")
    void testMissingIntensity() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> withIntensity(null).toMeasurementConfig());
        assertTrue(e.getMessage().contains("grid intensity"));
    }

    @Test
    @DisplayName("Should reject invalid repetition and retry counts")
    void testInvalidCounts() {
        MeasurementProperties noRepetitions = withIntensity(250.0);
        noRepetitions.setRepetitions(0);
        assertThrows(IllegalArgumentException.class, noRepetitions::toMeasurementConfig);

        MeasurementProperties noRetries = withIntensity(250.0);
        noRetries.setRetryLimit(0);
        assertThrows(IllegalArgumentException.class, noRetries::toMeasurementConfig);
    }

    @Test
    @DisplayName("Should reject a non-positive sampling interval and a negative intensity")
    void testInvalidValues() {
        MeasurementProperties zeroInterval = withIntensity(250.0);
        zeroInterval.getSampling().setIntervalMs(0);
        assertThrows(IllegalArgumentException.class, zeroInterval::toMeasurementConfig);

        assertThrows(IllegalArgumentException.class, () -> withIntensity(-1.0).toMeasurementConfig());
    }

    @Test
    @DisplayName("Should enable the power meter only when an endpoint is set")
    void testPowerMeterEndpoint() {
        MeasurementProperties properties = withIntensity(0.0);
        properties.getPowerMeter().setEndpoint("http://192.168.1.50/netio.json");
        properties.getBaseline().setDurationSeconds(0.5);

        MeasurementConfig config = properties.toMeasurementConfig();

        assertTrue(config.isPowerMeterConfigured());
        assertEquals(Duration.ofMillis(500), config.getBaselineDuration());
        assertEquals(0.0, config.getGridIntensityGPerKwh());
    }
}
