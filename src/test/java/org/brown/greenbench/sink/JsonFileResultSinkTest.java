package org.brown.greenbench.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.brown.greenbench.aggregate.MeasurementOutcome;
import org.brown.greenbench.aggregate.MetricSummary;
import org.brown.greenbench.aggregate.OutcomeMetadata;
import org.brown.greenbench.aggregate.OutcomeStatus;
import org.brown.greenbench.config.JacksonConfig;
import org.brown.greenbench.model.MetricStatus;
import org.brown.greenbench.model.SessionKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonFileResultSink Tests")
class JsonFileResultSinkTest {

    private static final Instant TIMESTAMP = Instant.parse("2024-05-01T12:34:56Z");

    private final ObjectMapper objectMapper = JacksonConfig.newObjectMapper();

    @TempDir
    Path tempDir;

    private static MeasurementOutcome outcome(SessionKey key) {
        return MeasurementOutcome.builder()
                .key(key)
                .status(OutcomeStatus.SUCCESS)
                .aggregated(Map.of("cpu_energy_joules", MetricSummary.of(List.of(1.0, 3.0), MetricStatus.OK, null),
                        "gpu_energy_joules", MetricSummary.unavailable("sensor unavailable")))
                .metadata(OutcomeMetadata.builder().timestamp(TIMESTAMP).gridIntensityGPerKwh(250.0).build())
                .build();
    }

    @Test
    @DisplayName("Should build the file name from the session key and UTC timestamp")
    void testFileName() {
        assertEquals("a__b__c_20240501_123456.json",
                JsonFileResultSink.fileName(new SessionKey("a", "b", "c"), TIMESTAMP));
        assertEquals("astropy-12907__baseline__test_sep_1__20240501_123456.json",
                JsonFileResultSink.fileName(new SessionKey("astropy-12907", "baseline", "test_sep[1]"), TIMESTAMP));
        assertEquals("a_b__v1__tests_x.py__t_20240501_123456.json",
                JsonFileResultSink.fileName(new SessionKey("a/b", "v1", "tests/x.py::t"), TIMESTAMP));
    }

    @Test
    @DisplayName("Should write the outcome as JSON with unavailable metrics carrying a null mean")
    void testWritesJson() throws IOException {
        Path outDir = tempDir.resolve("results");
        JsonFileResultSink sink = new JsonFileResultSink(objectMapper, outDir);

        sink.accept(outcome(new SessionKey("inst", "var", "test")));

        Path file = outDir.resolve("inst__var__test_20240501_123456.json");
        assertTrue(Files.exists(file));
        JsonNode root = objectMapper.readTree(file.toFile());
        assertEquals("SUCCESS", root.get("status").asText());
        assertEquals("inst", root.get("key").get("instanceId").asText());
        assertEquals(2.0, root.get("aggregated").get("cpu_energy_joules").get("mean").asDouble(), 1e-9);
        JsonNode gpu = root.get("aggregated").get("gpu_energy_joules");
        assertTrue(gpu.has("mean"));
        assertTrue(gpu.get("mean").isNull());
        assertEquals("UNAVAILABLE", gpu.get("status").asText());
        assertEquals("2024-05-01T12:34:56Z", root.get("metadata").get("timestamp").asText());
    }

    @Test
    @DisplayName("Should keep an earlier outcome of the same session written within the same second")
    void testNoOverwriteWithinSameSecond() throws IOException {
        JsonFileResultSink sink = new JsonFileResultSink(objectMapper, tempDir);
        SessionKey key = new SessionKey("inst", "var", "test");

        sink.accept(outcome(key));
        sink.accept(MeasurementOutcome.builder()
                .key(key)
                .status(OutcomeStatus.FAILED)
                .failureReason("no successful repetition (3 failed, 0 partial)")
                .metadata(OutcomeMetadata.builder().timestamp(TIMESTAMP).build())
                .build());

        JsonNode first = objectMapper.readTree(tempDir.resolve("inst__var__test_20240501_123456.json").toFile());
        JsonNode second = objectMapper.readTree(tempDir.resolve("inst__var__test_20240501_123456_1.json").toFile());
        assertEquals("SUCCESS", first.get("status").asText());
        assertEquals("FAILED", second.get("status").asText());
    }

    @Test
    @DisplayName("Should raise a persistence error when the output directory cannot be created")
    void testPersistenceFailure() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        JsonFileResultSink sink = new JsonFileResultSink(objectMapper, blocker.resolve("results"));

        ResultPersistenceException e = assertThrows(ResultPersistenceException.class,
                () -> sink.accept(outcome(new SessionKey("inst", "var", "test"))));
        assertNotNull(e.getCause());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }
}
