package org.brown.greenbench.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.aggregate.MeasurementOutcome;
import org.brown.greenbench.model.SessionKey;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 결과를 JSON 파일로 저장한다.
 *
 * 파일명: {instance}__{variant}__{test}_{yyyyMMdd_HHmmss}.json
 * 파일명에 쓸 수 없는 문자는 '_' 로 바꾼다. 같은 이름의 파일이 이미 있으면 덮어쓰지 않고
 * 일련번호(_1, _2, ...)를 붙인다.
 */
@Slf4j
public class JsonFileResultSink implements ResultSink {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private static final int MAX_NAME_COLLISIONS = 1000;

    private final ObjectWriter writer;
    private final Path outputDir;

    public JsonFileResultSink(ObjectMapper objectMapper, Path outputDir) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.outputDir = outputDir;
    }

    @Override
    public void accept(MeasurementOutcome outcome) {
        Instant timestamp = outcome.getMetadata() != null && outcome.getMetadata().getTimestamp() != null
                ? outcome.getMetadata().getTimestamp()
                : Instant.now();
        Path file = outputDir.resolve(fileName(outcome.getKey(), timestamp, 0));
        try {
            Files.createDirectories(outputDir);
            for (int seq = 1; ; seq++) {
                try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                    writer.writeValue(out, outcome);
                    break;
                } catch (FileAlreadyExistsException e) {
                    if (seq > MAX_NAME_COLLISIONS) {
                        throw e;
                    }
                    file = outputDir.resolve(fileName(outcome.getKey(), timestamp, seq));
                }
            }
            log.info("[SINK][FILE] {} written ({})", file, outcome.getStatus());
        } catch (IOException e) {
            log.error("[SINK][FILE][FAIL] Failed to write result for {} to {}", outcome.getKey(), file, e);
            throw new ResultPersistenceException("Failed to write result file " + file, e);
        }
    }

    static String fileName(SessionKey key, Instant timestamp) {
        return fileName(key, timestamp, 0);
    }

    /**
     * @param seq 같은 초에 같은 세션 결과가 이미 있으면 1부터 붙는 일련번호
     */
    static String fileName(SessionKey key, Instant timestamp, int seq) {
        return sanitize(key.instanceId()) + "__" + sanitize(key.variantId()) + "__" + sanitize(key.testName())
                + "_" + TIMESTAMP.format(timestamp) + (seq > 0 ? "_" + seq : "") + ".json";
    }

    private static String sanitize(String part) {
        return part.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
