package org.brown.greenbench.sensor.probe;

import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.sensor.SensorProbeException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Linux powercap(RAPL) 누적 에너지 카운터 리더
 *
 * package 도메인을 우선 선택한다. 카운터는 max_energy_range_uj 에서 0으로 되돌아가며,
 * 그 판단은 호출자(회계 단계)가 한다.
 */
@Slf4j
public final class RaplEnergyCounter {

    private static final String[] ROOTS = {"/sys/class/powercap", "/sys/devices/virtual/powercap"};

    private final Path energyPath;

    RaplEnergyCounter(Path energyPath) {
        this.energyPath = energyPath;
    }

    public static Optional<RaplEnergyCounter> discover() {
        for (boolean packageOnly : new boolean[]{true, false}) {
            for (String root : ROOTS) {
                Optional<Path> found = scan(Paths.get(root), packageOnly);
                if (found.isPresent()) {
                    log.info("RAPL energy counter: {}", found.get());
                    return found.map(RaplEnergyCounter::new);
                }
            }
        }
        log.info("No readable RAPL energy counter, CPU energy will be unavailable");
        return Optional.empty();
    }

    static Optional<Path> scan(Path root, boolean packageOnly) {
        if (!Files.isDirectory(root)) {
            return Optional.empty();
        }
        try (DirectoryStream<Path> domains = Files.newDirectoryStream(root, "intel-rapl*")) {
            for (Path domain : domains) {
                Path energy = domain.resolve("energy_uj");
                if (!Files.isReadable(energy)) {
                    continue;
                }
                if (!packageOnly || isPackageDomain(domain)) {
                    return Optional.of(energy);
                }
            }
        } catch (IOException | SecurityException e) {
            log.debug("Cannot scan {}", root, e);
        }
        return Optional.empty();
    }

    private static boolean isPackageDomain(Path domain) {
        Path name = domain.resolve("name");
        if (!Files.isReadable(name)) {
            return false;
        }
        try {
            return Files.readString(name, StandardCharsets.US_ASCII).trim().toLowerCase().contains("package");
        } catch (IOException e) {
            return false;
        }
    }

    public Path energyPath() {
        return energyPath;
    }

    public double readJoules() throws SensorProbeException {
        try {
            String raw = Files.readString(energyPath, StandardCharsets.US_ASCII).trim();
            return Long.parseLong(raw) / 1_000_000.0;
        } catch (IOException | NumberFormatException e) {
            throw new SensorProbeException("Failed to read " + energyPath, e);
        }
    }
}
