package org.brown.greenbench.sensor.probe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RaplEnergyCounter Tests")
class RaplEnergyCounterTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Should prefer the package domain and read microjoules as joules")
    void testScanPrefersPackage() throws Exception {
        Path core = Files.createDirectories(root.resolve("intel-rapl:0:0"));
        Files.writeString(core.resolve("name"), "core\n");
        Files.writeString(core.resolve("energy_uj"), "5\n");
        Path pkg = Files.createDirectories(root.resolve("intel-rapl:0"));
        Files.writeString(pkg.resolve("name"), "package-0\n");
        Files.writeString(pkg.resolve("energy_uj"), "2500000\n");

        Optional<Path> found = RaplEnergyCounter.scan(root, true);
        assertTrue(found.isPresent());
        assertEquals(pkg.resolve("energy_uj"), found.get());
        assertEquals(2.5, new RaplEnergyCounter(found.get()).readJoules(), 1e-9);
    }

    @Test
    @DisplayName("Should find nothing in a directory without RAPL domains")
    void testScanEmpty() {
        assertTrue(RaplEnergyCounter.scan(root, false).isEmpty());
        assertTrue(RaplEnergyCounter.scan(root.resolve("missing"), false).isEmpty());
    }
}
