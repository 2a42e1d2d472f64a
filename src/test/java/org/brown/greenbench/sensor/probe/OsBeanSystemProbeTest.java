package org.brown.greenbench.sensor.probe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OsBeanSystemProbe Tests")
class OsBeanSystemProbeTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should count resident memory as total minus available, excluding page cache")
    void testResidentMemory() throws IOException {
        Path meminfo = Files.writeString(tempDir.resolve("meminfo"), """
                MemTotal:       16384000 kB
                MemFree:         1024000 kB
                MemAvailable:   12288000 kB
                Buffers:          512000 kB
                Cached:         10240000 kB
                """);

        OptionalDouble used = OsBeanSystemProbe.residentMemoryMb(meminfo);

        assertEquals(4000.0, used.getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("Should fall back when meminfo is missing or lacks MemAvailable")
    void testMissingMeminfo() throws IOException {
        assertTrue(OsBeanSystemProbe.residentMemoryMb(tempDir.resolve("absent")).isEmpty());

        Path old = Files.writeString(tempDir.resolve("meminfo-old"), "MemTotal: 1000 kB\nMemFree: 10 kB\n");
        assertTrue(OsBeanSystemProbe.residentMemoryMb(old).isEmpty());

        OsBeanSystemProbe probe = new OsBeanSystemProbe(
                ManagementFactory.getOperatingSystemMXBean(), null, tempDir.resolve("absent"));
        assertTrue(probe.usedMemoryMb() > 0);
    }
}
