package org.brown.greenbench.workload;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProcessWorkload Tests")
class ProcessWorkloadTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should succeed on exit code zero and keep output as diagnostic")
    void testSuccess() throws Exception {
        WorkloadResult result = new ProcessWorkload("echo 4 passed", tempDir, 4L).run(TIMEOUT);

        assertTrue(result.isSuccess());
        assertEquals("4 passed", result.getDiagnostic());
        assertEquals(4L, result.usefulWorkCount().getAsLong());
        assertNotNull(result.getElapsed());
        assertFalse(result.getElapsed().isNegative());
    }

    @Test
    @DisplayName("Should fail on a non-zero exit code without reporting useful work")
    void testNonZeroExit() throws Exception {
        WorkloadResult result = new ProcessWorkload("echo boom >&2; exit 3", tempDir, 4L).run(TIMEOUT);

        assertFalse(result.isSuccess());
        assertTrue(result.getDiagnostic().startsWith("exit code 3"));
        assertTrue(result.getDiagnostic().contains("boom"));
        assertTrue(result.usefulWorkCount().isEmpty());
    }

    @Test
    @DisplayName("Should kill the process and fail when the timeout elapses")
    void testTimeout() throws Exception {
        long start = System.nanoTime();
        WorkloadResult result = new ProcessWorkload("sleep 5", tempDir, null).run(Duration.ofMillis(200));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertFalse(result.isSuccess());
        assertEquals("timed out after 200 ms", result.getDiagnostic());
        assertTrue(elapsedMs < 4_000);
    }

    @Test
    @DisplayName("Should kill processes started by the shell when the timeout elapses")
    void testTimeoutKillsDescendants() throws Exception {
        String marker = "37." + System.nanoTime() % 100_000;
        WorkloadResult result = new ProcessWorkload("sleep " + marker + "; true", tempDir, null)
                .run(Duration.ofMillis(300));

        assertFalse(result.isSuccess());
        long deadline = System.nanoTime() + 2_000_000_000L;
        while (sleepAlive(marker) && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertFalse(sleepAlive(marker), "no child of the timed out shell may survive");
    }

    private static boolean sleepAlive(String marker) {
        return ProcessHandle.allProcesses()
                .filter(ProcessHandle::isAlive)
                .anyMatch(p -> p.info().commandLine().map(c -> c.contains("sleep " + marker)).orElse(false)
                        || p.info().arguments().map(a -> List.of(a).contains(marker)).orElse(false));
    }

    @Test
    @DisplayName("Should run in the given working directory")
    void testWorkingDirectory() throws Exception {
        WorkloadResult result = new ProcessWorkload(List.of("pwd"), tempDir, null).run(TIMEOUT);

        assertTrue(result.isSuccess());
        assertEquals(tempDir.toRealPath().toString(), result.getDiagnostic());
    }

    @Test
    @DisplayName("Should keep only the tail of long output")
    void testDiagnosticTail() throws Exception {
        WorkloadResult result = new ProcessWorkload("yes x | head -n 5000 | tr -d '\\n'; echo END", tempDir, null)
                .run(TIMEOUT);

        assertTrue(result.isSuccess());
        assertTrue(result.getDiagnostic().length() <= ProcessWorkload.DIAGNOSTIC_TAIL_CHARS);
        assertTrue(result.getDiagnostic().endsWith("END"));
    }

    @Test
    @DisplayName("Should reject an empty command")
    void testEmptyCommand() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessWorkload(List.of(), tempDir, null));
    }
}
