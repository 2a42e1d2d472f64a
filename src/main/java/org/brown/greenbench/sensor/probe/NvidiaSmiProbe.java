package org.brown.greenbench.sensor.probe;

import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.sensor.SensorAvailability;
import org.brown.greenbench.sensor.SensorProbeException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * nvidia-smi 기반 가속기 프로브
 *
 * 조회 1회 = nvidia-smi 프로세스 1회 실행.
 * 미지원 항목([N/A], [Not Supported])은 null 로 둔다.
 */
@Slf4j
public class NvidiaSmiProbe implements AcceleratorProbe {

    private static final String QUERY = "utilization.gpu,memory.used,memory.total,temperature.gpu,power.draw";

    private final String executable;
    private final int deviceIndex;
    private final Duration timeout;

    public NvidiaSmiProbe(int deviceIndex) {
        this("nvidia-smi", deviceIndex, Duration.ofSeconds(5));
    }

    public NvidiaSmiProbe(String executable, int deviceIndex, Duration timeout) {
        this.executable = executable;
        this.deviceIndex = deviceIndex;
        this.timeout = timeout;
    }

    @Override
    public SensorAvailability detect() {
        try {
            ExecResult res = exec(List.of(executable, "-L"));
            if (res.exitCode() != 0) {
                return SensorAvailability.unavailable("nvidia-smi -L exited with " + res.exitCode());
            }
            List<String> gpus = res.stdout().lines()
                    .filter(l -> l.startsWith("GPU "))
                    .toList();
            if (gpus.size() <= deviceIndex) {
                return SensorAvailability.unavailable("no accelerator at index " + deviceIndex);
            }
            return SensorAvailability.available(gpus.get(deviceIndex).trim());
        } catch (IOException | SensorProbeException e) {
            return SensorAvailability.unavailable("nvidia-smi not usable: " + e.getMessage());
        }
    }

    @Override
    public AcceleratorSnapshot read() throws SensorProbeException {
        try {
            ExecResult res = exec(List.of(
                    executable,
                    "--query-gpu=" + QUERY,
                    "--format=csv,noheader,nounits",
                    "--id=" + deviceIndex
            ));
            if (res.exitCode() != 0) {
                throw new SensorProbeException("nvidia-smi query failed (exit " + res.exitCode() + "): " + res.stderr());
            }
            return parseLine(res.stdout().trim());
        } catch (IOException e) {
            throw new SensorProbeException("nvidia-smi query failed", e);
        }
    }

    /**
     * "45, 1024, 16384, 60, 75.30" 형태의 CSV 한 줄을 해석한다.
     */
    static AcceleratorSnapshot parseLine(String line) throws SensorProbeException {
        String[] parts = line.split(",");
        if (parts.length < 3) {
            throw new SensorProbeException("Unexpected nvidia-smi output: " + line);
        }
        Double utilization = parseOptional(parts[0]);
        Double memUsed = parseOptional(parts[1]);
        Double memTotal = parseOptional(parts[2]);
        if (utilization == null || memUsed == null || memTotal == null) {
            throw new SensorProbeException("Missing mandatory accelerator fields: " + line);
        }
        Double temperature = parts.length > 3 ? parseOptional(parts[3]) : null;
        Double power = parts.length > 4 ? parseOptional(parts[4]) : null;
        return new AcceleratorSnapshot(utilization, memUsed, memTotal, temperature, power);
    }

    private static Double parseOptional(String raw) {
        String v = raw.trim();
        if (v.isEmpty() || v.startsWith("[")) {
            return null;
        }
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private ExecResult exec(List<String> cmd) throws IOException, SensorProbeException {
        Process p = new ProcessBuilder(cmd).start();
        try {
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                throw new SensorProbeException("Command timed out: " + String.join(" ", cmd));
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SensorProbeException("Interrupted while waiting for " + cmd.get(0), e);
        }
        return new ExecResult(p.exitValue(), readAll(p.getInputStream()), readAll(p.getErrorStream()));
    }

    private static String readAll(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private record ExecResult(int exitCode, String stdout, String stderr) {
    }
}
