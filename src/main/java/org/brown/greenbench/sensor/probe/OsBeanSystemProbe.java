package org.brown.greenbench.sensor.probe;

import org.brown.greenbench.sensor.SensorAvailability;
import org.brown.greenbench.sensor.SensorProbeException;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.OptionalDouble;

/**
 * JDK OperatingSystemMXBean 기반 시스템 프로브
 *
 * RAM 은 시스템 전체의 상주 메모리(MemTotal - MemAvailable)다. 워크로드는 별도 프로세스/컨테이너에서
 * 돌기 때문에 이 JVM 의 RSS 는 의미가 없다. 회수 가능한 페이지 캐시는 포함하지 않으며,
 * /proc/meminfo 가 없으면 OS bean 의 total - free 로 대신한다.
 * CPU 에너지는 RAPL 카운터가 있을 때만 제공한다.
 */
public class OsBeanSystemProbe implements SystemProbe {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    private static final Path MEMINFO = Paths.get("/proc/meminfo");

    private final OperatingSystemMXBean osBean;
    private final RaplEnergyCounter rapl;
    private final Path meminfo;

    public OsBeanSystemProbe() {
        this(ManagementFactory.getOperatingSystemMXBean(), RaplEnergyCounter.discover().orElse(null), MEMINFO);
    }

    public OsBeanSystemProbe(OperatingSystemMXBean osBean, RaplEnergyCounter rapl, Path meminfo) {
        this.osBean = osBean;
        this.rapl = rapl;
        this.meminfo = meminfo;
    }

    @Override
    public SensorAvailability detect() {
        if (!(osBean instanceof com.sun.management.OperatingSystemMXBean)) {
            return SensorAvailability.unavailable(
                    "OperatingSystemMXBean does not expose CPU load: " + osBean.getClass().getName());
        }
        return SensorAvailability.available(rapl != null
                ? "os-bean + RAPL " + rapl.energyPath()
                : "os-bean (no CPU energy counter)");
    }

    @Override
    public OptionalDouble cpuUtilizationPercent() {
        double load = sunBean().getCpuLoad();
        // 첫 호출 직후 등 값이 없으면 음수
        if (load < 0 || Double.isNaN(load)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(load * 100.0);
    }

    @Override
    public double usedMemoryMb() {
        OptionalDouble resident = residentMemoryMb(meminfo);
        if (resident.isPresent()) {
            return resident.getAsDouble();
        }
        com.sun.management.OperatingSystemMXBean bean = sunBean();
        long used = bean.getTotalMemorySize() - bean.getFreeMemorySize();
        return used / BYTES_PER_MB;
    }

    /**
     * /proc/meminfo 의 MemTotal - MemAvailable (kB) 를 MB 로. 파일이나 항목이 없으면 empty.
     */
    static OptionalDouble residentMemoryMb(Path meminfo) {
        if (meminfo == null || !Files.isReadable(meminfo)) {
            return OptionalDouble.empty();
        }
        long totalKb = -1;
        long availableKb = -1;
        try {
            for (String line : Files.readAllLines(meminfo, StandardCharsets.US_ASCII)) {
                if (line.startsWith("MemTotal:")) {
                    totalKb = kilobytes(line);
                } else if (line.startsWith("MemAvailable:")) {
                    availableKb = kilobytes(line);
                }
            }
        } catch (IOException | NumberFormatException e) {
            return OptionalDouble.empty();
        }
        if (totalKb < 0 || availableKb < 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.max(0, totalKb - availableKb) / 1024.0);
    }

    private static long kilobytes(String line) {
        // "MemAvailable:   12345678 kB"
        String[] parts = line.trim().split("\\s+");
        return Long.parseLong(parts[1]);
    }

    @Override
    public OptionalDouble energyCounterJoules() throws SensorProbeException {
        if (rapl == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(rapl.readJoules());
    }

    private com.sun.management.OperatingSystemMXBean sunBean() {
        return (com.sun.management.OperatingSystemMXBean) osBean;
    }
}
