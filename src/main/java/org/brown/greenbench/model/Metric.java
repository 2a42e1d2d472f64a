package org.brown.greenbench.model;

import java.util.Arrays;
import java.util.List;

/**
 * 측정 메트릭 정의
 *
 * 메트릭 이름(JSON 키), 단위, 출처 센서, 종류를 고정한다.
 * 같은 이름은 항상 같은 단위와 의미를 가진다.
 */
public enum Metric {

    DURATION_SECONDS("duration_seconds", "s", Source.RUN, Kind.TIME),

    CPU_USAGE_MEAN_PERCENT("cpu_usage_mean_percent", "%", Source.SYSTEM_RESOURCE, Kind.UTILIZATION),
    CPU_USAGE_PEAK_PERCENT("cpu_usage_peak_percent", "%", Source.SYSTEM_RESOURCE, Kind.UTILIZATION),
    RAM_USAGE_MEAN_MB("ram_usage_mean_mb", "MB", Source.SYSTEM_RESOURCE, Kind.MEMORY),
    RAM_USAGE_PEAK_MB("ram_usage_peak_mb", "MB", Source.SYSTEM_RESOURCE, Kind.MEMORY),
    CPU_ENERGY_JOULES("cpu_energy_joules", "J", Source.SYSTEM_RESOURCE, Kind.ENERGY),
    CPU_POWER_MEAN_WATTS("cpu_power_mean_watts", "W", Source.SYSTEM_RESOURCE, Kind.POWER),

    GPU_USAGE_MEAN_PERCENT("gpu_usage_mean_percent", "%", Source.ACCELERATOR, Kind.UTILIZATION),
    GPU_USAGE_PEAK_PERCENT("gpu_usage_peak_percent", "%", Source.ACCELERATOR, Kind.UTILIZATION),
    GPU_MEMORY_MEAN_MB("gpu_memory_mean_mb", "MB", Source.ACCELERATOR, Kind.MEMORY),
    GPU_MEMORY_PEAK_MB("gpu_memory_peak_mb", "MB", Source.ACCELERATOR, Kind.MEMORY),
    GPU_MEMORY_PEAK_PERCENT("gpu_memory_peak_percent", "%", Source.ACCELERATOR, Kind.MEMORY),
    GPU_TEMPERATURE_PEAK_CELSIUS("gpu_temperature_peak_celsius", "C", Source.ACCELERATOR, Kind.TEMPERATURE),
    GPU_POWER_MEAN_WATTS("gpu_power_mean_watts", "W", Source.ACCELERATOR, Kind.POWER),
    GPU_POWER_PEAK_WATTS("gpu_power_peak_watts", "W", Source.ACCELERATOR, Kind.POWER),
    GPU_ENERGY_JOULES("gpu_energy_joules", "J", Source.ACCELERATOR, Kind.ENERGY),

    SYSTEM_ENERGY_JOULES("system_energy_joules", "J", Source.EXTERNAL_POWER, Kind.ENERGY),
    SYSTEM_POWER_MEAN_WATTS("system_power_mean_watts", "W", Source.EXTERNAL_POWER, Kind.POWER),
    SYSTEM_POWER_PEAK_WATTS("system_power_peak_watts", "W", Source.EXTERNAL_POWER, Kind.POWER),

    TOTAL_ENERGY_JOULES("total_energy_joules", "J", Source.DERIVED, Kind.ENERGY),
    POWER_WATTS("power_watts", "W", Source.DERIVED, Kind.POWER),
    CARBON_GRAMS("carbon_grams", "gCO2e", Source.DERIVED, Kind.CARBON),
    CARBON_GRAMS_SYSTEM("carbon_grams_system", "gCO2e", Source.DERIVED, Kind.CARBON),
    ENERGY_EFFICIENCY("energy_efficiency", "work/J", Source.DERIVED, Kind.EFFICIENCY);

    /**
     * 메트릭을 만들어내는 주체
     */
    public enum Source {
        RUN,
        SYSTEM_RESOURCE,
        ACCELERATOR,
        EXTERNAL_POWER,
        DERIVED
    }

    public enum Kind {
        TIME,
        UTILIZATION,
        MEMORY,
        TEMPERATURE,
        POWER,
        ENERGY,
        CARBON,
        EFFICIENCY
    }

    private final String key;
    private final String unit;
    private final Source source;
    private final Kind kind;

    Metric(String key, String unit, Source source, Kind kind) {
        this.key = key;
        this.unit = unit;
        this.source = source;
        this.kind = kind;
    }

    public String key() {
        return key;
    }

    public String unit() {
        return unit;
    }

    public Source source() {
        return source;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * 시계 이상(duration <= 0) 시 무효화되는 에너지/전력 계열 여부
     */
    public boolean isEnergyFamily() {
        return kind == Kind.POWER || kind == Kind.ENERGY || kind == Kind.CARBON || kind == Kind.EFFICIENCY;
    }

    public static List<Metric> ofSource(Source source) {
        return Arrays.stream(values())
                .filter(m -> m.source == source)
                .toList();
    }

    public static Metric fromKey(String key) {
        for (Metric metric : values()) {
            if (metric.key.equals(key)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + key);
    }
}
