package org.brown.greenbench.sensor;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 세션에서 사용하는 센서 집합 (고정 순서)
 *
 * 시작 순서: 시스템 리소스 → 가속기 → 외부 전력계. 정지는 역순.
 * 가용하지 않은 센서는 시작/정지 순서에서 완전히 빠진다.
 */
@Slf4j
public class SensorSuite {

    private final List<Sensor> sensors;

    public SensorSuite(List<Sensor> sensors) {
        List<Sensor> ordered = new ArrayList<>(sensors);
        ordered.sort(Comparator.comparing(Sensor::type));
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).type() == ordered.get(i - 1).type()) {
                throw new IllegalArgumentException("Duplicate sensor type: " + ordered.get(i).type());
            }
        }
        this.sensors = List.copyOf(ordered);
    }

    public List<Sensor> all() {
        return sensors;
    }

    public List<Sensor> active() {
        return sensors.stream().filter(Sensor::isAvailable).toList();
    }

    /**
     * 이번 세션에서 측정하지 않는 센서 종류 (미구성 포함)
     */
    public Set<SensorType> inactiveTypes() {
        Set<SensorType> inactive = EnumSet.allOf(SensorType.class);
        active().forEach(s -> inactive.remove(s.type()));
        return inactive;
    }

    public boolean isMeasurable() {
        return !active().isEmpty();
    }

    /**
     * 가용 센서를 순서대로 시작한다. 도중에 실패하면 이미 시작한 센서를 역순으로 정지한 뒤 예외를 던진다.
     */
    public SamplingRun startAll() {
        List<Sensor> started = new ArrayList<>();
        try {
            for (Sensor sensor : active()) {
                sensor.start();
                started.add(sensor);
            }
        } catch (RuntimeException e) {
            new SamplingRun(started).stopAll();
            throw e;
        }
        return new SamplingRun(started);
    }

    /**
     * 시작된 센서 묶음. 정지는 역순이며 한 번만 수행된다.
     */
    public static final class SamplingRun implements AutoCloseable {

        private final List<Sensor> started;
        private List<SensorReading> readings;

        private SamplingRun(List<Sensor> started) {
            this.started = List.copyOf(started);
        }

        public List<SensorType> startedTypes() {
            return started.stream().map(Sensor::type).toList();
        }

        /**
         * 역순으로 정지하고 시작 순서대로 정렬된 결과를 돌려준다.
         */
        public List<SensorReading> stopAll() {
            if (readings != null) {
                return readings;
            }
            List<SensorReading> collected = new ArrayList<>();
            for (int i = started.size() - 1; i >= 0; i--) {
                Sensor sensor = started.get(i);
                try {
                    collected.add(0, sensor.stop());
                } catch (RuntimeException e) {
                    log.error("[SENSOR][STOP] failed to stop {}", sensor.type().id(), e);
                }
            }
            readings = List.copyOf(collected);
            return readings;
        }

        @Override
        public void close() {
            stopAll();
        }
    }
}
