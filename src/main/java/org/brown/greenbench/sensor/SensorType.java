package org.brown.greenbench.sensor;

import org.brown.greenbench.model.Metric;

/**
 * 센서 종류. 선언 순서가 곧 시작 순서이며, 정지는 역순이다.
 */
public enum SensorType {

    SYSTEM_RESOURCE("system", Metric.Source.SYSTEM_RESOURCE),
    ACCELERATOR("accelerator", Metric.Source.ACCELERATOR),
    EXTERNAL_POWER("power-meter", Metric.Source.EXTERNAL_POWER);

    private final String id;
    private final Metric.Source metricSource;

    SensorType(String id, Metric.Source metricSource) {
        this.id = id;
        this.metricSource = metricSource;
    }

    public String id() {
        return id;
    }

    public Metric.Source metricSource() {
        return metricSource;
    }
}
