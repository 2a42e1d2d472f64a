package org.brown.greenbench.sensor.probe;

import org.brown.greenbench.sensor.SensorAvailability;
import org.brown.greenbench.sensor.SensorProbeException;

/**
 * 가속기(GPU) 프로브
 */
public interface AcceleratorProbe {

    /**
     * 장치 감지. 생성 시점에 한 번 호출된다.
     */
    SensorAvailability detect();

    AcceleratorSnapshot read() throws SensorProbeException;
}
