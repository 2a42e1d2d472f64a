package org.brown.greenbench.sensor.probe;

import org.brown.greenbench.sensor.SensorProbeException;

/**
 * 네트워크로 접근하는 외부 전력계
 */
public interface PowerMeterClient {

    String endpoint();

    PowerMeterSnapshot poll() throws SensorProbeException;
}
