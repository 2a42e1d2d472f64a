package org.brown.greenbench.sensor;

/**
 * 하드웨어/API 프로브 호출 실패
 *
 * 샘플링 루프 안에서는 "드롭된 샘플"로 처리되며 오케스트레이터로 전파되지 않는다.
 */
public class SensorProbeException extends Exception {

    public SensorProbeException(String message) {
        super(message);
    }

    public SensorProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
