package org.brown.greenbench.sensor;

/**
 * 센서 인터페이스
 *
 * 구현체는 고정된 집합(시스템 리소스, 가속기, 외부 전력계)이다.
 */
public interface Sensor {

    SensorType type();

    /**
     * 하드웨어/API 존재 여부. 생성 시 한 번 결정된다.
     */
    boolean isAvailable();

    /**
     * 가용하지 않을 때 그 사유
     */
    String availabilityReason();

    /**
     * 백그라운드 샘플링을 시작하고 즉시 반환한다.
     */
    void start();

    /**
     * 샘플링을 멈추고 루프 종료를 기다린 뒤 닫힌 버퍼를 반환한다.
     * 이 메서드가 반환된 이후에는 버퍼에 어떤 샘플도 추가되지 않는다.
     */
    SensorReading stop();

    boolean isRunning();
}
