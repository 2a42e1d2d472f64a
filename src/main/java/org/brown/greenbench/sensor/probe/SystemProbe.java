package org.brown.greenbench.sensor.probe;

import org.brown.greenbench.sensor.SensorAvailability;
import org.brown.greenbench.sensor.SensorProbeException;

import java.util.OptionalDouble;

/**
 * 시스템 CPU/메모리(와 선택적 CPU 에너지 카운터) 프로브
 */
public interface SystemProbe {

    SensorAvailability detect();

    /**
     * 시스템 전체 CPU 사용률 (0~100). 아직 값이 없으면 empty.
     */
    OptionalDouble cpuUtilizationPercent() throws SensorProbeException;

    /**
     * 사용 중인 물리 메모리 (MB)
     */
    double usedMemoryMb() throws SensorProbeException;

    /**
     * 누적 CPU 에너지 카운터 (J). 지원하지 않으면 empty.
     */
    OptionalDouble energyCounterJoules() throws SensorProbeException;
}
