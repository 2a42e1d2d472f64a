package org.brown.greenbench.sensor;

/**
 * 단조 시계. 모든 샘플/윈도우 시각은 이 시계 기준이다.
 */
@FunctionalInterface
public interface MonotonicClock {

    MonotonicClock SYSTEM = System::nanoTime;

    long nanoTime();
}
