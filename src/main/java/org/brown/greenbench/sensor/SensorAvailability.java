package org.brown.greenbench.sensor;

/**
 * 생성 시점에 한 번 결정되는 센서 가용 여부
 */
public record SensorAvailability(boolean available, String reason) {

    public static SensorAvailability available(String reason) {
        return new SensorAvailability(true, reason);
    }

    public static SensorAvailability unavailable(String reason) {
        return new SensorAvailability(false, reason);
    }
}
