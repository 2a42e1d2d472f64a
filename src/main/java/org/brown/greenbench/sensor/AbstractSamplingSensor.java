package org.brown.greenbench.sensor;

import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.model.MetricKind;
import org.brown.greenbench.model.Sample;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 주기 백그라운드 샘플링 루프
 *
 * start() 마다 새 버퍼와 새 스레드를 만들고, stop() 은 루프가 끝난 것을 확인(join)한 뒤
 * 버퍼를 닫는다. 루프가 stop 타임아웃 안에 끝나지 않아도 버퍼는 닫히므로
 * stop() 반환 이후의 쓰기는 버퍼가 거부한다.
 *
 * 정지 신호를 받으면 종료 샘플을 한 번 더 찍고 끝난다.
 *
 * 샘플링 중 예외는 루프 안에서 처리한다:
 * - {@link SensorProbeException}: 드롭된 샘플. 연속 실패가 한도에 닿으면 degraded 후 루프 종료
 * - 그 외 RuntimeException: 즉시 degraded 후 루프 종료
 */
@Slf4j
public abstract class AbstractSamplingSensor implements Sensor {

    private final SensorType type;
    private final SensorAvailability availability;
    private final Duration interval;
    private final Duration stopTimeout;
    private final int maxConsecutiveFailures;
    private final MonotonicClock clock;

    private Window window;

    protected AbstractSamplingSensor(SensorType type,
                                     SensorAvailability availability,
                                     Duration interval,
                                     Duration stopTimeout,
                                     int maxConsecutiveFailures,
                                     MonotonicClock clock) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sampling interval must be positive: " + interval);
        }
        if (maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be >= 1");
        }
        this.type = type;
        this.availability = availability;
        this.interval = interval;
        this.stopTimeout = stopTimeout;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.clock = clock;

        if (availability.available()) {
            log.info("Sensor {} available: {}", type.id(), availability.reason());
        } else {
            log.warn("[SENSOR][UNAVAILABLE] {}: {}", type.id(), availability.reason());
        }
    }

    /**
     * 프로브에서 값 1세트를 읽는다. 반환된 값들은 같은 타임스탬프로 기록된다.
     */
    protected abstract Map<MetricKind, Double> sampleOnce() throws SensorProbeException;

    @Override
    public SensorType type() {
        return type;
    }

    @Override
    public boolean isAvailable() {
        return availability.available();
    }

    @Override
    public String availabilityReason() {
        return availability.reason();
    }

    @Override
    public synchronized boolean isRunning() {
        return window != null;
    }

    @Override
    public synchronized void start() {
        if (!isAvailable()) {
            log.debug("Sensor {} unavailable, start ignored", type.id());
            return;
        }
        if (window != null) {
            throw new IllegalStateException("Sensor " + type.id() + " is already running");
        }

        Window w = new Window(clock.nanoTime());
        Thread thread = new Thread(() -> loop(w), "sensor-" + type.id());
        thread.setDaemon(true);
        w.thread = thread;
        window = w;
        thread.start();

        // 첫 샘플 시도가 끝날 때까지 대기: 짧은 워크로드도 최소 1개의 샘플을 갖게 된다
        try {
            if (!w.firstAttempt.await(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sensor {} first sample not taken within {}ms", type.id(), stopTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Sensor {} started", type.id());
    }

    @Override
    public synchronized SensorReading stop() {
        if (!isAvailable()) {
            long now = clock.nanoTime();
            return new SensorReading(type, SampleBuffer.closedEmpty(), null, now, now, 0);
        }
        Window w = window;
        if (w == null) {
            throw new IllegalStateException("Sensor " + type.id() + " was not started");
        }

        w.stopSignal.countDown();
        try {
            w.thread.join(stopTimeout.toMillis());
            if (w.thread.isAlive()) {
                w.thread.interrupt();
                w.thread.join(stopTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (w.thread.isAlive()) {
            w.degrade("sampling loop did not stop within " + stopTimeout.toMillis() + "ms");
            log.warn("[SENSOR][STOP] {} loop still alive after stop timeout, buffer closed anyway", type.id());
        }

        w.buffer.close();
        long stoppedNanos = clock.nanoTime();
        window = null;

        log.debug("Sensor {} stopped: {} samples, {} dropped", type.id(), w.buffer.size(), w.dropped.get());
        return new SensorReading(type, w.buffer, w.degradedReason, w.startedNanos, stoppedNanos, w.dropped.get());
    }

    private void loop(Window w) {
        try {
            while (true) {
                if (!sampleInto(w)) {
                    return;
                }
                if (w.stopSignal.await(interval.toNanos(), TimeUnit.NANOSECONDS)) {
                    // 종료 샘플: 윈도우의 마지막 샘플이 정지 시각에 오도록 한다
                    sampleInto(w);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            w.degrade("sampling loop failed: " + e);
            log.error("[SENSOR][DEGRADED] {} sampling loop failed", type.id(), e);
        } finally {
            w.firstAttempt.countDown();
        }
    }

    /**
     * 샘플 1세트를 버퍼에 기록한다.
     *
     * @return 연속 실패 한도에 닿아 degraded 되었으면 false
     */
    private boolean sampleInto(Window w) {
        try {
            Map<MetricKind, Double> values = sampleOnce();
            long now = clock.nanoTime();
            values.forEach((kind, value) -> {
                if (value != null && Double.isFinite(value)) {
                    w.buffer.append(new Sample(now, value, kind));
                }
            });
            w.consecutiveFailures = 0;
            return true;
        } catch (SensorProbeException e) {
            w.consecutiveFailures++;
            w.dropped.incrementAndGet();
            log.warn("[SENSOR][DROP] {} sample dropped ({} consecutive): {}",
                    type.id(), w.consecutiveFailures, e.getMessage());
            if (w.consecutiveFailures >= maxConsecutiveFailures) {
                w.degrade(w.consecutiveFailures + " consecutive failed samples: " + e.getMessage());
                log.warn("[SENSOR][DEGRADED] {} degraded for the rest of the window", type.id());
                return false;
            }
            return true;
        } finally {
            w.firstAttempt.countDown();
        }
    }

    /**
     * start() 1회에 해당하는 측정 윈도우 상태
     */
    private static final class Window {

        private final SampleBuffer buffer = new SampleBuffer();
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final CountDownLatch firstAttempt = new CountDownLatch(1);
        private final AtomicInteger dropped = new AtomicInteger();
        private final long startedNanos;
        private volatile String degradedReason;
        private Thread thread;
        // 샘플링 스레드 전용
        private int consecutiveFailures;

        private Window(long startedNanos) {
            this.startedNanos = startedNanos;
        }

        private void degrade(String reason) {
            if (degradedReason == null) {
                degradedReason = reason;
            }
        }
    }
}
