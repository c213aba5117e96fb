package com.vtb.parity.dynamic;

import java.util.concurrent.TimeUnit;

/**
 * Ограничение частоты запросов, общее для обеих целей.
 * Каждый вызов {@link #acquire(int)} резервирует следующие слоты и спит до последнего из них.
 */
public class RequestThrottle {

    private final long intervalNanos;
    private long nextSlot;

    public RequestThrottle(double requestsPerSecond) {
        this.intervalNanos = requestsPerSecond > 0
            ? (long) (TimeUnit.SECONDS.toNanos(1) / requestsPerSecond)
            : 0L;
    }

    public boolean isEnabled() {
        return intervalNanos > 0;
    }

    public void acquire() throws InterruptedException {
        acquire(1);
    }

    /**
     * Резервирует {@code permits} подряд идущих слотов; возвращает управление, когда наступил последний
     */
    public void acquire(int permits) throws InterruptedException {
        if (intervalNanos == 0 || permits <= 0) {
            return;
        }
        long wait;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = Math.max(now, nextSlot);
            nextSlot = slot + intervalNanos * permits;
            wait = slot + intervalNanos * (permits - 1) - now;
        }
        if (wait > 0) {
            TimeUnit.NANOSECONDS.sleep(wait);
        }
    }
}
