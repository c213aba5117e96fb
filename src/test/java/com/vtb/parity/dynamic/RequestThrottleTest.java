package com.vtb.parity.dynamic;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RequestThrottleTest {

    @Test
    void spacesRequestsAcrossCallers() throws Exception {
        RequestThrottle throttle = new RequestThrottle(20);
        assertTrue(throttle.isEnabled());

        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            throttle.acquire();
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs >= 180, "5 запросов при 20 rps занимают не меньше 200 мс, получено " + elapsedMs);
    }

    @Test
    void disabledThrottleDoesNotWait() throws Exception {
        RequestThrottle throttle = new RequestThrottle(0);
        assertFalse(throttle.isEnabled());

        long start = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            throttle.acquire();
        }
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 100);
    }
}
