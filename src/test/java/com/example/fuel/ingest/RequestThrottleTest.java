package com.example.fuel.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Request throttle")
class RequestThrottleTest {

    @Test
    @DisplayName("First request goes out immediately")
    void testFirstRequest() throws InterruptedException {
        FakeClock clock = new FakeClock();
        RequestThrottle throttle = new RequestThrottle(Duration.ofSeconds(1), clock, clock);

        throttle.acquire();

        assertTrue(clock.sleeps().isEmpty());
    }

    @Test
    @DisplayName("Waits out the remainder of the interval")
    void testWaitsRemainder() throws InterruptedException {
        FakeClock clock = new FakeClock();
        RequestThrottle throttle = new RequestThrottle(Duration.ofSeconds(1), clock, clock);

        throttle.acquire();
        clock.advance(Duration.ofMillis(400));
        throttle.acquire();
        throttle.acquire();

        assertEquals(List.of(Duration.ofMillis(600), Duration.ofSeconds(1)), clock.sleeps());
    }

    @Test
    @DisplayName("No wait once the interval has passed")
    void testNoWaitAfterInterval() throws InterruptedException {
        FakeClock clock = new FakeClock();
        RequestThrottle throttle = new RequestThrottle(Duration.ofSeconds(1), clock, clock);

        throttle.acquire();
        clock.advance(Duration.ofSeconds(2));
        throttle.acquire();

        assertTrue(clock.sleeps().isEmpty());
    }

    @Test
    @DisplayName("Zero interval never sleeps")
    void testZeroInterval() throws InterruptedException {
        FakeClock clock = new FakeClock();
        RequestThrottle throttle = new RequestThrottle(Duration.ZERO, clock, clock);

        for (int i = 0; i < 5; i++) {
            throttle.acquire();
        }

        assertTrue(clock.sleeps().isEmpty());
    }

    @Test
    @DisplayName("Negative interval is rejected")
    void testNegativeInterval() {
        assertThrows(IllegalArgumentException.class, () -> new RequestThrottle(Duration.ofSeconds(-1)));
    }
}
