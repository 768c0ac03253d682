package com.jobrelay.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffPolicyTest {

    private static final Duration BASE = Duration.ofSeconds(1);
    private static final Duration MAX = Duration.ofSeconds(30);

    private final BackoffPolicy policy = new BackoffPolicy(new SplittableRandom(7));

    @Test
    void shouldDoubleCeilingPerAttemptUntilCapped() {
        assertEquals(Duration.ofSeconds(1), policy.ceiling(1, BASE, MAX));
        assertEquals(Duration.ofSeconds(2), policy.ceiling(2, BASE, MAX));
        assertEquals(Duration.ofSeconds(4), policy.ceiling(3, BASE, MAX));
        assertEquals(Duration.ofSeconds(16), policy.ceiling(5, BASE, MAX));
        assertEquals(MAX, policy.ceiling(6, BASE, MAX));
        assertEquals(MAX, policy.ceiling(500, BASE, MAX));
    }

    @Test
    void shouldKeepJitteredDelayWithinCeiling() {
        for (int attempt = 1; attempt <= 10; attempt++) {
            Duration ceiling = policy.ceiling(attempt, BASE, MAX);
            for (int i = 0; i < 200; i++) {
                Duration delay = policy.delay(attempt, BASE, MAX);
                assertTrue(!delay.isNegative() && delay.compareTo(ceiling) <= 0,
                        "delay " + delay + " outside [0, " + ceiling + "] for attempt " + attempt);
            }
        }
    }

    @Test
    void shouldReachCeilingWhenJitterSourceReturnsItsUpperBound() {
        BackoffPolicy upperBound = new BackoffPolicy(new RandomGenerator() {
            @Override
            public long nextLong() {
                return 0L;
            }

            @Override
            public long nextLong(long bound) {
                return bound - 1;
            }
        });
        OffsetDateTime now = OffsetDateTime.of(2030, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

        assertEquals(now.plusSeconds(4), upperBound.nextEligibleAt(3, BASE, MAX, now));
    }

    @Test
    void shouldReturnZeroDelayWhenBaseDelayIsZero() {
        assertEquals(Duration.ZERO, policy.delay(4, Duration.ZERO, MAX));
    }

    @Test
    void shouldRejectAttemptsBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> policy.ceiling(0, BASE, MAX));
    }
}
