package com.autopost.scheduler.ratelimit;

import com.autopost.scheduler.config.AutopostProperties;
import com.autopost.scheduler.exception.QuotaExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class QuotaGuardTest {

    @Mock
    private RateLimiter rateLimiter;

    private final List<Duration> waits = new ArrayList<>();
    private QuotaGuard guard;

    @BeforeEach
    void setUp() {
        guard = new QuotaGuard(rateLimiter, waits::add, new AutopostProperties());
    }

    @Test
    void returnsResultOfSuccessfulCall() throws Exception {
        assertEquals("caption", guard.call("generate", CallMode.INTERACTIVE, () -> "caption"));

        verify(rateLimiter).waitIfNeeded();
        assertTrue(waits.isEmpty());
    }

    @Test
    void retriesQuotaErrorsWithBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = guard.call("generate", CallMode.INTERACTIVE, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("429 quota exhausted, retry in 4s");
            }
            return "caption";
        });

        assertEquals("caption", result);
        assertEquals(List.of(Duration.ofSeconds(10), Duration.ofSeconds(15)), waits);
        verify(rateLimiter, times(3)).waitIfNeeded();
    }

    @Test
    void interactiveCallGivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(QuotaExceededException.class, () -> guard.call("generate", CallMode.INTERACTIVE, () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("quota exceeded");
        }));

        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(35), Duration.ofSeconds(65)), waits);
    }

    @Test
    void otherErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> guard.call("generate", CallMode.INTERACTIVE, () -> {
                    calls.incrementAndGet();
                    throw new IllegalArgumentException("bad prompt");
                }));

        assertEquals("bad prompt", e.getMessage());
        assertEquals(1, calls.get());
    }

    @Test
    void batchWaitsAreSplitIntoChunks() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        guard.call("generate", CallMode.BATCH, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("rate limit, retry in 149s");
            }
            return "ok";
        });

        assertEquals(List.of(Duration.ofSeconds(60), Duration.ofSeconds(60), Duration.ofSeconds(35)), waits);
    }

    @Test
    void batchWaitStopsWhenInterrupted() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> guard.call("generate", CallMode.BATCH, () -> {
                throw new IllegalStateException("quota exceeded, retry in 200s");
            }));
        } finally {
            Thread.interrupted();
        }
    }
}
