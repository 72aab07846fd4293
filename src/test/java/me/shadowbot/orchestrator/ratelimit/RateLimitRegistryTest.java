package me.shadowbot.orchestrator.ratelimit;

import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.RateLimitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitRegistryTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final long BUFFER = 1000L;

    private RateLimitRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RateLimitRegistry();
    }

    @Test
    void shouldReportNothingBeforeFirstObservation() {
        assertTrue(registry.find(EndpointCategory.MENTIONS).isEmpty());
        assertEquals(0L, registry.millisUntilAvailable(EndpointCategory.MENTIONS, NOW, BUFFER));
    }

    @Test
    void shouldWaitUntilResetPlusBufferWhenExhausted() {
        registry.observe(EndpointCategory.MENTIONS, state(0L, NOW + 4000));

        assertEquals(5000L, registry.millisUntilAvailable(EndpointCategory.MENTIONS, NOW, BUFFER));
    }

    @Test
    void shouldNotWaitWhenBudgetRemains() {
        registry.observe(EndpointCategory.MENTIONS, state(3L, NOW + 4000));

        assertEquals(0L, registry.millisUntilAvailable(EndpointCategory.MENTIONS, NOW, BUFFER));
    }

    @Test
    void shouldTreatPassedResetAsUnknown() {
        registry.observe(EndpointCategory.MENTIONS, state(0L, NOW - 1));

        assertEquals(0L, registry.millisUntilAvailable(EndpointCategory.MENTIONS, NOW, BUFFER));
        assertTrue(registry.find(EndpointCategory.MENTIONS).isPresent());
    }

    @Test
    void shouldOverwriteRatherThanMerge() {
        registry.observe(EndpointCategory.TWEET, state(0L, NOW + 4000));
        registry.observe(EndpointCategory.TWEET, RateLimitState.builder()
                .limit(300L)
                .observedAtEpochMillis(NOW)
                .build());

        RateLimitState state = registry.find(EndpointCategory.TWEET).orElseThrow();
        assertNull(state.getRemaining());
        assertNull(state.getResetAtEpochMillis());
        assertEquals(300L, state.getLimit());
    }

    @Test
    void shouldKeepCategoriesIndependent() {
        registry.observe(EndpointCategory.TWEET, state(0L, NOW + 4000));

        assertEquals(0L, registry.millisUntilAvailable(EndpointCategory.REPLY, NOW, BUFFER));
    }

    private static RateLimitState state(Long remaining, Long resetAt) {
        return RateLimitState.builder()
                .remaining(remaining)
                .resetAtEpochMillis(resetAt)
                .limit(50L)
                .observedAtEpochMillis(NOW)
                .build();
    }
}
