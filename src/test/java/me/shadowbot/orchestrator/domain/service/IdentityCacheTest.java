package me.shadowbot.orchestrator.domain.service;

import me.shadowbot.orchestrator.domain.model.ApiResponse;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.UserIdentity;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.SocialApiPort;
import me.shadowbot.orchestrator.ratelimit.AttemptFunction;
import me.shadowbot.orchestrator.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class IdentityCacheTest {

    private MutableClock clock;
    private RequestOrchestrator orchestrator;
    private SocialApiPort socialApiPort;
    private IdentityCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-14T12:00:00Z"));
        orchestrator = mock(RequestOrchestrator.class);
        when(orchestrator.execute(any(EndpointCategory.class), any(), any()))
                .thenAnswer(invocation -> invocation.<AttemptFunction<?>>getArgument(2).attempt().value());
        socialApiPort = mock(SocialApiPort.class);
        when(socialApiPort.getIdentity()).thenReturn(ApiResponse.of(new UserIdentity("42", "shadow")));

        cache = new IdentityCache(orchestrator, socialApiPort, clock, new BotProperties());
    }

    @Test
    void shouldFetchIdentityThroughUserLookupLane() {
        assertEquals("42", cache.getCachedIdentity());

        verify(orchestrator).execute(eq(EndpointCategory.USER_LOOKUP), any(), any());
    }

    @Test
    void shouldServeFromCacheWithinTtl() {
        cache.getCachedIdentity();
        clock.advance(Duration.ofMinutes(4));

        assertEquals("shadow", cache.getIdentity().username());
        verify(socialApiPort, times(1)).getIdentity();
    }

    @Test
    void shouldRefreshAfterTtlExpires() {
        cache.getCachedIdentity();
        clock.advance(Duration.ofMinutes(5));

        cache.getCachedIdentity();

        verify(socialApiPort, times(2)).getIdentity();
    }

    @Test
    void shouldRefreshAfterInvalidate() {
        cache.getCachedIdentity();

        cache.invalidate();
        cache.getCachedIdentity();

        verify(socialApiPort, times(2)).getIdentity();
    }

    @Test
    void shouldRejectLookupWithoutId() {
        when(socialApiPort.getIdentity()).thenReturn(ApiResponse.of(new UserIdentity(" ", "shadow")));

        assertThrows(IllegalStateException.class, () -> cache.getCachedIdentity());
    }
}
