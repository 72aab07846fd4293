package me.shadowbot.orchestrator.domain.service;

import me.shadowbot.orchestrator.domain.model.ApiResponse;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.Mention;
import me.shadowbot.orchestrator.domain.model.MentionPage;
import me.shadowbot.orchestrator.domain.model.PostedTweet;
import me.shadowbot.orchestrator.domain.model.TweetDraft;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.PersistencePort;
import me.shadowbot.orchestrator.port.outbound.SocialApiPort;
import me.shadowbot.orchestrator.ratelimit.AttemptFunction;
import me.shadowbot.orchestrator.testsupport.time.MutableClock;
import me.shadowbot.orchestrator.usage.ActivityMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BotActivityServiceTest {

    private static final String BOT_ID = "42";

    private RequestOrchestrator orchestrator;
    private SocialApiPort socialApiPort;
    private IdentityCache identityCache;
    private PersistencePort persistencePort;
    private ActivityMetrics metrics;
    private BotActivityService service;

    @BeforeEach
    void setUp() {
        orchestrator = mock(RequestOrchestrator.class);
        when(orchestrator.execute(any(EndpointCategory.class), any(), any()))
                .thenAnswer(invocation -> invocation.<AttemptFunction<?>>getArgument(2).attempt().value());
        socialApiPort = mock(SocialApiPort.class);
        identityCache = mock(IdentityCache.class);
        when(identityCache.getCachedIdentity()).thenReturn(BOT_ID);
        persistencePort = mock(PersistencePort.class);
        BotProperties properties = new BotProperties();
        metrics = new ActivityMetrics(persistencePort, properties,
                new MutableClock(Instant.parse("2026-03-14T12:00:00Z")));

        service = new BotActivityService(orchestrator, socialApiPort, identityCache, persistencePort, metrics,
                properties);
    }

    // ===== Posting =====

    @Test
    void shouldPostThroughTweetLaneAndRememberOwnPost() {
        when(socialApiPort.post(any())).thenReturn(ApiResponse.of(new PostedTweet("100", "hello")));

        PostedTweet posted = service.post("hello");

        assertEquals("100", posted.id());
        verify(orchestrator).execute(eq(EndpointCategory.TWEET), any(), any());
        verify(socialApiPort).post(TweetDraft.text("hello"));
        verify(persistencePort).recordOwnPost("100");
        assertEquals(1, metrics.snapshot().getTweetsPosted());
    }

    @Test
    void shouldPostMediaThroughTweetLane() {
        when(socialApiPort.post(any())).thenReturn(ApiResponse.of(new PostedTweet("101", "pic")));

        service.postWithMedia("pic", List.of("m1"));

        verify(orchestrator).execute(eq(EndpointCategory.TWEET), any(), any());
        verify(socialApiPort).post(new TweetDraft("pic", List.of("m1")));
    }

    @Test
    void shouldRejectBlankTextWithoutCallingApi() {
        assertThrows(IllegalArgumentException.class, () -> service.post("  "));
        assertThrows(IllegalArgumentException.class, () -> service.postWithMedia("pic", List.of()));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldStillReturnPostWhenOwnPostCannotBeRemembered() {
        when(socialApiPort.post(any())).thenReturn(ApiResponse.of(new PostedTweet("100", "hello")));
        doThrow(new IllegalStateException("disk full")).when(persistencePort).recordOwnPost(anyString());

        assertEquals("100", service.post("hello").id());
    }

    @Test
    void shouldFailPostWhenNoTweetIdCameBack() {
        when(socialApiPort.post(any())).thenReturn(ApiResponse.of(null));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> service.post("hello"));

        assertTrue(error.getMessage().contains("tweet"));
        verify(persistencePort, never()).recordOwnPost(anyString());
        assertEquals(0, metrics.snapshot().getTweetsPosted());
    }

    // ===== Replies =====

    @Test
    void shouldReplyThroughReplyLane() {
        when(socialApiPort.reply(eq("7"), any())).thenReturn(ApiResponse.of(new PostedTweet("200", "thanks")));

        PostedTweet reply = service.reply("7", "thanks");

        assertEquals("200", reply.id());
        verify(orchestrator).execute(eq(EndpointCategory.REPLY), any(), any());
        verify(persistencePort).recordOwnPost("200");
        assertEquals(1, metrics.snapshot().getRepliesSent());
    }

    @Test
    void shouldFailReplyWhenPostedTweetHasNoId() {
        when(socialApiPort.reply(eq("7"), any())).thenReturn(ApiResponse.of(new PostedTweet(null, "thanks")));

        assertThrows(IllegalStateException.class, () -> service.reply("7", "thanks"));
        assertEquals(0, metrics.snapshot().getRepliesSent());
    }

    @Test
    void shouldRequireReplyTarget() {
        assertThrows(IllegalArgumentException.class, () -> service.reply(null, "thanks"));
    }

    // ===== Engagement =====

    @Test
    void shouldLikeAsAuthenticatedUser() {
        when(socialApiPort.like(BOT_ID, "7")).thenReturn(ApiResponse.of(true));

        assertTrue(service.like("7"));
        verify(orchestrator).execute(eq(EndpointCategory.LIKE), eq("7"), any());
    }

    @Test
    void shouldFollowAsAuthenticatedUser() {
        when(socialApiPort.follow(BOT_ID, "99")).thenReturn(ApiResponse.of(false));

        assertFalse(service.follow("99"));
        verify(socialApiPort).follow(BOT_ID, "99");
    }

    // ===== Reading =====

    @Test
    void shouldFetchMentionsSinceCursor() {
        Mention mention = Mention.builder().id("11").authorId("5").text("@bot hi").build();
        when(socialApiPort.listMentions(BOT_ID, "10"))
                .thenReturn(ApiResponse.of(new MentionPage(List.of(mention), "11")));

        MentionPage page = service.fetchMentions("10");

        assertEquals(1, page.items().size());
        verify(orchestrator).execute(eq(EndpointCategory.MENTIONS), eq("10"), any());
    }

    @Test
    void shouldTreatMissingMentionPageAsEmpty() {
        when(socialApiPort.listMentions(BOT_ID, null)).thenReturn(ApiResponse.of(null));

        assertTrue(service.fetchMentions(null).isEmpty());
    }

    @Test
    void shouldReadOwnTimelineWithConfiguredPageSize() {
        when(socialApiPort.userTimeline(BOT_ID, 5)).thenReturn(ApiResponse.of(MentionPage.empty()));

        service.fetchOwnTimeline();

        verify(orchestrator).execute(eq(EndpointCategory.TIMELINE), eq(BOT_ID), any());
        verify(socialApiPort).userTimeline(BOT_ID, 5);
    }
}
