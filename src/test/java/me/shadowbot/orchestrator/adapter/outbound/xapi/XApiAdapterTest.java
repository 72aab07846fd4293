package me.shadowbot.orchestrator.adapter.outbound.xapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.shadowbot.orchestrator.domain.exception.PermanentApiException;
import me.shadowbot.orchestrator.domain.exception.RateLimitedException;
import me.shadowbot.orchestrator.domain.exception.TransientNetworkException;
import me.shadowbot.orchestrator.domain.model.ApiResponse;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.Mention;
import me.shadowbot.orchestrator.domain.model.MentionPage;
import me.shadowbot.orchestrator.domain.model.PostedTweet;
import me.shadowbot.orchestrator.domain.model.ReferencedTweet;
import me.shadowbot.orchestrator.domain.model.TweetDraft;
import me.shadowbot.orchestrator.domain.model.UserIdentity;
import me.shadowbot.orchestrator.infrastructure.config.AutoConfiguration;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.AccessTokenPort;
import me.shadowbot.orchestrator.testsupport.http.OkHttpMockEngine;
import me.shadowbot.orchestrator.testsupport.time.MutableClock;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class XApiAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-14T12:00:00Z");
    private static final String TOKEN = "test-token";

    private OkHttpMockEngine engine;
    private BotProperties properties;
    private ObjectMapper objectMapper;
    private AccessTokenPort accessTokenPort;
    private XApiAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new BotProperties();
        properties.getXApi().setBaseUrl("https://api.x.test");
        objectMapper = AutoConfiguration.objectMapper();
        accessTokenPort = mock(AccessTokenPort.class);
        when(accessTokenPort.getAccessToken()).thenReturn(TOKEN);

        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new XApiAdapter(client, properties, objectMapper, accessTokenPort, new MutableClock(NOW));
    }

    // ===== Posting =====

    @Test
    void shouldPostTweetAndReadRateLimitHeaders() throws Exception {
        engine.enqueueJson(201, "{\"data\":{\"id\":\"1001\",\"text\":\"hello\"}}", Map.of(
                XApiAdapter.HEADER_LIMIT, "200",
                XApiAdapter.HEADER_REMAINING, "199",
                XApiAdapter.HEADER_RESET, "1773490500"));

        ApiResponse<PostedTweet> response = adapter.post(TweetDraft.text("hello"));

        assertEquals(new PostedTweet("1001", "hello"), response.value());
        assertEquals(200L, response.rateLimit().getLimit());
        assertEquals(199L, response.rateLimit().getRemaining());
        assertEquals(1_773_490_500_000L, response.rateLimit().getResetAtEpochMillis());
        assertEquals(NOW.toEpochMilli(), response.rateLimit().getObservedAtEpochMillis());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/2/tweets", request.target());
        assertEquals("Bearer " + TOKEN, request.headers().get("Authorization"));
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("hello", body.get("text").asText());
        assertFalse(body.has("media"));
    }

    @Test
    void shouldAttachMediaIdsToPost() throws Exception {
        engine.enqueueJson(201, "{\"data\":{\"id\":\"1002\",\"text\":\"pic\"}}");

        adapter.post(new TweetDraft("pic", List.of("m1", "m2")));

        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        JsonNode mediaIds = body.path("media").path("media_ids");
        assertEquals(2, mediaIds.size());
        assertEquals("m1", mediaIds.get(0).asText());
        assertEquals("m2", mediaIds.get(1).asText());
    }

    @Test
    void shouldSendMediaPostThroughTweetBucket() {
        engine.enqueueJson(429, "{\"title\":\"Too Many Requests\"}");

        RateLimitedException error = assertThrows(RateLimitedException.class,
                () -> adapter.post(new TweetDraft("pic", List.of("m1"))));

        assertEquals(EndpointCategory.TWEET, error.getCategory());
    }

    @Test
    void shouldFailPostWhenResponseCarriesNoData() {
        engine.enqueueJson(201, "{}");

        PermanentApiException error = assertThrows(PermanentApiException.class,
                () -> adapter.post(TweetDraft.text("hello")));

        assertEquals(EndpointCategory.TWEET, error.getCategory());
        assertEquals(201, error.getStatusCode());
        assertTrue(error.getMessage().contains("no tweet id"));
    }

    @Test
    void shouldFailReplyWhenResponseDataIsNull() {
        engine.enqueueJson(201, "{\"data\":null}");

        PermanentApiException error = assertThrows(PermanentApiException.class,
                () -> adapter.reply("555", TweetDraft.text("thanks")));

        assertEquals(EndpointCategory.REPLY, error.getCategory());
        assertFalse(error.isAuthFailure());
    }

    @Test
    void shouldSendReplyTarget() throws Exception {
        engine.enqueueJson(201, "{\"data\":{\"id\":\"1003\",\"text\":\"thanks\"}}");

        ApiResponse<PostedTweet> response = adapter.reply("555", TweetDraft.text("thanks"));

        assertEquals("1003", response.value().id());
        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("555", body.path("reply").path("in_reply_to_tweet_id").asText());
    }

    @Test
    void shouldReturnNullRateLimitFieldsWhenHeadersMissing() {
        engine.enqueueJson(201, "{\"data\":{\"id\":\"1004\",\"text\":\"x\"}}");

        ApiResponse<PostedTweet> response = adapter.post(TweetDraft.text("x"));

        assertNull(response.rateLimit().getRemaining());
        assertNull(response.rateLimit().getResetAtEpochMillis());
        assertFalse(response.rateLimit().carriesLimitData());
    }

    // ===== Mentions and timeline =====

    @Test
    void shouldReturnMentionsOldestFirst() {
        properties.getXApi().setMentionsPageSize(2);
        engine.enqueueJson(200, """
                {"data":[
                  {"id":"30","text":"@bot third","author_id":"7","created_at":"2026-03-14T11:59:00.000Z",
                   "referenced_tweets":[{"type":"replied_to","id":"900"}]},
                  {"id":"20","text":"@bot second","author_id":"8","created_at":"2026-03-14T11:58:00.000Z"},
                  {"id":"10","text":"@bot first","author_id":"9","created_at":"2026-03-14T11:57:00.000Z"}
                ],"meta":{"result_count":3,"newest_id":"30"}}
                """);

        MentionPage page = adapter.listMentions("42", "5").value();

        assertEquals(List.of("10", "20", "30"), page.items().stream().map(Mention::getId).toList());
        assertEquals("30", page.nextCursor());
        Mention newest = page.items().get(2);
        assertEquals("7", newest.getAuthorId());
        assertEquals(Instant.parse("2026-03-14T11:59:00Z"), newest.getCreatedAt());
        assertEquals(List.of(new ReferencedTweet(ReferencedTweet.REPLIED_TO, "900")), newest.getReferencedTweets());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertTrue(request.target().startsWith("/2/users/42/mentions"));
        assertEquals("5", request.queryParameter("since_id"));
        assertEquals("5", request.queryParameter("max_results"));
        assertEquals("author_id,created_at,referenced_tweets", request.queryParameter("tweet.fields"));
    }

    @Test
    void shouldOmitSinceIdWithoutCursor() {
        engine.enqueueJson(200, "{\"meta\":{\"result_count\":0}}");

        MentionPage page = adapter.listMentions("42", null).value();

        assertTrue(page.isEmpty());
        assertNull(page.nextCursor());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertNull(request.queryParameter("since_id"));
        assertEquals("20", request.queryParameter("max_results"));
    }

    @Test
    void shouldFetchUserTimeline() {
        engine.enqueueJson(200, "{\"data\":[{\"id\":\"2\",\"text\":\"b\"},{\"id\":\"1\",\"text\":\"a\"}]}");

        MentionPage page = adapter.userTimeline("42", 500).value();

        assertEquals(List.of("1", "2"), page.items().stream().map(Mention::getId).toList());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertTrue(request.target().startsWith("/2/users/42/tweets"));
        assertEquals("100", request.queryParameter("max_results"));
    }

    // ===== Identity and engagement =====

    @Test
    void shouldResolveIdentity() {
        engine.enqueueJson(200, "{\"data\":{\"id\":\"42\",\"username\":\"shadow\",\"name\":\"Shadow\"}}");

        UserIdentity identity = adapter.getIdentity().value();

        assertEquals(new UserIdentity("42", "shadow"), identity);
        assertEquals("/2/users/me", engine.takeRequest().target());
    }

    @Test
    void shouldLikeTweet() throws Exception {
        engine.enqueueJson(200, "{\"data\":{\"liked\":true}}");

        assertTrue(adapter.like("42", "777").value());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/2/users/42/likes", request.target());
        assertEquals("777", objectMapper.readTree(request.body()).get("tweet_id").asText());
    }

    @Test
    void shouldTreatPendingFollowAsFollowed() {
        engine.enqueueJson(200, "{\"data\":{\"following\":false,\"pending_follow\":true}}");

        assertTrue(adapter.follow("42", "99").value());
        assertEquals("/2/users/42/following", engine.takeRequest().target());
    }

    // ===== Failure mapping =====

    @Test
    void shouldMapTooManyRequestsWithReset() {
        engine.enqueueJson(429, "{\"title\":\"Too Many Requests\"}", Map.of(
                XApiAdapter.HEADER_LIMIT, "75",
                XApiAdapter.HEADER_REMAINING, "0",
                XApiAdapter.HEADER_RESET, "1773490800"));

        RateLimitedException error = assertThrows(RateLimitedException.class,
                () -> adapter.listMentions("42", null));

        assertEquals(EndpointCategory.MENTIONS, error.getCategory());
        assertEquals(1_773_490_800_000L, error.getResetAtEpochMillis());
        assertEquals(75L, error.getLimit());
        assertEquals(0L, error.getRemaining());
    }

    @Test
    void shouldMapTooManyRequestsWithoutReset() {
        engine.enqueueJson(429, "{\"title\":\"Too Many Requests\"}");

        RateLimitedException error = assertThrows(RateLimitedException.class,
                () -> adapter.post(TweetDraft.text("x")));

        assertFalse(error.hasReset());
        assertEquals(EndpointCategory.TWEET, error.getCategory());
    }

    @Test
    void shouldIgnoreMalformedResetHeader() {
        engine.enqueueJson(429, "", Map.of(XApiAdapter.HEADER_RESET, "soon"));

        RateLimitedException error = assertThrows(RateLimitedException.class,
                () -> adapter.post(TweetDraft.text("x")));

        assertNull(error.getResetAtEpochMillis());
    }

    @Test
    void shouldMapServerErrorToTransient() {
        engine.enqueueJson(503, "{\"title\":\"Service Unavailable\"}");

        TransientNetworkException error = assertThrows(TransientNetworkException.class,
                () -> adapter.reply("1", TweetDraft.text("x")));

        assertTrue(error.getMessage().contains("503"));
        assertEquals(EndpointCategory.REPLY, error.getCategory());
    }

    @Test
    void shouldMapIoFailureToTransient() {
        engine.enqueueFailure(new IOException("connection reset"));

        TransientNetworkException error = assertThrows(TransientNetworkException.class,
                () -> adapter.getIdentity());

        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    void shouldMapUnauthorizedToPermanentWithDetail() {
        engine.enqueueJson(401, "{\"title\":\"Unauthorized\",\"detail\":\"Invalid token\",\"status\":401}");

        PermanentApiException error = assertThrows(PermanentApiException.class,
                () -> adapter.post(TweetDraft.text("x")));

        assertEquals(401, error.getStatusCode());
        assertTrue(error.isAuthFailure());
        assertTrue(error.getMessage().contains("Invalid token"));
    }

    @Test
    void shouldUseFirstErrorMessageWhenNoDetail() {
        engine.enqueueJson(400, "{\"errors\":[{\"message\":\"text is too long\"}]}");

        PermanentApiException error = assertThrows(PermanentApiException.class,
                () -> adapter.post(TweetDraft.text("x")));

        assertEquals(400, error.getStatusCode());
        assertTrue(error.getMessage().contains("text is too long"));
    }

    @Test
    void shouldMapMalformedBodyToPermanent() {
        engine.enqueueJson(200, "{not json");

        assertThrows(PermanentApiException.class, () -> adapter.getIdentity());
    }

    @Test
    void shouldRefuseToCallWithoutToken() {
        when(accessTokenPort.getAccessToken()).thenReturn(" ");

        assertThrows(IllegalStateException.class, () -> adapter.post(TweetDraft.text("x")));
        assertEquals(0, engine.getRequestCount());
    }
}
