package me.shadowbot.orchestrator.adapter.outbound.xapi;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.shadowbot.orchestrator.domain.exception.PermanentApiException;
import me.shadowbot.orchestrator.domain.exception.RateLimitedException;
import me.shadowbot.orchestrator.domain.exception.TransientNetworkException;
import me.shadowbot.orchestrator.domain.model.ApiResponse;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.Mention;
import me.shadowbot.orchestrator.domain.model.MentionPage;
import me.shadowbot.orchestrator.domain.model.PostedTweet;
import me.shadowbot.orchestrator.domain.model.RateLimitState;
import me.shadowbot.orchestrator.domain.model.ReferencedTweet;
import me.shadowbot.orchestrator.domain.model.TweetDraft;
import me.shadowbot.orchestrator.domain.model.UserIdentity;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.AccessTokenPort;
import me.shadowbot.orchestrator.port.outbound.SocialApiPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * X API v2 adapter.
 *
 * <p>
 * Performs exactly one HTTP exchange per call; retrying is left to the
 * orchestrator. The {@code x-rate-limit-*} response headers are returned with
 * every result and with every throttling signal. Status mapping:
 * <ul>
 * <li>429 - {@link RateLimitedException}</li>
 * <li>408, 5xx and I/O failures - {@link TransientNetworkException}</li>
 * <li>other 4xx and malformed bodies - {@link PermanentApiException}</li>
 * </ul>
 *
 * <p>
 * Mentions and timelines arrive newest first from the API and are returned
 * oldest first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class XApiAdapter implements SocialApiPort {

    static final String HEADER_LIMIT = "x-rate-limit-limit";
    static final String HEADER_REMAINING = "x-rate-limit-remaining";
    static final String HEADER_RESET = "x-rate-limit-reset";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String TWEET_FIELDS = "author_id,created_at,referenced_tweets";
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_SERVER_ERROR = 500;
    private static final int MIN_PAGE_SIZE = 5;
    private static final int MAX_PAGE_SIZE = 100;
    private static final int MAX_ERROR_DETAIL_LENGTH = 300;
    private static final long MILLIS_PER_SECOND = 1000L;

    private static final TypeReference<Envelope<TweetData>> TWEET_ENVELOPE = new TypeReference<>() {
    };
    private static final TypeReference<Envelope<List<TweetData>>> TWEET_LIST_ENVELOPE = new TypeReference<>() {
    };
    private static final TypeReference<Envelope<UserData>> USER_ENVELOPE = new TypeReference<>() {
    };
    private static final TypeReference<Envelope<ActionData>> ACTION_ENVELOPE = new TypeReference<>() {
    };

    private final OkHttpClient okHttpClient;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;
    private final AccessTokenPort accessTokenPort;
    private final Clock clock;

    @Override
    public ApiResponse<PostedTweet> post(TweetDraft draft) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", draft.text());
        if (draft.hasMedia()) {
            body.put("media", Map.of("media_ids", draft.mediaIds()));
        }
        Request request = authorized(EndpointCategory.TWEET, url("2", "tweets"))
                .post(jsonBody(body))
                .build();
        return call(EndpointCategory.TWEET, request, (payload, status) -> toPostedTweet(EndpointCategory.TWEET,
                status, objectMapper.readValue(payload, TWEET_ENVELOPE)));
    }

    @Override
    public ApiResponse<PostedTweet> reply(String targetId, TweetDraft draft) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", draft.text());
        body.put("reply", Map.of("in_reply_to_tweet_id", targetId));
        if (draft.hasMedia()) {
            body.put("media", Map.of("media_ids", draft.mediaIds()));
        }
        Request request = authorized(EndpointCategory.REPLY, url("2", "tweets"))
                .post(jsonBody(body))
                .build();
        return call(EndpointCategory.REPLY, request,
                (payload, status) -> toPostedTweet(EndpointCategory.REPLY, status,
                        objectMapper.readValue(payload, TWEET_ENVELOPE)));
    }

    @Override
    public ApiResponse<MentionPage> listMentions(String userId, String sinceId) {
        HttpUrl.Builder url = url("2", "users", userId, "mentions").newBuilder()
                .addQueryParameter("max_results",
                        String.valueOf(clampPageSize(properties.getXApi().getMentionsPageSize())))
                .addQueryParameter("tweet.fields", TWEET_FIELDS);
        if (sinceId != null && !sinceId.isBlank()) {
            url.addQueryParameter("since_id", sinceId);
        }
        Request request = authorized(EndpointCategory.MENTIONS, url.build()).get().build();
        return call(EndpointCategory.MENTIONS, request,
                (payload, status) -> toPage(objectMapper.readValue(payload, TWEET_LIST_ENVELOPE)));
    }

    @Override
    public ApiResponse<UserIdentity> getIdentity() {
        Request request = authorized(EndpointCategory.USER_LOOKUP, url("2", "users", "me")).get().build();
        return call(EndpointCategory.USER_LOOKUP, request, (payload, status) -> {
            Envelope<UserData> envelope = objectMapper.readValue(payload, USER_ENVELOPE);
            UserData user = envelope.getData();
            if (user == null) {
                return null;
            }
            return new UserIdentity(user.getId(), user.getUsername());
        });
    }

    @Override
    public ApiResponse<Boolean> like(String userId, String tweetId) {
        Request request = authorized(EndpointCategory.LIKE, url("2", "users", userId, "likes"))
                .post(jsonBody(Map.of("tweet_id", tweetId)))
                .build();
        return call(EndpointCategory.LIKE, request, (payload, status) -> {
            ActionData data = objectMapper.readValue(payload, ACTION_ENVELOPE).getData();
            return data != null && Boolean.TRUE.equals(data.getLiked());
        });
    }

    @Override
    public ApiResponse<Boolean> follow(String userId, String targetUserId) {
        Request request = authorized(EndpointCategory.FOLLOW, url("2", "users", userId, "following"))
                .post(jsonBody(Map.of("target_user_id", targetUserId)))
                .build();
        return call(EndpointCategory.FOLLOW, request, (payload, status) -> {
            ActionData data = objectMapper.readValue(payload, ACTION_ENVELOPE).getData();
            return data != null
                    && (Boolean.TRUE.equals(data.getFollowing()) || Boolean.TRUE.equals(data.getPendingFollow()));
        });
    }

    @Override
    public ApiResponse<MentionPage> userTimeline(String userId, int maxResults) {
        HttpUrl url = url("2", "users", userId, "tweets").newBuilder()
                .addQueryParameter("max_results", String.valueOf(clampPageSize(maxResults)))
                .addQueryParameter("tweet.fields", TWEET_FIELDS)
                .build();
        Request request = authorized(EndpointCategory.TIMELINE, url).get().build();
        return call(EndpointCategory.TIMELINE, request,
                (payload, status) -> toPage(objectMapper.readValue(payload, TWEET_LIST_ENVELOPE)));
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    private <T> ApiResponse<T> call(EndpointCategory category, Request request, ResponseParser<T> parser) {
        log.debug("[XApi] {} {} {}", category.getKey(), request.method(), request.url().encodedPath());
        try (Response response = okHttpClient.newCall(request).execute()) {
            RateLimitState rateLimit = readRateLimit(response);
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";

            if (response.code() == HTTP_TOO_MANY_REQUESTS) {
                log.warn("[XApi] {} throttled: remaining={}, reset={}", category.getKey(),
                        rateLimit.getRemaining(), rateLimit.getResetAtEpochMillis());
                throw new RateLimitedException(category, rateLimit.getResetAtEpochMillis(), rateLimit.getLimit(),
                        rateLimit.getRemaining());
            }
            if (!response.isSuccessful()) {
                throw toFailure(category, response.code(), payload);
            }

            try {
                return ApiResponse.of(parser.parse(payload, response.code()), rateLimit);
            } catch (JsonProcessingException e) {
                throw new PermanentApiException(category, response.code(),
                        "Malformed response: " + e.getOriginalMessage(), e);
            }
        } catch (IOException e) {
            log.warn("[XApi] {} network error: {}", category.getKey(), e.getMessage());
            throw new TransientNetworkException(category, "Network error on " + category.getKey() + ": "
                    + e.getMessage(), e);
        }
    }

    private RuntimeException toFailure(EndpointCategory category, int code, String payload) {
        String detail = extractErrorDetail(payload);
        if (code == HTTP_REQUEST_TIMEOUT || code >= HTTP_SERVER_ERROR) {
            log.warn("[XApi] {} transient HTTP {}: {}", category.getKey(), code, detail);
            return new TransientNetworkException(category, "HTTP " + code + ": " + detail);
        }
        log.error("[XApi] {} failed with HTTP {}: {}", category.getKey(), code, detail);
        return new PermanentApiException(category, code, detail);
    }

    private String extractErrorDetail(String payload) {
        if (payload == null || payload.isBlank()) {
            return "empty response";
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root.hasNonNull("detail")) {
                return root.get("detail").asText();
            }
            JsonNode errors = root.path("errors");
            if (errors.isArray() && !errors.isEmpty() && errors.get(0).hasNonNull("message")) {
                return errors.get(0).get("message").asText();
            }
            if (root.hasNonNull("title")) {
                return root.get("title").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("[XApi] Error body is not JSON: {}", e.getOriginalMessage());
        }
        return payload.length() > MAX_ERROR_DETAIL_LENGTH
                ? payload.substring(0, MAX_ERROR_DETAIL_LENGTH) + "..."
                : payload;
    }

    private RateLimitState readRateLimit(Response response) {
        Long resetSeconds = parseHeader(response, HEADER_RESET);
        return RateLimitState.builder()
                .limit(parseHeader(response, HEADER_LIMIT))
                .remaining(parseHeader(response, HEADER_REMAINING))
                .resetAtEpochMillis(resetSeconds != null ? resetSeconds * MILLIS_PER_SECOND : null)
                .observedAtEpochMillis(clock.millis())
                .build();
    }

    private static Long parseHeader(Response response, String name) {
        String value = response.header(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("[XApi] Ignoring malformed {} header: {}", name, value);
            return null;
        }
    }

    private Request.Builder authorized(EndpointCategory category, HttpUrl url) {
        String token = accessTokenPort.getAccessToken();
        if (token == null || token.isBlank()) {
            log.warn("[XApi] {} rejected: access token not configured", category.getKey());
            throw new IllegalStateException("X API access token not configured");
        }
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json");
    }

    private HttpUrl url(String... segments) {
        HttpUrl base = HttpUrl.parse(properties.getXApi().getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid X API base URL: " + properties.getXApi().getBaseUrl());
        }
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private RequestBody jsonBody(Object body) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize X API request", e);
        }
    }

    private static int clampPageSize(int size) {
        return Math.max(MIN_PAGE_SIZE, Math.min(MAX_PAGE_SIZE, size));
    }

    private static PostedTweet toPostedTweet(EndpointCategory category, int statusCode,
            Envelope<TweetData> envelope) {
        TweetData data = envelope.getData();
        if (data == null || data.getId() == null) {
            throw new PermanentApiException(category, statusCode, "Response carried no tweet id");
        }
        return new PostedTweet(data.getId(), data.getText());
    }

    private static MentionPage toPage(Envelope<List<TweetData>> envelope) {
        List<TweetData> data = envelope.getData();
        if (data == null || data.isEmpty()) {
            return MentionPage.empty();
        }
        List<Mention> mentions = new ArrayList<>(data.size());
        for (TweetData tweet : data) {
            mentions.add(toMention(tweet));
        }
        Collections.reverse(mentions);
        return new MentionPage(mentions, mentions.get(mentions.size() - 1).getId());
    }

    private static Mention toMention(TweetData tweet) {
        List<ReferencedTweet> references = new ArrayList<>();
        if (tweet.getReferencedTweets() != null) {
            for (ReferenceData reference : tweet.getReferencedTweets()) {
                references.add(new ReferencedTweet(reference.getType(), reference.getId()));
            }
        }
        return Mention.builder()
                .id(tweet.getId())
                .authorId(tweet.getAuthorId())
                .text(tweet.getText())
                .createdAt(tweet.getCreatedAt())
                .referencedTweets(references)
                .build();
    }

    @FunctionalInterface
    private interface ResponseParser<T> {
        T parse(String payload, int statusCode) throws JsonProcessingException;
    }

    @Data
    @NoArgsConstructor
    private static class Envelope<T> {
        private T data;
    }

    @Data
    @NoArgsConstructor
    private static class TweetData {
        private String id;
        private String text;
        @JsonProperty("author_id")
        private String authorId;
        @JsonProperty("created_at")
        private Instant createdAt;
        @JsonProperty("referenced_tweets")
        private List<ReferenceData> referencedTweets;
    }

    @Data
    @NoArgsConstructor
    private static class ReferenceData {
        private String type;
        private String id;
    }

    @Data
    @NoArgsConstructor
    private static class UserData {
        private String id;
        private String username;
        private String name;
    }

    @Data
    @NoArgsConstructor
    private static class ActionData {
        private Boolean liked;
        private Boolean following;
        @JsonProperty("pending_follow")
        private Boolean pendingFollow;
    }
}
