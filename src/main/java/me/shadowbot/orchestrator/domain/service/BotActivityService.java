package me.shadowbot.orchestrator.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.MentionPage;
import me.shadowbot.orchestrator.domain.model.PostedTweet;
import me.shadowbot.orchestrator.domain.model.TweetDraft;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.PersistencePort;
import me.shadowbot.orchestrator.port.outbound.SocialApiPort;
import me.shadowbot.orchestrator.usage.ActivityMetrics;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Bot-level operations against the social API.
 *
 * <p>
 * Every call goes through {@link RequestOrchestrator}. Posts and replies
 * created here are remembered as own posts for the mention poller.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotActivityService {

    private final RequestOrchestrator orchestrator;
    private final SocialApiPort socialApiPort;
    private final IdentityCache identityCache;
    private final PersistencePort persistencePort;
    private final ActivityMetrics metrics;
    private final BotProperties properties;

    public PostedTweet post(String text) {
        requireText(text);
        TweetDraft draft = TweetDraft.text(text);
        PostedTweet posted = requirePosted(EndpointCategory.TWEET,
                orchestrator.execute(EndpointCategory.TWEET, draft, () -> socialApiPort.post(draft)));
        metrics.recordTweetPosted();
        rememberOwnPost(posted);
        log.info("[Activity] posted tweet {}", posted.id());
        return posted;
    }

    public PostedTweet postWithMedia(String text, List<String> mediaIds) {
        requireText(text);
        if (mediaIds == null || mediaIds.isEmpty()) {
            throw new IllegalArgumentException("At least one media id is required");
        }
        TweetDraft draft = new TweetDraft(text, mediaIds);
        PostedTweet posted = requirePosted(EndpointCategory.TWEET,
                orchestrator.execute(EndpointCategory.TWEET, draft, () -> socialApiPort.post(draft)));
        metrics.recordTweetPosted();
        rememberOwnPost(posted);
        log.info("[Activity] posted tweet {} with {} media", posted.id(), mediaIds.size());
        return posted;
    }

    public PostedTweet reply(String targetId, String text) {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Reply target id is required");
        }
        requireText(text);
        TweetDraft draft = TweetDraft.text(text);
        PostedTweet posted = requirePosted(EndpointCategory.REPLY, orchestrator.execute(EndpointCategory.REPLY, draft,
                () -> socialApiPort.reply(targetId, draft)));
        metrics.recordReplySent();
        rememberOwnPost(posted);
        log.info("[Activity] replied to {} with {}", targetId, posted.id());
        return posted;
    }

    public boolean like(String tweetId) {
        String userId = identityCache.getCachedIdentity();
        Boolean liked = orchestrator.execute(EndpointCategory.LIKE, tweetId,
                () -> socialApiPort.like(userId, tweetId));
        return Boolean.TRUE.equals(liked);
    }

    public boolean follow(String targetUserId) {
        String userId = identityCache.getCachedIdentity();
        Boolean following = orchestrator.execute(EndpointCategory.FOLLOW, targetUserId,
                () -> socialApiPort.follow(userId, targetUserId));
        return Boolean.TRUE.equals(following);
    }

    /**
     * Mentions newer than {@code sinceId}, oldest first.
     */
    public MentionPage fetchMentions(String sinceId) {
        String userId = identityCache.getCachedIdentity();
        MentionPage page = orchestrator.execute(EndpointCategory.MENTIONS, sinceId,
                () -> socialApiPort.listMentions(userId, sinceId));
        return page != null ? page : MentionPage.empty();
    }

    public MentionPage fetchOwnTimeline() {
        String userId = identityCache.getCachedIdentity();
        int max = properties.getXApi().getTimelinePageSize();
        MentionPage page = orchestrator.execute(EndpointCategory.TIMELINE, userId,
                () -> socialApiPort.userTimeline(userId, max));
        return page != null ? page : MentionPage.empty();
    }

    private void rememberOwnPost(PostedTweet posted) {
        try {
            persistencePort.recordOwnPost(posted.id());
        } catch (RuntimeException e) { // NOSONAR - best-effort
            log.warn("[Activity] failed to remember own post {}: {}", posted.id(), e.getMessage());
        }
    }

    private static PostedTweet requirePosted(EndpointCategory category, PostedTweet posted) {
        if (posted == null || posted.id() == null) {
            throw new IllegalStateException("No tweet id returned for " + category.getKey());
        }
        return posted;
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Tweet text must not be blank");
        }
    }
}
