package me.shadowbot.orchestrator.port.outbound;

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

import me.shadowbot.orchestrator.domain.model.ApiResponse;
import me.shadowbot.orchestrator.domain.model.MentionPage;
import me.shadowbot.orchestrator.domain.model.PostedTweet;
import me.shadowbot.orchestrator.domain.model.TweetDraft;
import me.shadowbot.orchestrator.domain.model.UserIdentity;

/**
 * Port for the social network API. Each call performs exactly one HTTP request
 * and reports the rate-limit headers that came back with it.
 *
 * <p>
 * Failures are signalled with the orchestration exception hierarchy:
 * {@link me.shadowbot.orchestrator.domain.exception.RateLimitedException} for
 * throttling,
 * {@link me.shadowbot.orchestrator.domain.exception.TransientNetworkException}
 * for retryable transport errors and
 * {@link me.shadowbot.orchestrator.domain.exception.PermanentApiException} for
 * everything else.
 */
public interface SocialApiPort {

    ApiResponse<PostedTweet> post(TweetDraft draft);

    ApiResponse<PostedTweet> reply(String targetId, TweetDraft draft);

    /**
     * Fetch mentions of {@code userId} newer than {@code sinceId}, oldest
     * first.
     *
     * @param sinceId
     *            exclusive lower bound, {@code null} for the most recent page
     */
    ApiResponse<MentionPage> listMentions(String userId, String sinceId);

    ApiResponse<UserIdentity> getIdentity();

    ApiResponse<Boolean> like(String userId, String tweetId);

    ApiResponse<Boolean> follow(String userId, String targetUserId);

    ApiResponse<MentionPage> userTimeline(String userId, int maxResults);
}
