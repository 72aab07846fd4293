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

import me.shadowbot.orchestrator.domain.model.ActivityMetricsSnapshot;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.MentionOutcome;
import me.shadowbot.orchestrator.domain.model.RateLimitState;

import java.util.Optional;

/**
 * Port for the bot's durable state: the mention cursor, observed rate-limit
 * headers, the set of posts the bot authored, handled mention outcomes and
 * periodic metric snapshots.
 *
 * <p>
 * Implementations must be safe to call from the poll loop and from endpoint
 * lanes concurrently.
 */
public interface PersistencePort {

    /**
     * Load the last processed mention id, if any.
     */
    Optional<String> loadCursor();

    /**
     * Persist the last processed mention id. Must survive a crash mid-write.
     */
    void saveCursor(String mentionId);

    /**
     * Record the most recent rate-limit headers seen for a category.
     */
    void recordRateLimitObservation(EndpointCategory category, RateLimitState state);

    /**
     * Remember a tweet id authored by the bot.
     */
    void recordOwnPost(String tweetId);

    /**
     * Check whether a tweet id was authored by the bot.
     */
    boolean isOwnPost(String tweetId);

    /**
     * Append the outcome of a handled mention.
     */
    void recordMentionOutcome(MentionOutcome outcome);

    /**
     * Append a metrics snapshot.
     */
    void recordMetrics(ActivityMetricsSnapshot snapshot);
}
