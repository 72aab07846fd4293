package me.shadowbot.orchestrator.domain.model;

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

/**
 * Class of remote calls sharing one provider rate-limit bucket.
 *
 * <p>
 * Each category owns one execution lane in the endpoint queue and one
 * {@link RateLimitState} entry. Categories that consume a usage quota carry
 * the corresponding {@link ActivityType}; the rest are only rate limited.
 *
 * @since 1.0
 */
public enum EndpointCategory {

    TWEET("tweet", ActivityType.POST),
    REPLY("reply", ActivityType.REPLY),
    MENTIONS("mentions", null),
    USER_LOOKUP("user-lookup", null),
    LIKE("like", null),
    FOLLOW("follow", null),
    TIMELINE("timeline", ActivityType.READ);

    private final String key;
    private final ActivityType activityType;

    EndpointCategory(String key, ActivityType activityType) {
        this.key = key;
        this.activityType = activityType;
    }

    public String getKey() {
        return key;
    }

    /**
     * Quota sub-category, or {@code null} when the category is not quota gated.
     */
    public ActivityType getActivityType() {
        return activityType;
    }

    public boolean isQuotaGated() {
        return activityType != null;
    }
}
