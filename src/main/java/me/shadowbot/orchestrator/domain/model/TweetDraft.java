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

import java.util.List;

/**
 * Outbound post content. Text generation and media upload happen elsewhere;
 * this carries only the finished text and already uploaded media ids.
 */
public record TweetDraft(String text, List<String> mediaIds) {

    public TweetDraft {
        mediaIds = mediaIds != null ? List.copyOf(mediaIds) : List.of();
    }

    public static TweetDraft text(String text) {
        return new TweetDraft(text, List.of());
    }

    public boolean hasMedia() {
        return !mediaIds.isEmpty();
    }
}
