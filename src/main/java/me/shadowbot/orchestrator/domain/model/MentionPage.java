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
 * One page of mentions, oldest first.
 *
 * @param items
 *            mentions in processing order
 * @param nextCursor
 *            newest id on the page, {@code null} when the page is empty
 */
public record MentionPage(List<Mention> items, String nextCursor) {

    public MentionPage {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static MentionPage empty() {
        return new MentionPage(List.of(), null);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
