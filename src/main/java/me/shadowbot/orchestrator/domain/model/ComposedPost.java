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
 * Text and optional media ids produced for an autonomous post.
 *
 * @since 1.0
 */
public record ComposedPost(String text, List<String> mediaIds) {

    public ComposedPost {
        mediaIds = mediaIds == null ? List.of() : List.copyOf(mediaIds);
    }

    public static ComposedPost text(String text) {
        return new ComposedPost(text, List.of());
    }

    public boolean hasMedia() {
        return !mediaIds.isEmpty();
    }
}
