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

import me.shadowbot.orchestrator.domain.model.ComposedPost;
import me.shadowbot.orchestrator.domain.model.Mention;

import java.util.List;
import java.util.Optional;

/**
 * Produces the content of a scheduled post from the bot's recent posts. An
 * empty result skips the cycle.
 */
public interface PostComposerPort {

    /**
     * @param recentPosts
     *            latest own posts, oldest first; empty when the timeline could
     *            not be read
     */
    Optional<ComposedPost> compose(List<Mention> recentPosts);
}
