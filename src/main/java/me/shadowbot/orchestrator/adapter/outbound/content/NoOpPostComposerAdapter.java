package me.shadowbot.orchestrator.adapter.outbound.content;

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

import lombok.extern.slf4j.Slf4j;
import me.shadowbot.orchestrator.domain.model.ComposedPost;
import me.shadowbot.orchestrator.domain.model.Mention;
import me.shadowbot.orchestrator.port.outbound.PostComposerPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Composer used when no content generator is wired in. Never posts.
 */
@Component
@Slf4j
public class NoOpPostComposerAdapter implements PostComposerPort {

    @Override
    public Optional<ComposedPost> compose(List<Mention> recentPosts) {
        log.debug("[Composer] No composer configured, skipping scheduled post ({} recent posts)",
                recentPosts.size());
        return Optional.empty();
    }
}
