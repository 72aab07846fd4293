package me.shadowbot.orchestrator.adapter.outbound.handler;

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
import me.shadowbot.orchestrator.domain.model.Mention;
import me.shadowbot.orchestrator.domain.model.MentionOutcome;
import me.shadowbot.orchestrator.domain.model.PostedTweet;
import me.shadowbot.orchestrator.domain.service.BotActivityService;
import me.shadowbot.orchestrator.port.outbound.MentionHandlerPort;
import me.shadowbot.orchestrator.port.outbound.ReplyComposerPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Replies to a mention with text from the {@link ReplyComposerPort}. A mention
 * without composed text is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplyingMentionHandler implements MentionHandlerPort {

    private final ReplyComposerPort replyComposer;
    private final BotActivityService activityService;
    private final Clock clock;

    @Override
    public MentionOutcome handle(Mention mention) {
        Optional<String> text = replyComposer.compose(mention)
                .filter(candidate -> !candidate.isBlank());
        if (text.isEmpty()) {
            log.debug("[MentionHandler] Nothing to say to {}", mention.getId());
            return MentionOutcome.skipped(mention.getId(), "No reply composed", clock.instant());
        }

        PostedTweet reply = activityService.reply(mention.getId(), text.get());
        log.info("[MentionHandler] Replied to {} from {} with {}", mention.getId(), mention.getAuthorId(),
                reply.id());
        return MentionOutcome.replied(mention.getId(), reply.id(), clock.instant());
    }
}
