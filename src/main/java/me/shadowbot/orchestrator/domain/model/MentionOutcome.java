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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Result of handling one mention.
 *
 * @since 1.0
 */
@Data
@Builder
public class MentionOutcome {

    private String mentionId;
    private Status status;
    private String replyId;
    private String detail;
    private Instant handledAt;

    public enum Status {
        REPLIED,
        SKIPPED
    }

    public static MentionOutcome replied(String mentionId, String replyId, Instant handledAt) {
        return MentionOutcome.builder()
                .mentionId(mentionId)
                .status(Status.REPLIED)
                .replyId(replyId)
                .handledAt(handledAt)
                .build();
    }

    public static MentionOutcome skipped(String mentionId, String detail, Instant handledAt) {
        return MentionOutcome.builder()
                .mentionId(mentionId)
                .status(Status.SKIPPED)
                .detail(detail)
                .handledAt(handledAt)
                .build();
    }
}
