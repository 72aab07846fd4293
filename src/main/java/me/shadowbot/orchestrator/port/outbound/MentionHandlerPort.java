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

import me.shadowbot.orchestrator.domain.model.Mention;
import me.shadowbot.orchestrator.domain.model.MentionOutcome;

/**
 * Reacts to a single mention picked up by the poll loop.
 */
public interface MentionHandlerPort {

    /**
     * Handle one mention. Exceptions are logged by the caller and do not stop
     * the page from being processed.
     */
    MentionOutcome handle(Mention mention);
}
