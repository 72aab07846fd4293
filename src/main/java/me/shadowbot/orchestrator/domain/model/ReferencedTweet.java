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
 * Reference from a post to another post.
 *
 * @param type
 *            {@code replied_to}, {@code quoted} or {@code retweeted}
 * @param id
 *            referenced post id
 */
public record ReferencedTweet(String type, String id) {

    public static final String REPLIED_TO = "replied_to";
    public static final String QUOTED = "quoted";
}
