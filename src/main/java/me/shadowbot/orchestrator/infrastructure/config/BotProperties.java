package me.shadowbot.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix. Nested
 * property classes cover:
 * <ul>
 * <li>{@link StorageProperties} - local workspace for persisted state</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link XApiProperties} - remote social API endpoint and token</li>
 * <li>{@link QuotaProperties} - daily/monthly usage budgets</li>
 * <li>{@link RetryProperties} - throttling retry policy</li>
 * <li>{@link QueueProperties} - per-category endpoint lanes</li>
 * <li>{@link PollProperties} - mention polling loop</li>
 * <li>{@link PostProperties} - scheduled autonomous posting</li>
 * <li>{@link IdentityProperties} - own identity cache</li>
 * <li>{@link MetricsProperties} - activity counter snapshots</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private XApiProperties xApi = new XApiProperties();
    private QuotaProperties quota = new QuotaProperties();
    private RetryProperties retry = new RetryProperties();
    private QueueProperties queue = new QueueProperties();
    private PollProperties poll = new PollProperties();
    private PostProperties post = new PostProperties();
    private IdentityProperties identity = new IdentityProperties();
    private MetricsProperties metrics = new MetricsProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.shadowbot/workspace";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class XApiProperties {
        private String baseUrl = "https://api.twitter.com";
        private String bearerToken = "";
        private int mentionsPageSize = 20;
        private int timelinePageSize = 5;
    }

    @Data
    public static class QuotaProperties {
        private int dailyPostLimit = 100;
        private double postRatio = 0.2;
        private double replyRatio = 0.8;
        private int monthlyReadLimit = 100;
        private String zone = "UTC";
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private long resetBufferMs = 1000;
        private List<Long> backoffScheduleMs = new ArrayList<>(List.of(1000L, 5000L, 15000L, 30000L, 60000L));
    }

    @Data
    public static class QueueProperties {
        private int maxPendingPerCategory = 100;
    }

    @Data
    public static class PollProperties {
        private boolean enabled = true;
        private long defaultIntervalMs = 60000;
        private long maxIntervalMs = 3600000;
        private long itemPacingMs = 15000;
    }

    @Data
    public static class PostProperties {
        private boolean enabled = false;
        private boolean postOnStartup = true;
        private int intervalMinutes = 240;
        private boolean stripHashtags = true;
    }

    @Data
    public static class IdentityProperties {
        private long ttlMs = 300000;
    }

    @Data
    public static class MetricsProperties {
        private boolean enabled = true;
        private int snapshotIntervalMinutes = 60;
    }
}
