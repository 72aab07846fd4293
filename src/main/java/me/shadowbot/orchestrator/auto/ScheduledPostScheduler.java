package me.shadowbot.orchestrator.auto;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.shadowbot.orchestrator.domain.exception.QuotaExceededException;
import me.shadowbot.orchestrator.domain.model.ComposedPost;
import me.shadowbot.orchestrator.domain.model.Mention;
import me.shadowbot.orchestrator.domain.model.PostedTweet;
import me.shadowbot.orchestrator.domain.service.BotActivityService;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.PostComposerPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Scheduler for autonomous posting.
 *
 * <p>
 * Every {@code bot.post.interval-minutes} (and once on startup unless
 * {@code bot.post.post-on-startup} is off) a cycle:
 * <ul>
 * <li>reads the bot's own recent posts as context</li>
 * <li>asks the {@link PostComposerPort} for new content</li>
 * <li>publishes it through {@link BotActivityService}, so the post is quota
 * gated and rate limited like every other call</li>
 * </ul>
 *
 * <p>
 * A context read that fails or is over quota leaves the context empty. Cycles
 * never overlap; a tick that finds the previous cycle still running is
 * skipped.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ScheduledPostScheduler {

    private static final String LOG_PREFIX = "[PostScheduler]";
    private static final Pattern HASHTAG = Pattern.compile("#[A-Za-z0-9_]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s{2,}");

    private final BotActivityService activityService;
    private final PostComposerPort postComposer;
    private final BotProperties.PostProperties postProperties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public ScheduledPostScheduler(BotActivityService activityService, PostComposerPort postComposer,
            BotProperties properties) {
        this.activityService = activityService;
        this.postComposer = postComposer;
        this.postProperties = properties.getPost();
    }

    @PostConstruct
    public void init() {
        if (!postProperties.isEnabled()) {
            log.info("{} Scheduled posting disabled", LOG_PREFIX);
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduled-post");
            t.setDaemon(true);
            return t;
        });

        int intervalMinutes = postProperties.getIntervalMinutes();
        long initialDelayMinutes = postProperties.isPostOnStartup() ? 0 : intervalMinutes;
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                initialDelayMinutes,
                intervalMinutes,
                TimeUnit.MINUTES);
        log.info("{} Started with interval {}min, post on startup: {}", LOG_PREFIX, intervalMinutes,
                postProperties.isPostOnStartup());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("{} Shut down", LOG_PREFIX);
    }

    public boolean isScheduled() {
        return tickTask != null && !tickTask.isCancelled();
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("{} Tick skipped: previous cycle still in progress", LOG_PREFIX);
            return;
        }
        try {
            runCycle();
        } catch (QuotaExceededException e) {
            log.info("{} Post skipped: {}", LOG_PREFIX, e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - must not cancel the fixed-rate task
            log.error("{} Cycle failed: {}", LOG_PREFIX, e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Run one compose-and-post cycle.
     *
     * @return the published post, or empty when nothing was composed
     */
    public Optional<PostedTweet> runCycle() {
        List<Mention> context = recentPosts();
        Optional<ComposedPost> composed = postComposer.compose(context);
        if (composed.isEmpty()) {
            log.debug("{} Composer produced nothing", LOG_PREFIX);
            return Optional.empty();
        }

        ComposedPost post = composed.get();
        String text = cleanText(post.text());
        if (text.isEmpty()) {
            log.info("{} Composed post is empty after cleanup, skipping", LOG_PREFIX);
            return Optional.empty();
        }

        PostedTweet posted = post.hasMedia()
                ? activityService.postWithMedia(text, post.mediaIds())
                : activityService.post(text);
        log.info("{} Published scheduled post {}", LOG_PREFIX, posted.id());
        return Optional.of(posted);
    }

    private List<Mention> recentPosts() {
        try {
            return activityService.fetchOwnTimeline().items();
        } catch (RuntimeException e) { // NOSONAR - context is optional
            log.warn("{} Could not read own timeline, composing without context: {}", LOG_PREFIX,
                    e.getMessage());
            return List.of();
        }
    }

    private String cleanText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = postProperties.isStripHashtags() ? HASHTAG.matcher(text).replaceAll("") : text;
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }
}
