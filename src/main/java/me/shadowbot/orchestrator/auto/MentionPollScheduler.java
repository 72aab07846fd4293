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
import me.shadowbot.orchestrator.domain.exception.RateLimitExceededException;
import me.shadowbot.orchestrator.domain.exception.RateLimitedException;
import me.shadowbot.orchestrator.domain.model.Mention;
import me.shadowbot.orchestrator.domain.model.MentionOutcome;
import me.shadowbot.orchestrator.domain.model.MentionPage;
import me.shadowbot.orchestrator.domain.model.PollState;
import me.shadowbot.orchestrator.domain.model.ReferencedTweet;
import me.shadowbot.orchestrator.domain.service.BotActivityService;
import me.shadowbot.orchestrator.domain.service.IdentityCache;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import me.shadowbot.orchestrator.port.outbound.MentionHandlerPort;
import me.shadowbot.orchestrator.port.outbound.PersistencePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Self-rescheduling mention poll loop.
 *
 * <p>
 * Each cycle fetches mentions since the persisted cursor, hands every mention
 * that is neither authored by the bot nor referencing a bot post to the
 * {@link MentionHandlerPort}, and advances the cursor after each item. Handled
 * items are spaced by a fixed pacing delay, which a stop request cuts short.
 *
 * <p>
 * The next delay is computed after every cycle, whatever happened in it:
 * <ul>
 * <li>no throttling - the configured default interval</li>
 * <li>throttled with a reset time - the time until reset, capped</li>
 * <li>throttled without a reset time - twice the current interval, capped</li>
 * </ul>
 * No exception escapes the loop. Cycles run on one daemon thread and never
 * overlap; {@link #stop()} ends the loop after the in-flight cycle.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class MentionPollScheduler {

    private static final String LOG_PREFIX = "[Poll]";

    private final BotActivityService activityService;
    private final IdentityCache identityCache;
    private final MentionHandlerPort mentionHandler;
    private final PersistencePort persistencePort;
    private final Clock clock;
    private final BotProperties.PollProperties pollProperties;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile PollState state = PollState.IDLE;
    private volatile long currentIntervalMs;
    private volatile Thread loopThread;

    public MentionPollScheduler(BotActivityService activityService, IdentityCache identityCache,
            MentionHandlerPort mentionHandler, PersistencePort persistencePort, Clock clock,
            BotProperties properties) {
        this.activityService = activityService;
        this.identityCache = identityCache;
        this.mentionHandler = mentionHandler;
        this.persistencePort = persistencePort;
        this.clock = clock;
        this.pollProperties = properties.getPoll();
        this.currentIntervalMs = pollProperties.getDefaultIntervalMs();
    }

    @PostConstruct
    public void start() {
        if (!pollProperties.isEnabled()) {
            log.info("{} Mention polling disabled", LOG_PREFIX);
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        loopThread = new Thread(this::runLoop, "mention-poll");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("{} Started with default interval {}ms", LOG_PREFIX, pollProperties.getDefaultIntervalMs());
    }

    @PreDestroy
    public void stop() {
        stopSignal.countDown();
        log.info("{} Stop requested", LOG_PREFIX);
    }

    public PollState getState() {
        return state;
    }

    public long getCurrentIntervalMs() {
        return currentIntervalMs;
    }

    public boolean isRunning() {
        Thread thread = loopThread;
        return thread != null && thread.isAlive();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    void runLoop() {
        while (!isStopRequested()) {
            long delayMs = runCycle();
            log.debug("{} Next poll in {}ms", LOG_PREFIX, delayMs);
            try {
                if (stopSignal.await(delayMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("{} Stopped", LOG_PREFIX);
    }

    /**
     * Run one fetch-and-process cycle.
     *
     * @return delay in milliseconds before the next cycle
     */
    public long runCycle() {
        Throttle throttle = null;
        try {
            state = PollState.FETCHING;
            String selfId = identityCache.getCachedIdentity();
            String cursor = persistencePort.loadCursor().orElse(null);
            MentionPage page = activityService.fetchMentions(cursor);

            if (page.isEmpty()) {
                log.debug("{} No new mentions since {}", LOG_PREFIX, cursor);
            } else {
                state = PollState.PROCESSING;
                log.info("{} Processing {} mention(s) since {}", LOG_PREFIX, page.items().size(), cursor);
                throttle = processPage(page, selfId);
            }
        } catch (RuntimeException e) { // NOSONAR - must not kill the poll loop
            throttle = throttleOf(e);
            log.error("{} Cycle failed: {}", LOG_PREFIX, e.getMessage(), e);
        } finally {
            state = PollState.IDLE;
            currentIntervalMs = nextInterval(throttle);
        }
        return currentIntervalMs;
    }

    private Throttle processPage(MentionPage page, String selfId) {
        Throttle throttle = null;
        boolean pacingDue = false;
        for (Mention mention : page.items()) {
            if (isStopRequested()) {
                log.info("{} Stop requested, leaving remaining mentions for the next run", LOG_PREFIX);
                break;
            }
            if (shouldSkip(mention, selfId)) {
                advanceCursor(mention.getId());
                continue;
            }
            if (pacingDue && !pace()) {
                log.info("{} Stop requested while pacing, leaving remaining mentions for the next run", LOG_PREFIX);
                break;
            }
            Throttle itemThrottle = handle(mention);
            if (itemThrottle != null) {
                throttle = itemThrottle;
            }
            advanceCursor(mention.getId());
            pacingDue = true;
        }
        return throttle;
    }

    private boolean shouldSkip(Mention mention, String selfId) {
        if (mention.isAuthoredBy(selfId)) {
            log.debug("{} Skipping own mention {}", LOG_PREFIX, mention.getId());
            return true;
        }
        if (mention.getReferencedTweets() == null) {
            return false;
        }
        for (ReferencedTweet reference : mention.getReferencedTweets()) {
            if (reference.id() != null && persistencePort.isOwnPost(reference.id())) {
                log.debug("{} Skipping mention {} referencing own post {}", LOG_PREFIX, mention.getId(),
                        reference.id());
                return true;
            }
        }
        return false;
    }

    private Throttle handle(Mention mention) {
        try {
            MentionOutcome outcome = mentionHandler.handle(mention);
            if (outcome != null) {
                recordOutcome(outcome);
            }
            return null;
        } catch (RuntimeException e) { // NOSONAR - one failed mention must not stop the page
            log.error("{} Handler failed for mention {}: {}", LOG_PREFIX, mention.getId(), e.getMessage(), e);
            return throttleOf(e);
        }
    }

    private void recordOutcome(MentionOutcome outcome) {
        try {
            persistencePort.recordMentionOutcome(outcome);
        } catch (RuntimeException e) { // NOSONAR - best-effort
            log.warn("{} Failed to record outcome for {}: {}", LOG_PREFIX, outcome.getMentionId(), e.getMessage());
        }
    }

    private void advanceCursor(String mentionId) {
        try {
            persistencePort.saveCursor(mentionId);
        } catch (RuntimeException e) { // NOSONAR - best-effort
            log.error("{} Failed to save cursor {}: {}", LOG_PREFIX, mentionId, e.getMessage());
        }
    }

    /**
     * Wait the pacing delay before the next item.
     *
     * @return {@code false} when a stop was requested during the wait
     */
    private boolean pace() {
        try {
            return !stopSignal.await(pollProperties.getItemPacingMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Mention pacing interrupted", e);
        }
    }

    private long nextInterval(Throttle throttle) {
        long max = pollProperties.getMaxIntervalMs();
        if (throttle == null) {
            return pollProperties.getDefaultIntervalMs();
        }
        if (throttle.resetAtEpochMillis() != null) {
            long untilReset = Math.max(0L, throttle.resetAtEpochMillis() - clock.millis());
            log.warn("{} Throttled, next poll at reset in {}ms", LOG_PREFIX, Math.min(untilReset, max));
            return Math.min(untilReset, max);
        }
        long stretched = Math.min(currentIntervalMs * 2, max);
        log.warn("{} Throttled without reset time, stretching interval to {}ms", LOG_PREFIX, stretched);
        return stretched;
    }

    private static Throttle throttleOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof RateLimitExceededException exceeded) {
                return new Throttle(exceeded.getLastResetAtEpochMillis());
            }
            if (current instanceof RateLimitedException limited) {
                return new Throttle(limited.getResetAtEpochMillis());
            }
            current = current.getCause();
        }
        return null;
    }

    private record Throttle(Long resetAtEpochMillis) {
    }
}
