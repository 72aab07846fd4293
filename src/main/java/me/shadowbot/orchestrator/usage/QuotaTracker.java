package me.shadowbot.orchestrator.usage;

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
import me.shadowbot.orchestrator.domain.model.ActivityType;
import me.shadowbot.orchestrator.domain.model.EndpointCategory;
import me.shadowbot.orchestrator.domain.model.QuotaDecision;
import me.shadowbot.orchestrator.domain.model.QuotaSnapshot;
import me.shadowbot.orchestrator.domain.model.QuotaWindow;
import me.shadowbot.orchestrator.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Calendar-aligned usage quotas split by activity type.
 *
 * <p>
 * Two windows are kept:
 * <ul>
 * <li>daily - total posts and replies against {@code D}, plus independent caps
 * {@code floor(D * postRatio)} for posts and {@code floor(D * replyRatio)} for
 * replies</li>
 * <li>monthly - reads against the monthly read limit</li>
 * </ul>
 *
 * <p>
 * Windows reset lazily: every check and every record first compares the
 * current calendar day and month (in {@code bot.quota.zone}) with the stored
 * ones. A granted reservation holds its slot until the caller commits it after
 * the remote call succeeded or releases it after a failure, so concurrent
 * callers cannot overshoot a cap. All access is serialized on this instance.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class QuotaTracker {

    private static final String LOG_PREFIX = "[Quota]";
    private static final int MONTHS_PER_YEAR = 12;

    private final Clock clock;
    private final ZoneId zone;
    private final long dailyPostLimit;
    private final long postCap;
    private final long replyCap;
    private final long monthlyReadLimit;

    private final QuotaWindow dailyWindow;
    private final QuotaWindow monthlyWindow;

    public QuotaTracker(BotProperties properties, Clock clock) {
        BotProperties.QuotaProperties quota = properties.getQuota();
        this.clock = clock;
        this.zone = ZoneId.of(quota.getZone());
        this.dailyPostLimit = quota.getDailyPostLimit();
        this.postCap = (long) Math.floor(quota.getDailyPostLimit() * quota.getPostRatio());
        this.replyCap = (long) Math.floor(quota.getDailyPostLimit() * quota.getReplyRatio());
        this.monthlyReadLimit = quota.getMonthlyReadLimit();
        LocalDate today = today();
        this.dailyWindow = new QuotaWindow(dayUnit(today));
        this.monthlyWindow = new QuotaWindow(monthUnit(today));
    }

    /**
     * Reserve one operation of {@code activity} if it fits the budget. An
     * allowed decision must be followed by exactly one {@link #commit} or
     * {@link #release}.
     */
    public synchronized QuotaDecision tryReserve(EndpointCategory category, ActivityType activity) {
        resetIfBoundaryCrossed();
        if (activity == null) {
            return QuotaDecision.allowed();
        }

        String reason = switch (activity) {
            case READ -> readsInUse() >= monthlyReadLimit
                    ? "Monthly read limit reached (" + monthlyReadLimit + ")"
                    : null;
            case POST -> dailyDenial(ActivityType.POST, postCap, "post");
            case REPLY -> dailyDenial(ActivityType.REPLY, replyCap, "reply");
        };

        if (reason != null) {
            log.warn("{} {} rejected: {}", LOG_PREFIX, category.getKey(), reason);
            return QuotaDecision.denied(reason);
        }
        windowFor(activity).reserve(activity);
        return QuotaDecision.allowed();
    }

    /**
     * Record a reserved operation as used.
     */
    public synchronized void commit(EndpointCategory category, ActivityType activity) {
        resetIfBoundaryCrossed();
        if (activity == null) {
            return;
        }
        windowFor(activity).commit(activity);
        log.debug("{} {} recorded {}: daily={}/{}, monthlyReads={}/{}", LOG_PREFIX, category.getKey(), activity,
                dailyWindow.getCount(), dailyPostLimit, monthlyWindow.used(ActivityType.READ), monthlyReadLimit);
    }

    /**
     * Give back a reserved slot without recording usage.
     */
    public synchronized void release(EndpointCategory category, ActivityType activity) {
        if (activity == null) {
            return;
        }
        if (windowFor(activity).release(activity)) {
            log.debug("{} {} released {} reservation", LOG_PREFIX, category.getKey(), activity);
        }
    }

    /**
     * Zero any window whose calendar unit has changed since it was last
     * touched.
     */
    public synchronized void resetIfBoundaryCrossed() {
        LocalDate today = today();
        if (dailyWindow.rollTo(dayUnit(today))) {
            log.info("{} Daily window reset for {}", LOG_PREFIX, today);
        }
        if (monthlyWindow.rollTo(monthUnit(today))) {
            log.info("{} Monthly window reset for {}-{}", LOG_PREFIX, today.getYear(), today.getMonthValue());
        }
    }

    public synchronized QuotaSnapshot snapshot() {
        resetIfBoundaryCrossed();
        return new QuotaSnapshot(
                dailyWindow.getCount(),
                dailyWindow.used(ActivityType.POST),
                dailyWindow.used(ActivityType.REPLY),
                monthlyWindow.used(ActivityType.READ),
                dailyPostLimit,
                postCap,
                replyCap,
                monthlyReadLimit);
    }

    private String dailyDenial(ActivityType activity, long cap, String label) {
        if (dailyWindow.getCount() + dailyWindow.pendingTotal() >= dailyPostLimit) {
            return "Daily limit reached (" + dailyPostLimit + ")";
        }
        if (dailyWindow.used(activity) + dailyWindow.pending(activity) >= cap) {
            return "Daily " + label + " cap reached (" + cap + ")";
        }
        return null;
    }

    private long readsInUse() {
        return monthlyWindow.used(ActivityType.READ) + monthlyWindow.pending(ActivityType.READ);
    }

    private QuotaWindow windowFor(ActivityType activity) {
        return activity == ActivityType.READ ? monthlyWindow : dailyWindow;
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zone);
    }

    private static long dayUnit(LocalDate date) {
        return date.toEpochDay();
    }

    private static long monthUnit(LocalDate date) {
        return (long) date.getYear() * MONTHS_PER_YEAR + date.getMonthValue();
    }
}
