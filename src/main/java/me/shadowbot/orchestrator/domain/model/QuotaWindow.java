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

import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Calendar-aligned usage counters for one window (a day or a month).
 *
 * <p>
 * The window does not run a timer. The owner compares
 * {@link #getWindowStartCalendarUnit()} with the current calendar unit on every
 * access and calls {@link #rollTo(long)} when they differ. Reserved operations
 * that are still in flight count against the window until they are committed
 * or released; a roll keeps them. Not thread-safe; the owning tracker
 * serializes access.
 *
 * @since 1.0
 */
@Getter
public class QuotaWindow {

    private long windowStartCalendarUnit;
    private long count;
    private final Map<ActivityType, Long> usedByActivity = new EnumMap<>(ActivityType.class);
    private final Map<ActivityType, Long> pendingByActivity = new EnumMap<>(ActivityType.class);

    public QuotaWindow(long windowStartCalendarUnit) {
        this.windowStartCalendarUnit = windowStartCalendarUnit;
    }

    /**
     * Zero all counters if {@code calendarUnit} differs from the stored unit.
     *
     * @return {@code true} when the window was reset
     */
    public boolean rollTo(long calendarUnit) {
        if (calendarUnit == windowStartCalendarUnit) {
            return false;
        }
        windowStartCalendarUnit = calendarUnit;
        count = 0;
        usedByActivity.clear();
        return true;
    }

    public void record(ActivityType activity) {
        count++;
        usedByActivity.merge(activity, 1L, Long::sum);
    }

    public void reserve(ActivityType activity) {
        pendingByActivity.merge(activity, 1L, Long::sum);
    }

    /**
     * Drop one in-flight reservation of {@code activity}, if any.
     *
     * @return {@code true} when a reservation was dropped
     */
    public boolean release(ActivityType activity) {
        long pending = pending(activity);
        if (pending == 0) {
            return false;
        }
        pendingByActivity.put(activity, pending - 1);
        return true;
    }

    /**
     * Turn one reservation of {@code activity} into recorded usage.
     */
    public void commit(ActivityType activity) {
        release(activity);
        record(activity);
    }

    public long used(ActivityType activity) {
        return usedByActivity.getOrDefault(activity, 0L);
    }

    public long pending(ActivityType activity) {
        return pendingByActivity.getOrDefault(activity, 0L);
    }

    public long pendingTotal() {
        long total = 0;
        for (long pending : pendingByActivity.values()) {
            total += pending;
        }
        return total;
    }
}
