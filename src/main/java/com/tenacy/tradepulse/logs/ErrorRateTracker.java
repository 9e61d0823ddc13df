package com.tenacy.tradepulse.logs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling error counters over the last hour and the last ten minutes.
 */
public class ErrorRateTracker {

    static final Duration HOUR_WINDOW = Duration.ofHours(1);
    static final Duration SHORT_WINDOW = Duration.ofMinutes(10);

    private final Clock clock;
    private final Deque<Instant> errorTimestamps = new ArrayDeque<>();
    private ErrorCounts counts = ErrorCounts.none();

    public ErrorRateTracker(Clock clock) {
        this.clock = clock;
    }

    public synchronized void recordError() {
        errorTimestamps.addLast(clock.instant());
    }

    /**
     * Drops timestamps older than an hour and recomputes both counters.
     */
    public synchronized ErrorCounts cleanup() {
        Instant now = clock.instant();
        Instant hourAgo = now.minus(HOUR_WINDOW);
        Instant tenMinutesAgo = now.minus(SHORT_WINDOW);

        while (!errorTimestamps.isEmpty() && !errorTimestamps.peekFirst().isAfter(hourAgo)) {
            errorTimestamps.pollFirst();
        }

        int recent = (int) errorTimestamps.stream().filter(ts -> ts.isAfter(tenMinutesAgo)).count();
        counts = new ErrorCounts(errorTimestamps.size(), recent);
        return counts;
    }

    /**
     * Counters as of the last cleanup.
     */
    public synchronized ErrorCounts getCounts() {
        return new ErrorCounts(counts.getLastHour(), counts.getLast10Minutes());
    }
}
