package trader.aggregator.service.source;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window admission counter: at most {@code limit} admissions inside any {@code windowMillis} span.
 */
public class RateLimiter {

    private final int limit;
    private final long windowMillis;
    private final Deque<Long> admissions = new ArrayDeque<>();

    public RateLimiter(int limit, long windowMillis) {
        if (limit <= 0 || windowMillis <= 0) {
            throw new IllegalArgumentException("Rate limit and window must be positive");
        }
        this.limit = limit;
        this.windowMillis = windowMillis;
    }

    public synchronized boolean canAdmit(long now) {
        prune(now);
        return admissions.size() < limit;
    }

    public synchronized void record(long now) {
        admissions.addLast(now);
    }

    /**
     * Checks and records in one step.
     */
    public synchronized boolean tryAcquire(long now) {
        if (!canAdmit(now)) {
            return false;
        }
        record(now);
        return true;
    }

    public synchronized int inFlightCount(long now) {
        prune(now);
        return admissions.size();
    }

    public int getLimit() {
        return limit;
    }

    public long getWindowMillis() {
        return windowMillis;
    }

    private void prune(long now) {
        long windowStart = now - windowMillis;
        while (!admissions.isEmpty() && admissions.peekFirst() <= windowStart) {
            admissions.pollFirst();
        }
    }
}
