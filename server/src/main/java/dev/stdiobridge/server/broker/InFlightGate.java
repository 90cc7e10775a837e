package dev.stdiobridge.server.broker;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of writes to the child in progress at once. Waiters poll with a short sleep
 * instead of queueing, so there is no fairness between them.
 */
public class InFlightGate {

    private final int maxPermits;
    private final long pollMillis;
    private final AtomicInteger inUse = new AtomicInteger();

    public InFlightGate(int maxPermits, Duration pollInterval) {
        if (maxPermits < 1) {
            throw new IllegalArgumentException("maxPermits must be positive");
        }
        this.maxPermits = maxPermits;
        this.pollMillis = Math.max(1, pollInterval.toMillis());
    }

    public void acquire() throws InterruptedException {
        while (!tryAcquire()) {
            Thread.sleep(pollMillis);
        }
    }

    public boolean tryAcquire() {
        while (true) {
            int current = inUse.get();
            if (current >= maxPermits) {
                return false;
            }
            if (inUse.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release() {
        inUse.updateAndGet(current -> Math.max(0, current - 1));
    }

    public int inUse() {
        return inUse.get();
    }

    public int maxPermits() {
        return maxPermits;
    }
}
