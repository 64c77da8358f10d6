package io.ticketflow.agent;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared by the work loop and agents. Once cancelled it stays
 * cancelled.
 */
public final class CancellationToken {
    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel(String why) {
        if (reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            latch.countDown();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0L;
    }

    public String reason() {
        return reason.get();
    }
}
