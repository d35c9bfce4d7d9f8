package com.shopstream.engine;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot shutdown flag shared by all pipeline threads.
 *
 * <p>Backoff waits go through {@link #sleep(long)} so that a shutdown cuts them short
 * instead of holding the process open.</p>
 */
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void trigger() {
        latch.countDown();
    }

    public boolean isTriggered() {
        return latch.getCount() == 0;
    }

    /**
     * Waits for {@code millis} or until shutdown, whichever comes first.
     *
     * @return {@code true} if the full delay elapsed, {@code false} if shutdown was signalled
     */
    public boolean sleep(long millis) throws InterruptedException {
        return !latch.await(millis, TimeUnit.MILLISECONDS);
    }
}
