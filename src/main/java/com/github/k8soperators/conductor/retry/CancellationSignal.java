package com.github.k8soperators.conductor.retry;

import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide abort flag. Every sleep in the system goes through {@link #sleep(Duration)} so that an
 * operator-initiated abort unblocks waiting threads within one polling tick.
 */
@ApplicationScoped
public class CancellationSignal {

    private static final Logger log = Logger.getLogger(CancellationSignal.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile String reason;

    public void cancel(String reason) {
        if (latch.getCount() > 0) {
            this.reason = reason;
            log.infof("Cancellation requested: %s", reason);
            latch.countDown();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancelledException(reason);
        }
    }

    public void sleep(Duration duration) {
        throwIfCancelled();

        if (duration.isZero() || duration.isNegative()) {
            return;
        }

        try {
            if (latch.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CancelledException(reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("interrupted");
            throw new CancelledException(reason);
        }
    }
}
