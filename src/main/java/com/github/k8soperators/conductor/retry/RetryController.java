package com.github.k8soperators.conductor.retry;

import com.github.k8soperators.conductor.model.RetryPolicy;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Wraps every call into the platform or the secrets engine. Transient failures are retried with exponential
 * backoff up to {@link RetryPolicy#getMaxAttempts()}; conflicts and fatal failures are raised immediately as an
 * {@link OrchestrationException} of the corresponding {@link FailureKind} so the caller can decide on recovery.
 */
@ApplicationScoped
public class RetryController {

    private static final Logger log = Logger.getLogger(RetryController.class);

    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int attempt, OrchestrationException cause);
    }

    private static final RetryListener NO_LISTENER = (attempt, cause) -> { };

    private final CancellationSignal cancellation;

    @Inject
    public RetryController(CancellationSignal cancellation) {
        this.cancellation = cancellation;
    }

    public <T> T execute(String operation, RetryPolicy policy, Callable<T> call) {
        return execute(operation, policy, call, NO_LISTENER);
    }

    public <T> T execute(String operation, RetryPolicy policy, Callable<T> call, RetryListener listener) {
        int maxAttempts = policy.getMaxAttempts();

        for (int attempt = 1; ; attempt++) {
            cancellation.throwIfCancelled();

            try {
                return call.call();
            } catch (CancelledException e) {
                throw e;
            } catch (Exception e) {
                FailureKind kind = FailureClassifier.classify(e);
                OrchestrationException failure = wrap(kind, operation, e);

                if (kind != FailureKind.TRANSIENT) {
                    log.debugf("%s failed with %s failure: %s", operation, kind, e.getMessage());
                    throw failure;
                }

                if (attempt >= maxAttempts) {
                    throw new OrchestrationException(FailureKind.TRANSIENT,
                            String.format("%s: gave up after %d attempt(s): %s", operation, attempt, e.getMessage()),
                            e);
                }

                Duration delay = policy.backoff(attempt);
                log.warnf("%s failed (attempt %d/%d), retrying in %s: %s", operation, attempt, maxAttempts, delay, e.getMessage());
                listener.onRetry(attempt, failure);
                cancellation.sleep(delay);
            }
        }
    }

    public void run(String operation, RetryPolicy policy, Runnable call) {
        run(operation, policy, call, NO_LISTENER);
    }

    public void run(String operation, RetryPolicy policy, Runnable call, RetryListener listener) {
        execute(operation, policy, () -> {
            call.run();
            return null;
        }, listener);
    }

    static OrchestrationException wrap(FailureKind kind, String operation, Exception error) {
        if (error instanceof OrchestrationException && ((OrchestrationException) error).isKind(kind)) {
            return (OrchestrationException) error;
        }
        return new OrchestrationException(kind, operation + ": " + error.getMessage(), error);
    }
}
