package com.github.k8soperators.conductor.readiness;

import com.github.k8soperators.conductor.model.ReadinessCheck;
import com.github.k8soperators.conductor.retry.CancellationSignal;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;
import javax.inject.Inject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Polls readiness checks at a fixed interval until every required check is satisfied or one of them runs out of
 * time. Each check keeps its own deadline, capped by the phase timeout. Optional checks that time out are reported
 * as warnings and never close the gate.
 */
@ApplicationScoped
public class ReadinessGate {

    private static final Logger log = Logger.getLogger(ReadinessGate.class);

    private final ReadinessProbe probe;
    private final CancellationSignal cancellation;
    private final Duration pollInterval;

    @Inject
    public ReadinessGate(ReadinessProbe probe,
            CancellationSignal cancellation,
            @ConfigProperty(name = "conductor.readiness.poll-interval", defaultValue = "5S") Duration pollInterval) {
        this.probe = probe;
        this.cancellation = cancellation;
        this.pollInterval = pollInterval;
    }

    /**
     * @throws com.github.k8soperators.conductor.retry.CancelledException when the run is aborted while waiting
     */
    public GateResult waitFor(List<ReadinessCheck> checks, Duration timeout) {
        if (checks.isEmpty()) {
            return GateResult.skipped();
        }

        long start = System.nanoTime();
        Map<ReadinessCheck, Long> deadlines = new LinkedHashMap<>();
        for (ReadinessCheck check : checks) {
            Duration budget = check.getTimeout().compareTo(timeout) < 0 ? check.getTimeout() : timeout;
            deadlines.put(check, start + budget.toNanos());
        }

        List<CheckResult> finished = new ArrayList<>();

        while (true) {
            cancellation.throwIfCancelled();
            long now = System.nanoTime();

            for (var iterator = deadlines.entrySet().iterator(); iterator.hasNext(); ) {
                var entry = iterator.next();
                ReadinessCheck check = entry.getKey();
                CheckResult result = probe.evaluate(check);

                if (result.isSatisfied()) {
                    log.debugf("%s: ready", check.getIdentifier());
                    finished.add(result);
                    iterator.remove();
                } else if (now - entry.getValue() >= 0) {
                    iterator.remove();
                    finished.add(result);

                    if (check.isRequired()) {
                        log.errorf("%s: not satisfied within %s: %s", check.getIdentifier(), check.getTimeout(), result.getDetail());
                        return GateResult.timedOut(finished, result);
                    }
                    log.warnf("%s: optional check not satisfied within %s, continuing: %s",
                            check.getIdentifier(), check.getTimeout(), result.getDetail());
                } else {
                    log.tracef("%s: waiting (%s)", check.getIdentifier(), result.getDetail());
                }
            }

            if (deadlines.isEmpty()) {
                return GateResult.ready(finished);
            }

            long nextDeadline = deadlines.values().stream().mapToLong(Long::longValue).min().orElse(now);
            long untilDeadline = Math.max(1L, nextDeadline - System.nanoTime());
            cancellation.sleep(Duration.ofNanos(Math.min(pollInterval.toNanos(), untilDeadline)));
        }
    }

    /**
     * Single evaluation of every check, without waiting.
     */
    public List<CheckResult> evaluateOnce(List<ReadinessCheck> checks) {
        List<CheckResult> results = new ArrayList<>();
        for (ReadinessCheck check : checks) {
            results.add(probe.evaluate(check));
        }
        return results;
    }
}
