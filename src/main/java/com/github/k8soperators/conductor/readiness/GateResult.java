package com.github.k8soperators.conductor.readiness;

import java.util.List;
import java.util.Optional;

public final class GateResult {

    public enum Outcome {
        READY,
        TIMED_OUT,
        SKIPPED
    }

    private final Outcome outcome;
    private final List<CheckResult> checks;
    private final CheckResult failedCheck;

    private GateResult(Outcome outcome, List<CheckResult> checks, CheckResult failedCheck) {
        this.outcome = outcome;
        this.checks = List.copyOf(checks);
        this.failedCheck = failedCheck;
    }

    public static GateResult ready(List<CheckResult> checks) {
        return new GateResult(Outcome.READY, checks, null);
    }

    public static GateResult timedOut(List<CheckResult> checks, CheckResult failedCheck) {
        return new GateResult(Outcome.TIMED_OUT, checks, failedCheck);
    }

    public static GateResult skipped() {
        return new GateResult(Outcome.SKIPPED, List.of(), null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isOpen() {
        return outcome != Outcome.TIMED_OUT;
    }

    /**
     * Last observed result of every check that finished, including optional checks that timed out.
     */
    public List<CheckResult> getChecks() {
        return checks;
    }

    /**
     * The required check that kept the gate closed.
     */
    public Optional<CheckResult> getFailedCheck() {
        return Optional.ofNullable(failedCheck);
    }

    @Override
    public String toString() {
        return failedCheck == null ? outcome.toString() : outcome + " (" + failedCheck + ")";
    }
}
