package com.github.k8soperators.conductor.readiness;

import com.github.k8soperators.conductor.model.ReadinessCheck;

public final class CheckResult {

    private final ReadinessCheck check;
    private final boolean satisfied;
    private final String detail;

    public CheckResult(ReadinessCheck check, boolean satisfied, String detail) {
        this.check = check;
        this.satisfied = satisfied;
        this.detail = detail;
    }

    public static CheckResult satisfied(ReadinessCheck check) {
        return new CheckResult(check, true, "ready");
    }

    public static CheckResult unsatisfied(ReadinessCheck check, String detail) {
        return new CheckResult(check, false, detail);
    }

    public ReadinessCheck getCheck() {
        return check;
    }

    public boolean isSatisfied() {
        return satisfied;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return check.getIdentifier() + ": " + detail;
    }
}
