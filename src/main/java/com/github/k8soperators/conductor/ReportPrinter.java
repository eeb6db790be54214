package com.github.k8soperators.conductor;

import com.github.k8soperators.conductor.execution.PhaseResult;
import com.github.k8soperators.conductor.execution.RunReport;
import com.github.k8soperators.conductor.reconcile.ReconcileReport;
import com.github.k8soperators.conductor.status.PhaseStatusReport;
import com.github.k8soperators.conductor.teardown.TeardownReport;

import java.io.PrintWriter;
import java.util.List;

/**
 * Plain-text tables written to the command's standard output.
 */
final class ReportPrinter {

    private static final String ROW = "%-28s %-10s %-10s %s%n";

    private ReportPrinter() {
    }

    static void print(PrintWriter out, RunReport report) {
        out.printf(ROW, "PHASE", "STATUS", "CHANGES", "ERROR");
        for (PhaseResult result : report.getResults()) {
            out.printf(ROW, result.getPhaseName(), result.getStatus(),
                    result.countMutations() + "/" + result.getResources().size(),
                    result.getError().orElse(""));
        }
        out.flush();
    }

    static void print(PrintWriter out, List<PhaseStatusReport> reports) {
        out.printf(ROW, "PHASE", "STATUS", "PRESENT", "DETAIL");
        for (PhaseStatusReport report : reports) {
            String detail = report.getState().getLastError() != null ? report.getState().getLastError() : "";
            if (!report.getDrifted().isEmpty()) {
                detail = (detail.isEmpty() ? "" : detail + "; ") + "drifted " + report.getDrifted();
            }
            out.printf(ROW, report.getState().getPhaseName(), report.getState().getStatus(), report.getPresent(), detail);
        }
        out.flush();
    }

    static void print(PrintWriter out, ReconcileReport report) {
        report.getPhases().forEach((phase, resources) -> resources.forEach(r -> out.printf("%-28s %s%n", phase, r)));
        out.printf("Reconcile: %s%n", report);
        out.flush();
    }

    static void print(PrintWriter out, TeardownReport report) {
        report.getFailures().forEach(failure -> out.printf("FAILED %s%n", failure));
        out.printf("Teardown: %s%n", report);
        out.flush();
    }
}
