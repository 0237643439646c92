package com.tracegate.dispatch.cli;

import com.tracegate.core.coverage.CoverageReport;
import com.tracegate.core.coverage.CoverageSummary;
import com.tracegate.core.gate.GateResult;
import com.tracegate.core.model.CoverageStatus;
import com.tracegate.core.suggest.Suggestion;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Tracegate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TRACEGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TRACEGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void suggestion(Suggestion s) {
        String marker = s.alreadyInPlan() ? "@|fg(white) [IN PLAN]|@" : "@|fg(green) [NEW]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + marker + " " + s.code() + " (" + s.testLayer().code() + ") " + s.title()));
        System.out.println("      " + s.reason());
    }

    public static void coverageRow(CoverageReport r) {
        if (r.dataIncomplete()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) [INCOMPLETE]|@ " + r.label() + " - " + r.note()));
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + statusTag(r.coverageStatus()) + " " + r.label()
                + " - coverage " + r.coveragePct() + "% (" + r.inPlan() + "/" + r.totalTraceable() + ")"
                + ", executed " + r.executionPct() + "%, pass rate " + r.passRate() + "%"));
    }

    public static void coverageSummary(CoverageSummary s) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Plan Coverage|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Declarations: " + s.totalDeclarations() + " (@|fg(green) " + s.fullCoverage() + " full|@, @|fg(yellow) "
                + s.partialCoverage() + " partial|@, @|fg(red) " + s.noCoverage() + " none|@)"));
        System.out.println("  Artifacts: " + s.inPlan() + "/" + s.totalTraceable() + " in plan ("
                + s.coveragePct() + "%), " + s.executed() + " executed, " + s.passed() + " passed");
    }

    public static void gate(GateResult g) {
        String status = g.passed() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + g.label() + ": " + g.measuredValue()));
    }

    private static String statusTag(CoverageStatus status) {
        return switch (status) {
            case FULL -> "@|fg(green) [FULL]|@";
            case PARTIAL -> "@|fg(yellow) [PARTIAL]|@";
            case NONE -> "@|fg(red) [NONE]|@";
            case NOT_CALCULATED -> "@|fg(white) [?]|@";
        };
    }
}
