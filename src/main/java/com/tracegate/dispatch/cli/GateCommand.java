package com.tracegate.dispatch.cli;

import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.gate.ExitGateEvaluator;
import com.tracegate.core.gate.ExitGateReport;
import com.tracegate.core.gate.GateVerdict;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tracegate gate &lt;plan-id&gt;
 * <p>
 * Prints the exit-gate scorecard. Exit code 0 on PASS, 1 on FAIL, 2 for an unknown plan,
 * so the command can guard a release pipeline.
 */
@Command(name = "gate", mixinStandardHelpOptions = true, description = "Evaluate a plan's exit criteria")
@Component
public class GateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Test plan ID")
    private String planId;

    private final ExitGateEvaluator evaluator;

    public GateCommand(ExitGateEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ExitGateReport report;
        try {
            report = evaluator.evaluateExit(planId);
        } catch (NotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        report.gates().forEach(ConsoleOutput::gate);
        System.out.println("──────────────────────────────────");
        if (report.overall() == GateVerdict.PASS) {
            ConsoleOutput.success("Overall: PASS");
            return 0;
        }
        ConsoleOutput.error("Overall: FAIL");
        return 1;
    }
}
