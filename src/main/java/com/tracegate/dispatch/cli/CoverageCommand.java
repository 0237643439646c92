package com.tracegate.dispatch.cli;

import com.tracegate.core.coverage.CoverageAggregator;
import com.tracegate.core.coverage.PlanCoverageReport;
import com.tracegate.core.error.NotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: tracegate coverage &lt;plan-id&gt; [--anchor &lt;id&gt;]
 */
@Command(name = "coverage", mixinStandardHelpOptions = true,
        description = "Compute scope coverage for a plan, or for one anchor within it")
@Component
public class CoverageCommand implements Runnable {

    @Parameters(index = "0", description = "Test plan ID")
    private String planId;

    @Option(names = {"--anchor", "-a"}, description = "Limit to one level-3 process anchor")
    private String anchorId;

    private final CoverageAggregator aggregator;

    public CoverageCommand(CoverageAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            if (anchorId != null) {
                ConsoleOutput.coverageRow(aggregator.computeAnchorCoverage(planId, anchorId));
                return;
            }
            PlanCoverageReport report = aggregator.computePlanCoverage(planId);
            if (report.perDeclaration().isEmpty()) {
                ConsoleOutput.info("Plan " + planId + " has no scope declarations");
            }
            report.perDeclaration().forEach(ConsoleOutput::coverageRow);
            ConsoleOutput.coverageSummary(report.summary());
        } catch (NotFoundException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
