package com.tracegate.dispatch.cli;

import com.tracegate.core.model.TestLayer;
import com.tracegate.core.policy.LayerValidationPolicy;
import com.tracegate.core.policy.ValidationOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tracegate validate &lt;layer&gt; [--anchor &lt;id&gt;]
 * <p>
 * Exits with 1 when the layer rejects the (missing) anchor.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Check whether a test layer accepts the given anchor")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Test layer code (unit, sit, uat, regression, performance, cutover_rehearsal)")
    private String layer;

    @Option(names = {"--anchor", "-a"}, description = "Resolved level-3 anchor id")
    private String anchorId;

    private final LayerValidationPolicy policy;

    public ValidateCommand(LayerValidationPolicy policy) {
        this.policy = policy;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        TestLayer testLayer;
        try {
            testLayer = TestLayer.fromCode(layer);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ValidationOutcome outcome = policy.validate(testLayer, anchorId);
        switch (outcome.status()) {
            case OK -> ConsoleOutput.success("OK: " + testLayer.code() + " accepts this artifact");
            case WARN -> ConsoleOutput.warn("WARN: " + outcome.message());
            case REJECT -> ConsoleOutput.error("REJECT: " + outcome.message());
        }
        return outcome.isRejected() ? 1 : 0;
    }
}
