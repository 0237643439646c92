package com.tracegate.dispatch.cli;

import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.suggest.CandidateSuggestionEngine;
import com.tracegate.core.suggest.SuggestionResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: tracegate suggest &lt;plan-id&gt;
 */
@Command(name = "suggest", mixinStandardHelpOptions = true,
        description = "List test artifacts that satisfy a plan's declared scope")
@Component
public class SuggestCommand implements Runnable {

    @Parameters(index = "0", description = "Test plan ID")
    private String planId;

    private final CandidateSuggestionEngine engine;

    public SuggestCommand(CandidateSuggestionEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        SuggestionResult result;
        try {
            result = engine.suggest(planId);
        } catch (NotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        ConsoleOutput.info(result.message());
        result.suggestions().forEach(ConsoleOutput::suggestion);
    }
}
