package com.tracegate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Tracegate.
 * Routes to subcommands: resolve, validate, suggest, coverage, gate, health, serve.
 */
@Command(
        name = "tracegate",
        mixinStandardHelpOptions = true,
        version = "Tracegate 0.1.0",
        description = "Scope resolution and coverage traceability for test planning",
        subcommands = {
                ResolveCommand.class,
                ValidateCommand.class,
                SuggestCommand.class,
                CoverageCommand.class,
                GateCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TracegateCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
