package com.tracegate.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and hands its exit code back to
 * Spring Boot. Resolve, validate, suggest, coverage, gate and health all go through here; in
 * server mode nothing runs and the exit code stays 0.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TracegateCommand tracegateCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TracegateCommand tracegateCommand, IFactory factory) {
        this.tracegateCommand = tracegateCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        if (ServeCommand.isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(tracegateCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
