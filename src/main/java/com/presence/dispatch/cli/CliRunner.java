package com.presence.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the presence command line inside the Spring context, so evaluate, stages and health
 * work against the same beans the HTTP server uses. The command's exit code becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PresenceCommand presenceCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(PresenceCommand presenceCommand, IFactory factory) {
        this.presenceCommand = presenceCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        if (isServe(args)) {
            // the servlet container owns the process; ServeCommand prints the endpoints once it is bound
            return;
        }
        exitCode = new CommandLine(presenceCommand, factory).execute(args);
    }

    static boolean isServe(String... args) {
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
