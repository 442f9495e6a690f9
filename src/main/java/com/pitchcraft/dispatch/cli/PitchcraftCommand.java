package com.pitchcraft.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Pitchcraft.
 * Routes to subcommands: pitch, status, sessions, health, serve.
 */
@Command(
        name = "pitchcraft",
        mixinStandardHelpOptions = true,
        version = "Pitchcraft 0.1.0",
        description = "Agentic pitch generation powered by LangGraph4j and Spring AI",
        subcommands = {
                PitchCommand.class,
                StatusCommand.class,
                SessionsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PitchcraftCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
