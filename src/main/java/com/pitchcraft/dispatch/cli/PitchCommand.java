package com.pitchcraft.dispatch.cli;

import com.pitchcraft.core.engine.WorkflowEngine;
import com.pitchcraft.core.model.Phase;
import com.pitchcraft.core.model.Session;
import com.pitchcraft.core.workflow.WorkflowException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * CLI command: pitchcraft pitch "&lt;description&gt;"
 * <p>
 * Starts a session and walks the reviewer through each approval checkpoint on
 * the console: [A]pprove builds the final package, [R]eject asks for feedback and
 * triggers another refinement.
 */
@Command(name = "pitch", mixinStandardHelpOptions = true, description = "Generate a pitch for a product description")
@Component
public class PitchCommand implements Runnable {

    @Parameters(index = "0", description = "Free-text product / MVP description")
    private String description;

    @Option(names = {"--auto-approve", "-y"}, description = "Approve the first draft that reaches review")
    private boolean autoApprove;

    private final WorkflowEngine workflowEngine;
    private final BufferedReader input;

    @Autowired
    public PitchCommand(WorkflowEngine workflowEngine) {
        this(workflowEngine, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    PitchCommand(WorkflowEngine workflowEngine, BufferedReader input) {
        this.workflowEngine = workflowEngine;
        this.input = input;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Researching market and drafting pitch...");

        Session session;
        try {
            session = workflowEngine.start(description);
            ConsoleOutput.session(session);

            while (session.phase() == Phase.AWAITING_APPROVAL) {
                Decision decision = autoApprove ? Decision.APPROVE : ask();
                if (decision == null) {
                    System.out.println();
                    ConsoleOutput.info("No input; session " + session.id() + " is left awaiting approval.");
                    return;
                }
                if (decision == Decision.APPROVE) {
                    ConsoleOutput.info("Preparing final pitch package...");
                    session = workflowEngine.submitApproval(session.id(), true, null);
                } else {
                    ConsoleOutput.prompt("What should be improved? ");
                    String feedback = readLine();
                    ConsoleOutput.info("Refining pitch...");
                    session = workflowEngine.submitApproval(session.id(), false, feedback);
                    ConsoleOutput.session(session);
                }
            }
        } catch (WorkflowException | IllegalArgumentException e) {
            ConsoleOutput.error("Pitch failed: " + e.getMessage());
            return;
        }

        if (session.state().finalPackage() != null) {
            ConsoleOutput.finalPackage(session.state().finalPackage());
        }
        System.out.println();
        if (session.phase() == Phase.CAPPED) {
            ConsoleOutput.info("Iteration budget reached; package built from the last draft.");
        } else {
            ConsoleOutput.success("Pitch ready. Session " + session.id());
        }
    }

    private enum Decision { APPROVE, REJECT }

    private Decision ask() {
        while (true) {
            System.out.println();
            System.out.println("Options: [A]pprove or [R]eject");
            ConsoleOutput.prompt("Your decision (A/R): ");
            String line = readLine();
            if (line == null) {
                return null;
            }
            switch (line.trim().toUpperCase(Locale.ROOT)) {
                case "A" -> {
                    return Decision.APPROVE;
                }
                case "R" -> {
                    return Decision.REJECT;
                }
                default -> ConsoleOutput.error("Please answer A or R.");
            }
        }
    }

    private String readLine() {
        try {
            return input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }
}
