package com.pitchcraft.dispatch.cli;

import com.pitchcraft.core.engine.WorkflowEngine;
import com.pitchcraft.core.model.Session;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: pitchcraft sessions
 * <p>
 * Lists stored sessions as a table: Session ID | Phase | Refinements | Description.
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List pitch sessions")
@Component
public class SessionsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final WorkflowEngine workflowEngine;

    public SessionsCommand(WorkflowEngine workflowEngine) {
        this.workflowEngine = workflowEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Session> sessions = workflowEngine.list();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return;
        }

        List<Session> display = sessions.size() > limit
                ? sessions.subList(sessions.size() - limit, sessions.size())
                : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-36s %-18s %-6s %s%n", "SESSION ID", "PHASE", "ITER", "DESCRIPTION");
        System.out.println("  " + "-".repeat(90));
        for (Session session : display) {
            System.out.printf("  %-36s %-18s %-6d %s%n", session.id(), session.phase(),
                    session.state().totalIterationCount(), truncate(session.state().description(), 30));
        }
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }
}
