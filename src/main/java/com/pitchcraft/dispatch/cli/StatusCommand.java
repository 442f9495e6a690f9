package com.pitchcraft.dispatch.cli;

import com.pitchcraft.core.engine.WorkflowEngine;
import com.pitchcraft.core.model.Phase;
import com.pitchcraft.core.model.Session;
import com.pitchcraft.core.session.SessionNotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: pitchcraft status &lt;session-id&gt;
 * <p>
 * Shows the current snapshot of a session. Sessions from earlier runs are only
 * visible when a durable session store is configured.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show a pitch session")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    private final WorkflowEngine workflowEngine;

    public StatusCommand(WorkflowEngine workflowEngine) {
        this.workflowEngine = workflowEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Session session;
        try {
            session = workflowEngine.status(sessionId);
        } catch (SessionNotFoundException e) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return;
        }

        ConsoleOutput.session(session);
        if (session.state().finalPackage() != null) {
            ConsoleOutput.finalPackage(session.state().finalPackage());
        }
        System.out.println();
        if (session.phase() == Phase.DONE) {
            ConsoleOutput.success("Status: " + session.phase());
        } else {
            ConsoleOutput.info("Status: " + session.phase());
        }
    }
}
