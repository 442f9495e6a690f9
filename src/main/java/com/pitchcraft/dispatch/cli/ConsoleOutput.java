package com.pitchcraft.dispatch.cli;

import com.pitchcraft.core.model.Critique;
import com.pitchcraft.core.model.FinalPackage;
import com.pitchcraft.core.model.Session;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Pitchcraft CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PITCHCRAFT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PITCHCRAFT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void prompt(String message) {
        System.out.print(CommandLine.Help.Ansi.AUTO.string("@|bold " + message + "|@"));
        System.out.flush();
    }

    public static void session(Session session) {
        var state = session.state();
        System.out.println();
        System.out.println("SESSION " + session.id());
        System.out.println("Phase: " + state.phase()
                + " | Refinements: " + state.totalIterationCount()
                + " (auto " + state.autoRefineCount() + ")");
        if (state.pitch() != null) {
            System.out.println();
            System.out.println("CURRENT PITCH:");
            System.out.println(state.pitch());
        }
        if (state.critique() != null) {
            critique(state.critique());
        }
    }

    public static void critique(Critique critique) {
        String score = critique.passed()
                ? "@|fg(green) " + critique.overall() + "/10 PASS|@"
                : "@|fg(red) " + critique.overall() + "/10 FAIL|@";
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(yellow) [CRITIQUE]|@ " + score
                + (critique.degraded() ? " (degraded)" : "")));
        var s = critique.scores();
        System.out.printf("    clarity %.1f | problem %.1f | solution %.1f | uniqueness %.1f | traction %.1f | engagement %.1f%n",
                s.clarity(), s.problem(), s.solution(), s.uniqueness(), s.traction(), s.engagement());
        if (!critique.feedback().isBlank()) {
            System.out.println("    " + critique.feedback());
        }
        for (String weakness : critique.weaknesses()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + weakness));
        }
    }

    public static void finalPackage(FinalPackage pkg) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(green) FINAL PITCH PACKAGE|@"
                + (pkg.capped() ? " (iteration budget reached)" : "")));
        System.out.println("Elevator pitch: " + pkg.elevatorPitch());
        System.out.println();
        System.out.println("Executive summary:");
        System.out.println(pkg.executiveSummary());
        System.out.println();
        System.out.println("Key talking points:");
        pkg.keyTalkingPoints().forEach(point -> System.out.println("  - " + point));
        System.out.println();
        System.out.println("Anticipated questions:");
        pkg.anticipatedQuestions().forEach(qa -> {
            System.out.println("  Q: " + qa.question());
            System.out.println("  A: " + qa.answer());
        });
        var tips = pkg.deliveryTips();
        System.out.println();
        System.out.println("Delivery: tone " + tips.tone() + ", pacing " + tips.pacing());
    }
}
