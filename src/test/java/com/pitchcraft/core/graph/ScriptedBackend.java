package com.pitchcraft.core.graph;

import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.metrics.PitchMetrics;
import com.pitchcraft.core.nodes.ContextAgentStep;
import com.pitchcraft.core.nodes.CriticAgentStep;
import com.pitchcraft.core.nodes.GeneratorAgentStep;
import com.pitchcraft.core.nodes.ReadinessAgentStep;
import com.pitchcraft.core.nodes.RefinerAgentStep;
import com.pitchcraft.core.parsing.CritiqueParser;
import com.pitchcraft.core.parsing.FinalPackageParser;
import com.pitchcraft.core.qualitygate.ScoreGate;
import com.pitchcraft.core.search.SearchProperties;
import com.pitchcraft.core.search.WebSearchClient;
import com.pitchcraft.core.tools.PitchAnalyzer;
import com.pitchcraft.core.workflow.IterationPolicy;
import com.pitchcraft.core.workflow.WorkflowProperties;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * A mocked {@link LlmService} that answers each agent step by recognising its
 * system prompt, wired into a real {@link PitchGraph}.
 */
public class ScriptedBackend {

    public static final String PACKAGE_REPLY = """
            {"elevator_pitch": "Home-cooked dinners from your street.",
             "executive_summary": "HomePlate matches cooks and diners.",
             "key_talking_points": ["Local", "Fresh"]}
            """;

    private final LlmService llmService = mock(LlmService.class);
    private final PitchMetrics metrics;
    private final AtomicInteger criticCalls = new AtomicInteger();
    private final AtomicInteger refinerCalls = new AtomicInteger();
    private final List<String> refinerPrompts = new CopyOnWriteArrayList<>();
    private volatile double criticScore = 8.0;
    private volatile RuntimeException failure;
    private volatile String heldStep;
    private volatile CountDownLatch heldEntered;
    private volatile CountDownLatch heldGate;

    public ScriptedBackend(PitchMetrics metrics) {
        this.metrics = metrics;
        when(llmService.call(anyString(), anyString(), anyDouble()))
                .thenAnswer(inv -> reply(inv.getArgument(0), inv.getArgument(1)));
    }

    public PitchGraph graph(IterationPolicy policy) throws Exception {
        var llmProperties = new LlmProperties();
        var searchProperties = new SearchProperties();
        searchProperties.setEnabled(false);
        WebSearchClient search = mock(WebSearchClient.class);
        return new PitchGraph(
                new ContextAgentStep(llmService, search, llmProperties, searchProperties, new WorkflowProperties()),
                new GeneratorAgentStep(llmService, llmProperties),
                new CriticAgentStep(llmService, llmProperties, new CritiqueParser(new ScoreGate(7.5)),
                        new PitchAnalyzer(), metrics),
                new RefinerAgentStep(llmService, llmProperties),
                new ReadinessAgentStep(llmService, llmProperties, new FinalPackageParser()),
                policy,
                metrics);
    }

    public ScriptedBackend scoring(double score) {
        this.criticScore = score;
        return this;
    }

    public ScriptedBackend failingWith(RuntimeException e) {
        this.failure = e;
        return this;
    }

    /**
     * Makes the step whose system prompt contains {@code promptMarker} block until
     * {@code gate} opens, counting down {@code entered} once it is inside the step.
     */
    public ScriptedBackend holding(String promptMarker, CountDownLatch entered, CountDownLatch gate) {
        this.heldEntered = entered;
        this.heldGate = gate;
        this.heldStep = promptMarker;
        return this;
    }

    public int criticCalls() {
        return criticCalls.get();
    }

    public int refinerCalls() {
        return refinerCalls.get();
    }

    public List<String> refinerPrompts() {
        return refinerPrompts;
    }

    public LlmService llmService() {
        return llmService;
    }

    private String reply(String system, String user) {
        if (failure != null) {
            throw failure;
        }
        String held = heldStep;
        if (held != null && system.contains(held)) {
            awaitGate();
        }
        if (system.contains("research expert")) {
            return "Research notes";
        }
        if (system.contains("expert pitch writer")) {
            return "Draft pitch v1";
        }
        if (system.contains("pitch critic")) {
            criticCalls.incrementAndGet();
            double s = criticScore;
            return """
                    {"scores": {"clarity": %s, "problem": %s, "solution": %s, "uniqueness": %s, "traction": %s, "engagement": %s},
                     "feedback": "Needs sharper numbers", "weaknesses": ["Vague market size"]}
                    """.formatted(s, s, s, s, s, s);
        }
        if (system.contains("refinement expert")) {
            refinerPrompts.add(user);
            return "Refined pitch v" + (refinerCalls.incrementAndGet() + 1);
        }
        if (system.contains("pitch coach")) {
            return PACKAGE_REPLY;
        }
        throw new IllegalStateException("Unexpected prompt: " + system);
    }

    private void awaitGate() {
        heldEntered.countDown();
        try {
            if (!heldGate.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate for '" + heldStep + "' never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
