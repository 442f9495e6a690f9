package com.pitchcraft.core.nodes;

import com.pitchcraft.core.llm.BackendUnavailableException;
import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.model.PitchState;
import com.pitchcraft.core.search.SearchProperties;
import com.pitchcraft.core.search.WebSearchClient;
import com.pitchcraft.core.tools.PitchTemplate;
import com.pitchcraft.core.workflow.WorkflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Gathers market and competitor context for the product description.
 * <p>
 * Runs one web search, trims the snippets, and asks the backend to turn them
 * into pitch-oriented research notes.
 */
@Component
public class ContextAgentStep implements AgentStep {

    private static final Logger log = LoggerFactory.getLogger(ContextAgentStep.class);

    static final int QUERY_PREFIX_CHARS = 100;
    static final String QUERY_SUFFIX = " market analysis competitors";

    private static final String SYSTEM_PROMPT = """
            You are a startup research expert. Analyze the MVP description and the search
            results to provide context for writing a compelling pitch.

            Cover:
            - key market insights from the search results
            - the competitive landscape
            - the target audience
            - the recommended pitch approach
            - the value propositions to emphasize
            """;

    private final LlmService llmService;
    private final WebSearchClient searchClient;
    private final LlmProperties llmProperties;
    private final SearchProperties searchProperties;
    private final PitchTemplate template;

    public ContextAgentStep(LlmService llmService,
                            WebSearchClient searchClient,
                            LlmProperties llmProperties,
                            SearchProperties searchProperties,
                            WorkflowProperties workflowProperties) {
        this.llmService = llmService;
        this.searchClient = searchClient;
        this.llmProperties = llmProperties;
        this.searchProperties = searchProperties;
        this.template = PitchTemplate.fromName(workflowProperties.getPitchTemplate());
    }

    @Override
    public String name() {
        return "context";
    }

    @Override
    public PitchState execute(PitchState state) {
        String research = research(state.description());
        String userPrompt = """
                MVP Description: %s

                Market Research Results:
                %s

                Pitch Template to Follow:
                %s

                Based on this information, provide context for creating a compelling pitch.
                """.formatted(state.description(), research.isEmpty() ? "(no search results)" : research,
                template.structure());

        try {
            String context = llmService.call(SYSTEM_PROMPT, userPrompt, llmProperties.getTemperatures().getContext());
            return state.withContext(context.trim());
        } catch (BackendUnavailableException e) {
            log.warn("Context generation degraded: {}", e.getMessage());
            return state.withContext(degradedContext(research));
        }
    }

    static String searchQuery(String description) {
        String prefix = description.length() > QUERY_PREFIX_CHARS
                ? description.substring(0, QUERY_PREFIX_CHARS)
                : description;
        return prefix + QUERY_SUFFIX;
    }

    private String research(String description) {
        List<String> snippets = searchClient.search(searchQuery(description));
        String joined = String.join("\n", snippets);
        int max = searchProperties.getMaxChars();
        return joined.length() > max ? joined.substring(0, max) : joined;
    }

    private String degradedContext(String research) {
        String note = "Market context unavailable: the research backend did not respond. "
                + "Work from the product description alone.";
        return research.isEmpty() ? note : note + "\n\nRaw search notes:\n" + research;
    }
}
