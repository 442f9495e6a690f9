package com.pitchcraft.core.health;

import com.pitchcraft.core.graph.PitchGraph;
import com.pitchcraft.core.search.WebSearchClient;
import com.pitchcraft.core.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final PitchGraph pitchGraph;
    private final SessionStore sessionStore;
    private final WebSearchClient searchClient;
    private final String llmApiKey;

    public HealthCheckService(
            @Autowired(required = false) PitchGraph pitchGraph,
            @Autowired(required = false) SessionStore sessionStore,
            @Autowired(required = false) WebSearchClient searchClient,
            @Value("${spring.ai.openai.api-key:}") String llmApiKey) {
        this.pitchGraph = pitchGraph;
        this.sessionStore = sessionStore;
        this.searchClient = searchClient;
        this.llmApiKey = llmApiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkSessionStore());
        results.add(checkSearch());
        results.add(checkLlm());
        return results;
    }

    private HealthStatus checkGraph() {
        if (pitchGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkSessionStore() {
        if (sessionStore == null) {
            return new HealthStatus("sessionStore", HealthStatus.Status.DOWN,
                    "No SessionStore configured", Map.of());
        }
        try {
            int count = sessionStore.list().size();
            return new HealthStatus("sessionStore", HealthStatus.Status.UP,
                    "Session store reachable",
                    Map.of("type", sessionStore.getClass().getSimpleName(), "sessions", String.valueOf(count)));
        } catch (RuntimeException e) {
            log.warn("Session store health check failed: {}", e.getMessage());
            return new HealthStatus("sessionStore", HealthStatus.Status.DOWN,
                    "Session store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkSearch() {
        if (searchClient == null || !searchClient.isEnabled()) {
            return new HealthStatus("search", HealthStatus.Status.DEGRADED,
                    "Web search disabled; context is generated without research", Map.of());
        }
        return new HealthStatus("search", HealthStatus.Status.UP, "Web search enabled", Map.of());
    }

    private HealthStatus checkLlm() {
        if (llmApiKey == null || llmApiKey.isBlank()) {
            return new HealthStatus("llm", HealthStatus.Status.DEGRADED,
                    "No API key configured; steps will produce degraded content", Map.of());
        }
        return new HealthStatus("llm", HealthStatus.Status.UP, "API key configured", Map.of());
    }
}
