package com.pitchcraft.core.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Market research lookups against the DuckDuckGo instant-answer API.
 * <p>
 * Collects the abstract plus related-topic texts. Any failure (network, status,
 * malformed body) degrades to an empty result so the context step can proceed.
 */
@Service
public class DuckDuckGoSearchClient implements WebSearchClient {

    private static final Logger log = LoggerFactory.getLogger(DuckDuckGoSearchClient.class);

    private final SearchProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DuckDuckGoSearchClient(SearchProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public List<String> search(String query) {
        if (!isEnabled() || query == null || query.isBlank()) {
            log.debug("Web search skipped (enabled={})", isEnabled());
            return List.of();
        }

        log.info("Searching: {}", query);
        long start = System.currentTimeMillis();
        try {
            String url = properties.getEndpoint()
                    + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                    + "&format=json&no_html=1&skip_disambig=1";
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .header("Accept", "application/json")
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Search returned status {}", response.statusCode());
                return List.of();
            }
            List<String> snippets = parse(response.body());
            log.info("Search returned {} snippet(s) ({}ms)", snippets.size(), System.currentTimeMillis() - start);
            return snippets;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Search interrupted for '{}'", query);
            return List.of();
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Search failed for '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    List<String> parse(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        if (root == null) {
            return List.of();
        }
        List<String> snippets = new ArrayList<>();
        addIfPresent(snippets, root.path("AbstractText").asText(""));
        addIfPresent(snippets, root.path("Answer").asText(""));
        collectTopics(root.path("RelatedTopics"), snippets);
        return snippets.size() > properties.getMaxResults()
                ? List.copyOf(snippets.subList(0, properties.getMaxResults()))
                : List.copyOf(snippets);
    }

    // Topics are either {Text, FirstURL} leaves or {Name, Topics[]} groups.
    private void collectTopics(JsonNode topics, List<String> out) {
        if (!topics.isArray()) {
            return;
        }
        for (JsonNode topic : topics) {
            if (out.size() >= properties.getMaxResults()) {
                return;
            }
            if (topic.has("Topics")) {
                collectTopics(topic.get("Topics"), out);
            } else {
                addIfPresent(out, topic.path("Text").asText(""));
            }
        }
    }

    private static void addIfPresent(List<String> out, String text) {
        if (text != null && !text.isBlank()) {
            out.add(text.trim());
        }
    }
}
