package com.pitchcraft.core.llm;

import com.pitchcraft.core.metrics.PitchMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps Spring AI's {@link ChatClient} with the call discipline every agent step relies on.
 * <p>
 * Each call runs on a bounded executor (at most {@code pitchcraft.llm.max-concurrent-calls}
 * in flight) under the {@code pitchcraft.llm.timeout} bound. When the call fails the caller
 * gets a {@link BackendUnavailableException} and decides how to degrade.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final PitchMetrics metrics;
    private final ExecutorService executor;

    @Autowired
    public LlmService(ChatClient.Builder builder,
                      LlmProperties properties,
                      PitchMetrics metrics,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this(builder.build(), properties, metrics);
        log.info("LlmService initialized, OpenAI-compatible base-url: {}", baseUrl);
    }

    LlmService(ChatClient chatClient, LlmProperties properties, PitchMetrics metrics) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.metrics = metrics;
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentCalls()),
                namedDaemonThreads());
    }

    /**
     * Sends a system + user prompt at the given temperature and returns the raw text reply.
     * <p>
     * Transient HTTP failures are retried inside the chat model by Spring AI's retry
     * template ({@code spring.ai.retry.*}). The timeout here bounds the whole call,
     * retries included.
     *
     * @throws BackendUnavailableException when the call timed out, failed or came back blank
     */
    public String call(String systemPrompt, String userPrompt, double temperature) {
        long timeoutMs = properties.getTimeout().toMillis();
        long start = System.currentTimeMillis();
        CompletableFuture<String> future =
                CompletableFuture.supplyAsync(() -> invoke(systemPrompt, userPrompt, temperature), executor);
        try {
            String response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response == null || response.isBlank()) {
                metrics.recordBackendFailure("empty");
                log.warn("LLM returned empty content");
                throw new BackendUnavailableException("LLM unavailable",
                        new LlmEmptyResponseException("LLM returned empty content"));
            }
            log.info("LLM call complete ({}s)",
                    String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordBackendFailure("timeout");
            log.warn("LLM call timed out after {} ms", timeoutMs);
            throw new BackendUnavailableException("LLM unavailable", e);
        } catch (ExecutionException e) {
            metrics.recordBackendFailure("error");
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("LLM call failed: {}", cause.getMessage());
            throw new BackendUnavailableException("LLM unavailable", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while waiting for the LLM", e);
        }
    }

    /**
     * JSON format instructions derived from a record type, appended to prompts whose
     * reply is parsed back into that type.
     */
    public static String formatInstructions(Class<?> outputType) {
        return new BeanOutputConverter<>(outputType).getFormat();
    }

    private String invoke(String systemPrompt, String userPrompt, double temperature) {
        return chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(ChatOptions.builder().temperature(temperature).build())
                .call()
                .content();
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private static java.util.concurrent.ThreadFactory namedDaemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "llm-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
