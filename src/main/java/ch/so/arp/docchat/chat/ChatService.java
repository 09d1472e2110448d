package ch.so.arp.docchat.chat;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.docchat.document.SearchResult;
import ch.so.arp.docchat.error.PermanentServiceException;
import ch.so.arp.docchat.error.TransientServiceException;
import ch.so.arp.docchat.error.ValidationException;
import ch.so.arp.docchat.retrieval.ContextAssembler;
import ch.so.arp.docchat.retrieval.RetrievalEngine;
import ch.so.arp.docchat.retrieval.SearchHit;

/**
 * Coordinates the retrieval of context from the chunk store and delegates the
 * answer generation to the large language model integration. Every request
 * runs on the chat executor and is bounded by the request timeout.
 */
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final RetrievalEngine retrievalEngine;
    private final ContextAssembler contextAssembler;
    private final LlmClient llmClient;
    private final Executor chatExecutor;
    private final int maxContextChars;
    private final Duration requestTimeout;

    public ChatService(RetrievalEngine retrievalEngine, ContextAssembler contextAssembler, LlmClient llmClient,
            Executor chatExecutor, int maxContextChars, Duration requestTimeout) {
        this.retrievalEngine = Objects.requireNonNull(retrievalEngine, "retrievalEngine");
        this.contextAssembler = Objects.requireNonNull(contextAssembler, "contextAssembler");
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
        this.maxContextChars = maxContextChars;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    /**
     * Retrieve context for the prompt and generate an answer.
     *
     * @throws ValidationException       if the prompt is blank
     * @throws TransientServiceException if the request does not finish within
     *                                   the request timeout
     */
    public ChatResponse answer(String prompt, AgentMode agentMode) {
        if (prompt == null || prompt.isBlank()) {
            throw new ValidationException("Valid prompt is required");
        }
        AgentMode mode = agentMode != null ? agentMode : AgentMode.DOCUMENT_SEARCH;
        CompletableFuture<ChatResponse> future = CompletableFuture.supplyAsync(() -> generate(prompt, mode),
                chatExecutor);
        try {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            LOGGER.warn("Chat request timed out after {} ms", requestTimeout.toMillis());
            throw new TransientServiceException("Chat request timed out after " + requestTimeout.toMillis() + " ms",
                    ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransientServiceException("Chat request interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            LOGGER.error("Failed to produce response for prompt '{}': {}", prompt, cause.getMessage(), cause);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new PermanentServiceException("Chat request failed: " + cause.getMessage(), cause);
        }
    }

    private ChatResponse generate(String prompt, AgentMode mode) {
        List<SearchResult> results = retrievalEngine.search(prompt);
        String context = contextAssembler.buildContext(results, maxContextChars);
        String response = llmClient.generate(prompt, context, mode);
        LOGGER.debug("Generated {} answer of {} characters from {} source(s)", mode, response.length(),
                results.size());
        return new ChatResponse(response, results.stream().map(SearchHit::of).toList());
    }
}
