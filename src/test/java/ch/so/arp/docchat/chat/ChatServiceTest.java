package ch.so.arp.docchat.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.docchat.document.Chunk;
import ch.so.arp.docchat.document.ChunkEmbedding;
import ch.so.arp.docchat.document.Document;
import ch.so.arp.docchat.document.DocumentCategory;
import ch.so.arp.docchat.document.SearchResult;
import ch.so.arp.docchat.error.PermanentServiceException;
import ch.so.arp.docchat.error.TransientServiceException;
import ch.so.arp.docchat.error.ValidationException;
import ch.so.arp.docchat.retrieval.ContextAssembler;
import ch.so.arp.docchat.retrieval.RetrievalEngine;

class ChatServiceTest {

    private final RetrievalEngine retrievalEngine = mock(RetrievalEngine.class);
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void answersWithRetrievedContextAndSources() {
        when(retrievalEngine.search("Who may work remotely?")).thenReturn(List.of(result()));
        AtomicReference<String> receivedContext = new AtomicReference<>();
        LlmClient llmClient = (prompt, context, mode) -> {
            receivedContext.set(context);
            return "After six months [" + mode + "]";
        };
        ChatService chatService = new ChatService(retrievalEngine, new ContextAssembler(), llmClient,
                Runnable::run, 8000, Duration.ofSeconds(5));

        ChatResponse response = chatService.answer("Who may work remotely?", AgentMode.DOCUMENT_SEARCH);

        assertThat(response.response()).isEqualTo("After six months [document-search]");
        assertThat(response.sources()).singleElement()
                .satisfies(hit -> assertThat(hit.documentId()).isEqualTo("hr"));
        assertThat(receivedContext.get()).isEqualTo(
                "Document: Remote work (politics)\nContent: remote work eligibility requires six months tenure");
    }

    @Test
    void boundsContextLength() {
        when(retrievalEngine.search("prompt")).thenReturn(List.of(result()));
        AtomicReference<String> receivedContext = new AtomicReference<>();
        ChatService chatService = new ChatService(retrievalEngine, new ContextAssembler(),
                (prompt, context, mode) -> {
                    receivedContext.set(context);
                    return "ok";
                }, Runnable::run, 20, Duration.ofSeconds(5));

        chatService.answer("prompt", null);

        assertThat(receivedContext.get()).hasSize(20);
    }

    @Test
    void propagatesGenerationFailures() {
        when(retrievalEngine.search("prompt")).thenReturn(List.of());
        ChatService chatService = new ChatService(retrievalEngine, new ContextAssembler(),
                (prompt, context, mode) -> {
                    throw new PermanentServiceException("Chat completion failed with HTTP 401");
                }, executor, 8000, Duration.ofSeconds(5));

        assertThatThrownBy(() -> chatService.answer("prompt", AgentMode.DOCUMENT_CREATOR))
                .isInstanceOf(PermanentServiceException.class)
                .hasMessageContaining("401");
    }

    @Test
    void failsWithTransientErrorWhenRequestTimesOut() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        when(retrievalEngine.search("prompt")).thenReturn(List.of());
        ChatService chatService = new ChatService(retrievalEngine, new ContextAssembler(),
                (prompt, context, mode) -> {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return "too late";
                }, executor, 8000, Duration.ofMillis(50));

        assertThatThrownBy(() -> chatService.answer("prompt", AgentMode.DOCUMENT_SEARCH))
                .isInstanceOf(TransientServiceException.class)
                .hasMessageContaining("timed out");
        release.countDown();
    }

    @Test
    void rejectsBlankPrompt() {
        ChatService chatService = new ChatService(retrievalEngine, new ContextAssembler(),
                (prompt, context, mode) -> "unused", Runnable::run, 8000, Duration.ofSeconds(5));

        assertThatThrownBy(() -> chatService.answer(" ", AgentMode.DOCUMENT_SEARCH))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(retrievalEngine);
    }

    private static SearchResult result() {
        Document document = new Document("hr", "Remote work", "text", DocumentCategory.POLITICS, "hr.txt",
                Instant.parse("2024-05-01T00:00:00Z"), null);
        Chunk chunk = new Chunk("hr-c0", "hr", "remote work eligibility requires six months tenure", 0,
                ChunkEmbedding.none());
        return new SearchResult(chunk, document, 1.0d);
    }
}
