package com.williamcallahan.videochat.service.generation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.EvidenceItem;
import com.williamcallahan.videochat.domain.SourceSignal;
import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.domain.stream.DoneEvent;
import com.williamcallahan.videochat.domain.stream.ErrorEvent;
import com.williamcallahan.videochat.domain.stream.MetadataEvent;
import com.williamcallahan.videochat.domain.stream.SourcesEvent;
import com.williamcallahan.videochat.domain.stream.StreamEvent;
import com.williamcallahan.videochat.domain.stream.TokenEvent;
import com.williamcallahan.videochat.model.ChatSession;
import com.williamcallahan.videochat.service.rerank.RerankerService;
import com.williamcallahan.videochat.service.rerank.RerankingFailureException;
import com.williamcallahan.videochat.service.retrieval.HybridRetrievalService;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.UserMessage;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

/**
 * Verifies event ordering, the no-evidence path and cancellation handling of question answering.
 */
class GenerationOrchestratorTest {

    private static final String QUESTION = "What is a base case?";

    private HybridRetrievalService retrievalService;
    private RerankerService rerankerService;
    private OpenAIStreamingService streamingService;
    private ConversationService conversationService;
    private AppProperties appProperties;
    private GenerationOrchestrator orchestrator;
    private ChatSession session;

    @BeforeEach
    void setUp() {
        retrievalService = mock(HybridRetrievalService.class);
        rerankerService = mock(RerankerService.class);
        streamingService = mock(OpenAIStreamingService.class);
        conversationService = mock(ConversationService.class);
        appProperties = new AppProperties();
        session = new ChatSession(UUID.randomUUID(), TaskType.QA, QUESTION, "default_user");
        when(conversationService.resolveSession(isNull(), eq(TaskType.QA), anyString(), eq("default_user")))
                .thenReturn(session);
        orchestrator = new GenerationOrchestrator(
                retrievalService,
                rerankerService,
                new EvidencePromptFormatter(),
                streamingService,
                conversationService,
                appProperties);
    }

    @Test
    void streamsMetadataTokensSourcesThenDone() {
        when(retrievalService.retrieve(eq(QUESTION), anyInt(), anyInt(), anyInt(), anyList()))
                .thenReturn(List.of(evidence("k1", "v1"), evidence("k2", "v2")));
        when(streamingService.streamResponse(eq(PromptTemplates.QA_SYSTEM_PROMPT), anyString()))
                .thenReturn(Flux.just("A", "B", "C"));

        StepVerifier.create(orchestrator.ask(QUESTION, List.of(), null, null, null))
                .assertNext(event -> {
                    MetadataEvent metadata = assertInstanceOf(MetadataEvent.class, event);
                    assertEquals(List.of("v1", "v2"), metadata.videoIds());
                    assertEquals(2, metadata.evidenceCount());
                })
                .expectNext(new TokenEvent("A"), new TokenEvent("B"), new TokenEvent("C"))
                .assertNext(event -> {
                    SourcesEvent sources = assertInstanceOf(SourcesEvent.class, event);
                    assertEquals(2, sources.sources().size());
                    assertEquals(1, sources.sources().get(0).index());
                })
                .assertNext(event -> {
                    DoneEvent done = assertInstanceOf(DoneEvent.class, event);
                    assertEquals("ABC", done.content());
                    assertEquals(session.getId().toString(), done.sessionId());
                    assertTrue(done.terminal());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(conversationService).appendTurn(eq(session.getId()), eq(QUESTION), eq("ABC"), anyList(), eq(false));
    }

    @Test
    void noEvidenceYieldsSingleErrorEvent() {
        when(retrievalService.retrieve(anyString(), anyInt(), anyInt(), anyInt(), anyList())).thenReturn(List.of());

        StepVerifier.create(orchestrator.ask(QUESTION, null, null, null, null))
                .expectNext(new ErrorEvent(GenerationOrchestrator.NO_EVIDENCE_MESSAGE))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(streamingService, never()).streamResponse(anyString(), anyString());
        verify(conversationService, never()).resolveSession(any(), any(), any(), any());
    }

    @Test
    void upstreamFailureAfterTokensEndsWithErrorEvent() {
        when(retrievalService.retrieve(anyString(), anyInt(), anyInt(), anyInt(), anyList()))
                .thenReturn(List.of(evidence("k1", "v1")));
        when(streamingService.streamResponse(anyString(), anyString()))
                .thenReturn(Flux.concat(Flux.just("A"), Flux.error(new StreamInterruptedException("reset"))));

        StepVerifier.create(orchestrator.ask(QUESTION, null, null, null, null))
                .expectNextMatches(MetadataEvent.class::isInstance)
                .expectNext(new TokenEvent("A"))
                .expectNext(new ErrorEvent(GenerationOrchestrator.GENERIC_FAILURE_MESSAGE))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(conversationService, never())
                .appendTurn(any(), anyString(), anyString(), anyList(), eq(false));
    }

    @Test
    void followUpUsesSessionHistory() {
        UUID sessionId = session.getId();
        when(conversationService.requireSession(sessionId)).thenReturn(session);
        when(conversationService.recentHistory(sessionId, 10))
                .thenReturn(List.of(new UserMessage("What is recursion?"), new AssistantMessage("A function calling itself.")));
        when(retrievalService.retrieve(anyString(), anyInt(), anyInt(), anyInt(), anyList()))
                .thenReturn(List.of(evidence("k1", "v1")));
        when(streamingService.streamResponse(anyString(), anyString())).thenAnswer(invocation -> {
            String userPrompt = invocation.getArgument(1);
            assertTrue(userPrompt.contains("A function calling itself."));
            return Flux.just("Yes.");
        });

        StepVerifier.create(orchestrator.followUp(QUESTION, sessionId, List.of("v1")))
                .expectNextMatches(MetadataEvent.class::isInstance)
                .expectNext(new TokenEvent("Yes."))
                .expectNextMatches(SourcesEvent.class::isInstance)
                .expectNextMatches(DoneEvent.class::isInstance)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void unknownFollowUpSessionYieldsErrorEvent() {
        UUID missing = UUID.randomUUID();
        when(retrievalService.retrieve(anyString(), anyInt(), anyInt(), anyInt(), anyList()))
                .thenReturn(List.of(evidence("k1", "v1")));
        when(conversationService.requireSession(missing))
                .thenThrow(new SessionNotFoundException("Session " + missing + " not found"));

        StepVerifier.create(orchestrator.followUp(QUESTION, missing, null))
                .expectNext(new ErrorEvent("Session " + missing + " not found"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void rerankFailureFallsBackToFusedOrder() {
        when(rerankerService.isEnabled()).thenReturn(true);
        when(retrievalService.retrieve(anyString(), anyInt(), anyInt(), anyInt(), anyList()))
                .thenReturn(List.of(evidence("k1", "v1")));
        when(rerankerService.rerank(anyString(), anyList(), any())).thenThrow(new RerankingFailureException("down"));
        when(streamingService.streamResponse(anyString(), anyString())).thenReturn(Flux.just("ok"));

        StepVerifier.create(orchestrator.ask(QUESTION, null, null, null, 3))
                .expectNextMatches(MetadataEvent.class::isInstance)
                .expectNext(new TokenEvent("ok"))
                .expectNextMatches(SourcesEvent.class::isInstance)
                .expectNextMatches(DoneEvent.class::isInstance)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void cancellationStoresPartialResponse() {
        when(retrievalService.retrieve(anyString(), anyInt(), anyInt(), anyInt(), anyList()))
                .thenReturn(List.of(evidence("k1", "v1")));
        when(streamingService.streamResponse(anyString(), anyString()))
                .thenReturn(Flux.concat(Flux.just("partial "), Flux.never()));

        StepVerifier.create(orchestrator.ask(QUESTION, null, null, null, null))
                .expectNextMatches(MetadataEvent.class::isInstance)
                .expectNext(new TokenEvent("partial "))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        verify(conversationService, timeout(2000))
                .appendTurn(eq(session.getId()), eq(QUESTION), eq("partial "), anyList(), eq(true));
    }

    private static EvidenceItem evidence(String key, String videoId) {
        return EvidenceItem.fromSignal(
                videoId, "Recursion " + videoId, "https://www.youtube.com/watch?v=" + videoId,
                30, 90, "The base case stops the recursion.", key, 0.8, SourceSignal.VECTOR);
    }
}
