package com.williamcallahan.videochat.service.generation;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.EvidenceItem;
import com.williamcallahan.videochat.domain.SourceCitation;
import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.domain.stream.DoneEvent;
import com.williamcallahan.videochat.domain.stream.ErrorEvent;
import com.williamcallahan.videochat.domain.stream.MetadataEvent;
import com.williamcallahan.videochat.domain.stream.SourcesEvent;
import com.williamcallahan.videochat.domain.stream.StreamEvent;
import com.williamcallahan.videochat.domain.stream.TokenEvent;
import com.williamcallahan.videochat.model.ChatMessage;
import com.williamcallahan.videochat.model.ChatSession;
import com.williamcallahan.videochat.service.rerank.RerankerService;
import com.williamcallahan.videochat.service.rerank.RerankingFailureException;
import com.williamcallahan.videochat.service.retrieval.HybridRetrievalService;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Retrieval-augmented question answering as an ordered event stream.
 *
 * <p>Stages run {@link GenerationStage#RETRIEVING} through {@link GenerationStage#DONE}. The stream
 * is {@code metadata}, one {@code token} per model fragment, then {@code sources} and {@code done}.
 * Any failure ends the stream with a single {@code error} event; tokens already sent stay sent.
 * A client disconnect stores the text produced so far as a partial assistant message.</p>
 */
@Service
public class GenerationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    static final String NO_EVIDENCE_MESSAGE =
            "No relevant transcript evidence was found for this question. Try rephrasing it or ingesting more videos.";
    static final String GENERIC_FAILURE_MESSAGE = "Something went wrong while generating the answer. Please try again.";

    private static final int SESSION_TITLE_LENGTH = 100;

    private final HybridRetrievalService retrievalService;
    private final RerankerService rerankerService;
    private final EvidencePromptFormatter promptFormatter;
    private final OpenAIStreamingService streamingService;
    private final ConversationService conversationService;
    private final AppProperties appProperties;

    public GenerationOrchestrator(
            HybridRetrievalService retrievalService,
            RerankerService rerankerService,
            EvidencePromptFormatter promptFormatter,
            OpenAIStreamingService streamingService,
            ConversationService conversationService,
            AppProperties appProperties) {
        this.retrievalService = retrievalService;
        this.rerankerService = rerankerService;
        this.promptFormatter = promptFormatter;
        this.streamingService = streamingService;
        this.conversationService = conversationService;
        this.appProperties = appProperties;
    }

    /**
     * Answers a question, in a new session unless {@code sessionId} names an existing one.
     *
     * @param question user question
     * @param videoIds videos to search, empty for all
     * @param sessionId existing session, or null
     * @param userId owner for a new session, or null for the default user
     * @param topK evidence items to use, or null for the configured default
     * @return ordered event stream
     */
    public Flux<StreamEvent> ask(String question, List<String> videoIds, UUID sessionId, String userId, Integer topK) {
        String owner = userId == null || userId.isBlank()
                ? appProperties.getConversation().getDefaultUserId()
                : userId;
        return answer(question, videoIds, topK, false,
                () -> conversationService.resolveSession(sessionId, TaskType.QA, sessionTitle(question), owner));
    }

    /**
     * Answers a follow-up using the session's recent history.
     *
     * @param question follow-up question
     * @param sessionId existing session
     * @param videoIds videos to search, empty for all
     * @return ordered event stream; an error event when the session does not exist
     */
    public Flux<StreamEvent> followUp(String question, UUID sessionId, List<String> videoIds) {
        return answer(question, videoIds, null, true, () -> conversationService.requireSession(sessionId));
    }

    public List<ChatMessage> history(UUID sessionId) {
        return conversationService.messages(sessionId);
    }

    private Flux<StreamEvent> answer(
            String question,
            List<String> videoIds,
            Integer topK,
            boolean withHistory,
            Supplier<ChatSession> sessionSupplier) {
        return Flux.defer(() -> {
                    String requestId = UUID.randomUUID().toString().substring(0, 8);
                    stage(requestId, GenerationStage.RETRIEVING, "question chars=" + question.length());
                    List<String> filter = videoIds == null ? List.of() : videoIds;
                    List<EvidenceItem> evidence = gatherEvidence(question, filter, topK);
                    if (evidence.isEmpty()) {
                        throw new NoEvidenceFoundException("No evidence for question");
                    }
                    ChatSession session = sessionSupplier.get();

                    stage(requestId, GenerationStage.PROMPTING, "evidence=" + evidence.size());
                    String userPrompt;
                    if (withHistory) {
                        List<Message> history = conversationService.recentHistory(
                                session.getId(), appProperties.getConversation().getHistoryLimit());
                        userPrompt = promptFormatter.followUpPrompt(question, evidence, history);
                    } else {
                        userPrompt = promptFormatter.questionPrompt(question, evidence);
                    }
                    List<SourceCitation> citations = promptFormatter.citations(evidence);
                    return stream(requestId, question, session.getId(), evidence, citations, userPrompt);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(failure -> Flux.just(toErrorEvent(failure)));
    }

    private Flux<StreamEvent> stream(
            String requestId,
            String question,
            UUID sessionId,
            List<EvidenceItem> evidence,
            List<SourceCitation> citations,
            String userPrompt) {
        StringBuffer response = new StringBuffer();
        AtomicBoolean persisted = new AtomicBoolean(false);

        List<String> evidenceVideoIds = List.copyOf(
                new LinkedHashSet<>(evidence.stream().map(EvidenceItem::videoId).toList()));
        Flux<StreamEvent> metadata = Flux.just(new MetadataEvent(null, evidenceVideoIds, evidence.size()));

        Flux<StreamEvent> tokens = Flux.defer(() -> {
            stage(requestId, GenerationStage.STREAMING, "model call");
            return streamingService.streamResponse(PromptTemplates.QA_SYSTEM_PROMPT, userPrompt);
        })
                .doOnNext(response::append)
                .map(TokenEvent::new);

        Flux<StreamEvent> completion = Mono.fromCallable(() -> {
                    stage(requestId, GenerationStage.PERSISTING, "chars=" + response.length());
                    persisted.set(true);
                    conversationService.appendTurn(sessionId, question, response.toString(), citations, false);
                    stage(requestId, GenerationStage.DONE, "session=" + sessionId);
                    return response.toString();
                })
                .flatMapMany(content -> Flux.<StreamEvent>just(
                        new SourcesEvent(citations), DoneEvent.of(content, sessionId.toString(), citations)));

        return Flux.concat(metadata, tokens, completion)
                .doOnCancel(() -> persistPartial(requestId, sessionId, question, response, citations, persisted));
    }

    private List<EvidenceItem> gatherEvidence(String question, List<String> videoIds, Integer requestedTopK) {
        AppProperties.Retrieval retrieval = appProperties.getRetrieval();
        int topK = requestedTopK == null || requestedTopK <= 0 ? retrieval.getTopK() : requestedTopK;
        if (!rerankerService.isEnabled()) {
            return retrievalService.retrieve(question, topK, retrieval.getLexicalK(), retrieval.getVectorK(), videoIds);
        }
        int candidateK = Math.max(topK, appProperties.getRerank().getCandidateK());
        List<EvidenceItem> candidates =
                retrievalService.retrieve(question, candidateK, retrieval.getLexicalK(), retrieval.getVectorK(), videoIds);
        try {
            return rerankerService.rerank(question, candidates, topK);
        } catch (RerankingFailureException failure) {
            log.warn("[RETRIEVAL] Reranking failed, using fused order: {}", failure.getMessage());
            return candidates.size() > topK ? List.copyOf(candidates.subList(0, topK)) : candidates;
        }
    }

    private void persistPartial(
            String requestId,
            UUID sessionId,
            String question,
            StringBuffer response,
            List<SourceCitation> citations,
            AtomicBoolean persisted) {
        if (response.length() == 0 || !persisted.compareAndSet(false, true)) {
            return;
        }
        String partialText = response.toString();
        PIPELINE_LOG.info("[{}] client disconnected; storing {} chars as partial", requestId, partialText.length());
        Schedulers.boundedElastic().schedule(() -> {
            try {
                conversationService.appendTurn(sessionId, question, partialText, citations, true);
            } catch (RuntimeException e) {
                log.warn("Failed to store partial response for session {}: {}", sessionId, e.getMessage());
            }
        });
    }

    private static ErrorEvent toErrorEvent(Throwable failure) {
        if (failure instanceof NoEvidenceFoundException) {
            PIPELINE_LOG.info("{} -> no evidence", GenerationStage.ERROR);
            return new ErrorEvent(NO_EVIDENCE_MESSAGE);
        }
        if (failure instanceof SessionNotFoundException) {
            PIPELINE_LOG.info("{} -> {}", GenerationStage.ERROR, failure.getMessage());
            return new ErrorEvent(failure.getMessage());
        }
        PIPELINE_LOG.error("{} -> {}", GenerationStage.ERROR, failure.toString(), failure);
        return new ErrorEvent(GENERIC_FAILURE_MESSAGE);
    }

    private static void stage(String requestId, GenerationStage stage, String detail) {
        PIPELINE_LOG.info("[{}] {} {}", requestId, stage, detail);
    }

    private static String sessionTitle(String question) {
        String trimmed = question.strip();
        return trimmed.length() > SESSION_TITLE_LENGTH ? trimmed.substring(0, SESSION_TITLE_LENGTH) : trimmed;
    }
}
