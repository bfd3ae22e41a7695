package com.williamcallahan.videochat.service.quiz;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.QuestionType;
import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.model.ChatSession;
import com.williamcallahan.videochat.model.Chunk;
import com.williamcallahan.videochat.model.QuizQuestion;
import com.williamcallahan.videochat.model.Video;
import com.williamcallahan.videochat.repository.QuizQuestionRepository;
import com.williamcallahan.videochat.repository.VideoRepository;
import com.williamcallahan.videochat.service.VideoNotFoundException;
import com.williamcallahan.videochat.service.generation.ConversationService;
import com.williamcallahan.videochat.service.generation.OpenAIStreamingService;
import com.williamcallahan.videochat.service.generation.PromptTemplates;
import com.williamcallahan.videochat.service.quiz.QuizResponseParser.ParsedQuestion;
import com.williamcallahan.videochat.service.retrieval.HybridRetrievalService;
import com.williamcallahan.videochat.support.PromptTokenBudget;
import com.williamcallahan.videochat.support.TimestampFormatter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Generates, stores and grades quizzes over ingested videos.
 */
@Service
public class QuizGenerationService {
    private static final Logger log = LoggerFactory.getLogger(QuizGenerationService.class);

    private static final String SESSION_TITLE_PREFIX = "Quiz: ";
    private static final String SOURCE_SEPARATOR = "\n\n";

    private final HybridRetrievalService retrievalService;
    private final VideoRepository videoRepository;
    private final QuizQuestionRepository quizQuestionRepository;
    private final ConversationService conversationService;
    private final OpenAIStreamingService streamingService;
    private final QuizResponseParser responseParser;
    private final PromptTokenBudget tokenBudget;
    private final AppProperties appProperties;

    public QuizGenerationService(
            HybridRetrievalService retrievalService,
            VideoRepository videoRepository,
            QuizQuestionRepository quizQuestionRepository,
            ConversationService conversationService,
            OpenAIStreamingService streamingService,
            QuizResponseParser responseParser,
            PromptTokenBudget tokenBudget,
            AppProperties appProperties) {
        this.retrievalService = retrievalService;
        this.videoRepository = videoRepository;
        this.quizQuestionRepository = quizQuestionRepository;
        this.conversationService = conversationService;
        this.streamingService = streamingService;
        this.responseParser = responseParser;
        this.tokenBudget = tokenBudget;
        this.appProperties = appProperties;
    }

    /**
     * Generates and stores a quiz.
     *
     * @param videoIds videos to draw questions from, at least one
     * @param numQuestions questions to generate, {@code 1..app.quiz.max-questions}
     * @param questionType multiple choice or yes/no
     * @param sessionId existing session, or null for a new quiz session
     * @return the stored quiz
     * @throws IllegalArgumentException when the request is out of range
     * @throws VideoNotFoundException when none of the videos has transcript chunks
     * @throws QuizGenerationException when the model output is unusable
     */
    public QuizView generateQuiz(List<String> videoIds, int numQuestions, QuestionType questionType, UUID sessionId) {
        if (videoIds == null || videoIds.isEmpty()) {
            throw new IllegalArgumentException("video_ids must contain at least one video");
        }
        int maxQuestions = appProperties.getQuiz().getMaxQuestions();
        if (numQuestions < 1 || numQuestions > maxQuestions) {
            throw new IllegalArgumentException("num_questions must be between 1 and " + maxQuestions);
        }
        QuestionType type = questionType == null ? QuestionType.MCQ : questionType;
        List<String> requested = List.copyOf(new LinkedHashSet<>(videoIds));

        List<String> sourceVideoIds = new ArrayList<>();
        List<String> sourceBlocks = new ArrayList<>();
        collectSources(requested, sourceVideoIds, sourceBlocks);
        if (sourceBlocks.isEmpty()) {
            throw new VideoNotFoundException("No transcript found for videos " + requested);
        }
        List<String> kept = tokenBudget.leadingBlocksWithin(sourceBlocks, appProperties.getQuiz().getMaxPromptTokens());
        String sources = String.join(SOURCE_SEPARATOR, kept);

        String template = type == QuestionType.YES_NO
                ? PromptTemplates.YES_NO_QUIZ_USER_TEMPLATE
                : PromptTemplates.MCQ_QUIZ_USER_TEMPLATE;
        String prompt = template.formatted(numQuestions, sources, numQuestions);

        log.info("Generating {} {} question(s) for videos={} from {} source(s)",
                numQuestions, type.wireValue(), requested, kept.size());
        String rawResponse = streamingService.complete(PromptTemplates.QUIZ_SYSTEM_PROMPT, prompt)
                .block(Duration.ofSeconds(appProperties.getLlm().getTimeoutSeconds()));
        List<ParsedQuestion> parsed = responseParser.parse(rawResponse, type);
        if (parsed.size() > numQuestions) {
            parsed = parsed.subList(0, numQuestions);
        }

        ChatSession session = conversationService.resolveSession(
                sessionId,
                TaskType.QUIZ,
                SESSION_TITLE_PREFIX + String.join(", ", requested),
                appProperties.getConversation().getDefaultUserId());

        List<QuizQuestion> rows = new ArrayList<>(parsed.size());
        int nextPosition = quizQuestionRepository.findBySessionIdOrderByPositionAsc(session.getId()).size() + 1;
        for (ParsedQuestion question : parsed) {
            rows.add(new QuizQuestion(
                    session.getId(),
                    attributeVideo(question, sourceVideoIds, requested),
                    nextPosition++,
                    type,
                    question.question(),
                    question.options(),
                    question.correctAnswer(),
                    question.explanation()));
        }
        List<QuizQuestion> stored = quizQuestionRepository.saveAll(rows);
        log.info("Stored {} quiz question(s) in session={}", stored.size(), session.getId());
        return new QuizView(session.getId(), stored.stream().map(QuizQuestionView::from).toList());
    }

    /**
     * Returns the stored quiz of a session.
     */
    public QuizView getQuiz(UUID sessionId) {
        conversationService.requireSession(sessionId);
        List<QuizQuestionView> questions = quizQuestionRepository.findBySessionIdOrderByPositionAsc(sessionId)
                .stream()
                .map(QuizQuestionView::from)
                .toList();
        return new QuizView(sessionId, questions);
    }

    /**
     * Grades answers keyed by question id. Unanswered questions count as wrong.
     *
     * @param sessionId quiz session
     * @param answers submitted answers keyed by question id
     * @return per-question results and the percentage score
     */
    public QuizGrade grade(UUID sessionId, Map<String, String> answers) {
        conversationService.requireSession(sessionId);
        List<QuizQuestion> questions = quizQuestionRepository.findBySessionIdOrderByPositionAsc(sessionId);
        Map<String, String> submitted = answers == null ? Map.of() : answers;

        List<QuizGrade.QuestionResult> results = new ArrayList<>(questions.size());
        int correctCount = 0;
        for (QuizQuestion question : questions) {
            String given = submitted.get(String.valueOf(question.getId()));
            boolean correct = given != null
                    && given.trim().toLowerCase(Locale.ROOT)
                            .equals(question.getCorrectAnswer().trim().toLowerCase(Locale.ROOT));
            if (correct) {
                correctCount++;
            }
            results.add(new QuizGrade.QuestionResult(
                    question.getId(), given, question.getCorrectAnswer(), correct, question.getExplanation()));
        }
        double score = questions.isEmpty() ? 0.0 : Math.round(correctCount * 1000.0 / questions.size()) / 10.0;
        return new QuizGrade(sessionId, questions.size(), correctCount, score, results);
    }

    private void collectSources(List<String> videoIds, List<String> sourceVideoIds, List<String> sourceBlocks) {
        int perVideoLimit = Math.max(1, appProperties.getQuiz().getMaxTranscriptChunks() / videoIds.size());
        for (String videoId : videoIds) {
            List<Chunk> chunks = retrievalService.chunksForVideo(videoId, perVideoLimit);
            if (chunks.isEmpty()) {
                log.warn("Quiz requested for video={} which has no transcript chunks", videoId);
                continue;
            }
            String title = videoRepository.findById(videoId).map(Video::getTitle).orElse(videoId);
            for (Chunk chunk : chunks) {
                sourceVideoIds.add(videoId);
                sourceBlocks.add("[" + (sourceBlocks.size() + 1) + "] Video: " + title
                        + " (" + TimestampFormatter.minutesSeconds(chunk.getStartTime())
                        + "-" + TimestampFormatter.minutesSeconds(chunk.getEndTime()) + ")\n"
                        + chunk.getText());
            }
        }
    }

    private static String attributeVideo(ParsedQuestion question, List<String> sourceVideoIds, List<String> requested) {
        Set<String> allowed = Set.copyOf(requested);
        if (question.videoId() != null && allowed.contains(question.videoId())) {
            return question.videoId();
        }
        Integer sourceIndex = question.sourceIndex();
        if (sourceIndex != null && sourceIndex >= 1 && sourceIndex <= sourceVideoIds.size()) {
            return sourceVideoIds.get(sourceIndex - 1);
        }
        return requested.size() == 1 ? requested.get(0) : null;
    }
}
