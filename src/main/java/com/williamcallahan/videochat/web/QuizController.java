package com.williamcallahan.videochat.web;

import com.williamcallahan.videochat.service.quiz.QuizGenerationService;
import com.williamcallahan.videochat.service.quiz.QuizGrade;
import com.williamcallahan.videochat.service.quiz.QuizView;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/quiz")
public class QuizController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(QuizController.class);

    private final QuizGenerationService quizService;

    public QuizController(QuizGenerationService quizService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.quizService = quizService;
    }

    @PostMapping("/generate")
    public QuizView generate(@Valid @RequestBody GenerateQuizRequest request) {
        log.info("Quiz requested: videos={} questions={}", request.videoIds(), request.numQuestions());
        return quizService.generateQuiz(
                request.videoIds(), request.numQuestions(), request.questionType(), request.sessionId());
    }

    @GetMapping("/{sessionId}")
    public QuizView quiz(@PathVariable("sessionId") UUID sessionId) {
        return quizService.getQuiz(sessionId);
    }

    @PostMapping("/{sessionId}/grade")
    public QuizGrade grade(@PathVariable("sessionId") UUID sessionId, @Valid @RequestBody GradeQuizRequest request) {
        return quizService.grade(sessionId, request.answers());
    }
}
