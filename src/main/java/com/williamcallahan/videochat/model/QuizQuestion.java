package com.williamcallahan.videochat.model;

import com.williamcallahan.videochat.domain.QuestionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "quiz_questions")
public class QuizQuestion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private ChatSession session;

    @Column(name = "video_id", length = 64)
    private String videoId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "video_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Video video;

    @Column(nullable = false)
    private int position;

    @Column(name = "question_type", nullable = false, length = 16)
    private QuestionType questionType;

    @Column(nullable = false, columnDefinition = "text")
    private String question;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, String> options = new LinkedHashMap<>();

    @Column(name = "correct_answer", nullable = false, length = 255)
    private String correctAnswer;

    @Column(columnDefinition = "text")
    private String explanation;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected QuizQuestion() {}

    public QuizQuestion(
            UUID sessionId,
            String videoId,
            int position,
            QuestionType questionType,
            String question,
            Map<String, String> options,
            String correctAnswer,
            String explanation) {
        this.sessionId = sessionId;
        this.videoId = videoId;
        this.position = position;
        this.questionType = questionType;
        this.question = question;
        this.options = options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options);
        this.correctAnswer = correctAnswer;
        this.explanation = explanation;
    }

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public UUID getSessionId() { return sessionId; }
    public String getVideoId() { return videoId; }
    public int getPosition() { return position; }
    public QuestionType getQuestionType() { return questionType; }
    public String getQuestion() { return question; }
    public Map<String, String> getOptions() { return options == null ? Map.of() : Map.copyOf(options); }
    public String getCorrectAnswer() { return correctAnswer; }
    public String getExplanation() { return explanation; }
    public Instant getCreatedAt() { return createdAt; }
}
