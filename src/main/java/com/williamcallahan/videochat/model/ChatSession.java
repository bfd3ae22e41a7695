package com.williamcallahan.videochat.model;

import com.williamcallahan.videochat.domain.TaskType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "chat_sessions",
        indexes = @Index(name = "idx_chat_sessions_user_updated", columnList = "user_id, updated_at"))
public class ChatSession {

    @Id
    private UUID id;

    @Column(name = "task_type", nullable = false, length = 32)
    private TaskType taskType;

    @Column(columnDefinition = "text")
    private String title;

    @Column(name = "user_id", nullable = false, length = 255)
    private String userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ChatSession() {}

    public ChatSession(UUID id, TaskType taskType, String title, String userId) {
        this.id = id;
        this.taskType = taskType;
        this.title = title;
        this.userId = userId;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    /** Marks the session as having a new turn. */
    public void touch() {
        updatedAt = Instant.now();
    }

    public UUID getId() { return id; }
    public TaskType getTaskType() { return taskType; }
    public String getTitle() { return title; }
    public String getUserId() { return userId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setTitle(String title) { this.title = title; }
}
