package com.williamcallahan.videochat.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Ingested video. Chunks reference it with an {@code ON DELETE CASCADE} foreign key.
 */
@Entity
@Table(name = "videos")
public class Video {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(nullable = false, columnDefinition = "text")
    private String title;

    @Column(name = "source_url", nullable = false, unique = true, length = 2048)
    private String sourceUrl;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "transcript_path", length = 1024)
    private String transcriptPath;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Video() {}

    public Video(String id, String sourceUrl) {
        this.id = id;
        this.sourceUrl = sourceUrl;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getSourceUrl() { return sourceUrl; }
    public Double getDurationSeconds() { return durationSeconds; }
    public String getTranscriptPath() { return transcriptPath; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setTitle(String title) { this.title = title; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }
    public void setDurationSeconds(Double durationSeconds) { this.durationSeconds = durationSeconds; }
    public void setTranscriptPath(String transcriptPath) { this.transcriptPath = transcriptPath; }
}
