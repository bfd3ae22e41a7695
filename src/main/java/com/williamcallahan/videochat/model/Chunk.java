package com.williamcallahan.videochat.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * Time-bounded transcript excerpt. {@code vectorIndexKey} is the id of the matching Qdrant point.
 */
@Entity
@Table(
        name = "chunks",
        indexes = @Index(name = "idx_chunks_video_start", columnList = "video_id, start_time"))
@Check(constraints = "end_time >= start_time")
public class Chunk {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "video_id", nullable = false, length = 64)
    private String videoId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "video_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Video video;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Column(name = "start_time", nullable = false)
    private double startTime;

    @Column(name = "end_time", nullable = false)
    private double endTime;

    @Column(nullable = false, columnDefinition = "text")
    private String text;

    @Column(name = "vector_index_key", nullable = false, unique = true, length = 36)
    private String vectorIndexKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Chunk() {}

    public Chunk(String videoId, int chunkIndex, double startTime, double endTime, String text, String vectorIndexKey) {
        this.videoId = videoId;
        this.chunkIndex = chunkIndex;
        this.startTime = startTime;
        this.endTime = endTime;
        this.text = text;
        this.vectorIndexKey = vectorIndexKey;
    }

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public String getVideoId() { return videoId; }
    public int getChunkIndex() { return chunkIndex; }
    public double getStartTime() { return startTime; }
    public double getEndTime() { return endTime; }
    public String getText() { return text; }
    public String getVectorIndexKey() { return vectorIndexKey; }
    public Instant getCreatedAt() { return createdAt; }
}
