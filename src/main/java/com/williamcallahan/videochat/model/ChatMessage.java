package com.williamcallahan.videochat.model;

import com.williamcallahan.videochat.domain.MessageRole;
import com.williamcallahan.videochat.domain.SourceCitation;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

/**
 * Immutable conversation turn. Creation order is conversation order.
 */
@Entity
@Table(
        name = "chat_messages",
        indexes = @Index(name = "idx_chat_messages_session_created", columnList = "session_id, created_at"))
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private ChatSession session;

    @Column(nullable = false, length = 16)
    private MessageRole role;

    @Column(nullable = false, columnDefinition = "text")
    private String content;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private List<SourceCitation> sources = new ArrayList<>();

    // assistant turn cut short by a client disconnect
    @Column(nullable = false)
    private boolean partial;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ChatMessage() {}

    public ChatMessage(UUID sessionId, MessageRole role, String content, List<SourceCitation> sources, boolean partial) {
        this.sessionId = sessionId;
        this.role = role;
        this.content = content;
        this.sources = sources == null ? new ArrayList<>() : new ArrayList<>(sources);
        this.partial = partial;
    }

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public UUID getSessionId() { return sessionId; }
    public MessageRole getRole() { return role; }
    public String getContent() { return content; }
    public List<SourceCitation> getSources() { return sources == null ? List.of() : List.copyOf(sources); }
    public boolean isPartial() { return partial; }
    public Instant getCreatedAt() { return createdAt; }
}
