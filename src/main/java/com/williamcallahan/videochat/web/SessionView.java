package com.williamcallahan.videochat.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.model.ChatSession;
import com.williamcallahan.videochat.service.generation.SessionSummary;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Wire form of a chat session. Message fields are filled depending on the endpoint.
 *
 * @param messageCount stored messages, set by the listing endpoint
 * @param messages full transcript, set by the detail endpoint
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(
        UUID id,
        TaskType taskType,
        String title,
        String userId,
        Instant createdAt,
        Instant updatedAt,
        Long messageCount,
        List<MessageView> messages) {

    static SessionView of(ChatSession session) {
        return new SessionView(
                session.getId(),
                session.getTaskType(),
                session.getTitle(),
                session.getUserId(),
                session.getCreatedAt(),
                session.getUpdatedAt(),
                null,
                null);
    }

    static SessionView of(SessionSummary summary) {
        ChatSession session = summary.session();
        return new SessionView(
                session.getId(),
                session.getTaskType(),
                session.getTitle(),
                session.getUserId(),
                session.getCreatedAt(),
                session.getUpdatedAt(),
                summary.messageCount(),
                null);
    }

    static SessionView withMessages(ChatSession session, List<MessageView> messages) {
        return new SessionView(
                session.getId(),
                session.getTaskType(),
                session.getTitle(),
                session.getUserId(),
                session.getCreatedAt(),
                session.getUpdatedAt(),
                (long) messages.size(),
                messages);
    }
}
