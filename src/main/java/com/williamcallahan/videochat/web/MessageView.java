package com.williamcallahan.videochat.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.williamcallahan.videochat.domain.MessageRole;
import com.williamcallahan.videochat.domain.SourceCitation;
import com.williamcallahan.videochat.model.ChatMessage;
import java.time.Instant;
import java.util.List;

/**
 * Wire form of a stored chat message.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageView(
        Long id, MessageRole role, String content, List<SourceCitation> sources, boolean partial, Instant createdAt) {

    static MessageView from(ChatMessage message) {
        return new MessageView(
                message.getId(),
                message.getRole(),
                message.getContent(),
                message.getSources(),
                message.isPartial(),
                message.getCreatedAt());
    }

    static List<MessageView> fromAll(List<ChatMessage> messages) {
        return messages.stream().map(MessageView::from).toList();
    }
}
