package com.williamcallahan.videochat.service.generation;

import com.williamcallahan.videochat.domain.MessageRole;
import com.williamcallahan.videochat.domain.SourceCitation;
import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.model.ChatMessage;
import com.williamcallahan.videochat.model.ChatSession;
import com.williamcallahan.videochat.repository.ChatMessageRepository;
import com.williamcallahan.videochat.repository.ChatSessionRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Chat sessions and their append-only message log.
 */
@Service
public class ConversationService {
    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    private static final int MAX_TITLE_LENGTH = 100;

    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;

    public ConversationService(ChatSessionRepository sessionRepository, ChatMessageRepository messageRepository) {
        this.sessionRepository = sessionRepository;
        this.messageRepository = messageRepository;
    }

    @Transactional
    public ChatSession createSession(TaskType taskType, String title, String userId) {
        ChatSession session = new ChatSession(UUID.randomUUID(), taskType, truncateTitle(title), userId);
        ChatSession saved = sessionRepository.save(session);
        log.debug("Created {} session {}", taskType.wireValue(), saved.getId());
        return saved;
    }

    /**
     * Returns the existing session.
     *
     * @throws SessionNotFoundException when no session has this id
     */
    @Transactional(readOnly = true)
    public ChatSession requireSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Session " + sessionId + " not found"));
    }

    /**
     * Validates a supplied session id or creates a new session when none was supplied.
     */
    @Transactional
    public ChatSession resolveSession(UUID sessionId, TaskType taskType, String title, String userId) {
        if (sessionId != null) {
            return requireSession(sessionId);
        }
        return createSession(taskType, title, userId);
    }

    /**
     * Appends a conversation turn and marks the session as updated.
     *
     * @param sessionId owning session
     * @param userContent user message, or {@code null} when the turn has no user side
     * @param assistantContent generated text
     * @param sources citations in prompt numbering order
     * @param partial true when generation was cut short by a client disconnect
     * @return the stored assistant message
     */
    @Transactional
    public ChatMessage appendTurn(
            UUID sessionId, String userContent, String assistantContent, List<SourceCitation> sources, boolean partial) {
        ChatSession session = requireSession(sessionId);
        if (userContent != null) {
            messageRepository.save(new ChatMessage(sessionId, MessageRole.USER, userContent, List.of(), false));
        }
        ChatMessage assistant = messageRepository.save(
                new ChatMessage(sessionId, MessageRole.ASSISTANT, assistantContent, sources, partial));
        session.touch();
        sessionRepository.save(session);
        return assistant;
    }

    @Transactional(readOnly = true)
    public List<ChatMessage> messages(UUID sessionId) {
        requireSession(sessionId);
        return messageRepository.findBySessionIdOrderByCreatedAtAscIdAsc(sessionId);
    }

    /**
     * Returns the last {@code limit} messages, oldest first, as prompt history.
     */
    @Transactional(readOnly = true)
    public List<Message> recentHistory(UUID sessionId, int limit) {
        List<ChatMessage> newestFirst =
                messageRepository.findBySessionIdOrderByCreatedAtDescIdDesc(sessionId, PageRequest.of(0, limit));
        List<Message> history = new ArrayList<>(newestFirst.size());
        for (ChatMessage message : newestFirst) {
            history.add(message.getRole() == MessageRole.ASSISTANT
                    ? new AssistantMessage(message.getContent())
                    : new UserMessage(message.getContent()));
        }
        Collections.reverse(history);
        return history;
    }

    /**
     * Finds the newest assistant message of the newest session with this task type and title.
     */
    @Transactional(readOnly = true)
    public Optional<ChatMessage> latestAssistantMessage(TaskType taskType, String title) {
        return sessionRepository.findFirstByTaskTypeAndTitleOrderByUpdatedAtDesc(taskType, title)
                .flatMap(session -> messageRepository.findFirstBySessionIdAndRoleOrderByCreatedAtDescIdDesc(
                        session.getId(), MessageRole.ASSISTANT));
    }

    /**
     * Lists sessions, newest activity first.
     *
     * @param userId owner filter, blank for all
     * @param taskType task filter, null for all
     * @param limit maximum sessions
     */
    @Transactional(readOnly = true)
    public List<SessionSummary> listSessions(String userId, TaskType taskType, int limit) {
        Pageable page = PageRequest.of(0, Math.max(1, limit));
        boolean byUser = userId != null && !userId.isBlank();
        List<ChatSession> sessions;
        if (byUser && taskType != null) {
            sessions = sessionRepository.findByUserIdAndTaskTypeOrderByUpdatedAtDesc(userId, taskType, page);
        } else if (byUser) {
            sessions = sessionRepository.findByUserIdOrderByUpdatedAtDesc(userId, page);
        } else if (taskType != null) {
            sessions = sessionRepository.findByTaskTypeOrderByUpdatedAtDesc(taskType, page);
        } else {
            sessions = sessionRepository.findAllByOrderByUpdatedAtDesc(page);
        }
        if (sessions.isEmpty()) {
            return List.of();
        }

        Map<UUID, Long> counts = new HashMap<>();
        for (Object[] row : messageRepository.countBySessionIds(sessions.stream().map(ChatSession::getId).toList())) {
            counts.put((UUID) row[0], ((Number) row[1]).longValue());
        }
        return sessions.stream()
                .map(session -> new SessionSummary(session, counts.getOrDefault(session.getId(), 0L)))
                .toList();
    }

    /**
     * Deletes a session; its messages and quiz questions go with it.
     *
     * @throws SessionNotFoundException when no session has this id
     */
    @Transactional
    public void deleteSession(UUID sessionId) {
        ChatSession session = requireSession(sessionId);
        sessionRepository.delete(session);
        log.info("Deleted session {}", sessionId);
    }

    private static String truncateTitle(String title) {
        if (title == null) {
            return null;
        }
        String trimmed = title.strip();
        return trimmed.length() > MAX_TITLE_LENGTH ? trimmed.substring(0, MAX_TITLE_LENGTH) : trimmed;
    }
}
