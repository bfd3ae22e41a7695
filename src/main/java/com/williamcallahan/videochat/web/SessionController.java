package com.williamcallahan.videochat.web;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.domain.errors.ApiResponse;
import com.williamcallahan.videochat.model.ChatSession;
import com.williamcallahan.videochat.service.generation.ConversationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/api/sessions")
public class SessionController extends BaseController {
    private static final int MAX_LISTED_SESSIONS = 200;

    private final ConversationService conversationService;
    private final AppProperties appProperties;

    public SessionController(
            ConversationService conversationService,
            AppProperties appProperties,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.conversationService = conversationService;
        this.appProperties = appProperties;
    }

    @PostMapping
    public ResponseEntity<SessionView> create(@Valid @RequestBody CreateSessionRequest request) {
        String userId = request.userId() == null || request.userId().isBlank()
                ? appProperties.getConversation().getDefaultUserId()
                : request.userId();
        ChatSession session = conversationService.createSession(request.taskType(), request.title(), userId);
        return created(SessionView.of(session));
    }

    @GetMapping
    public List<SessionView> list(
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(name = "task_type", required = false) String taskType,
            @RequestParam(name = "limit", defaultValue = "50")
                    @Min(value = 1, message = "limit must be at least 1")
                    @Max(value = MAX_LISTED_SESSIONS, message = "limit cannot exceed " + MAX_LISTED_SESSIONS)
                    int limit) {
        TaskType filter = taskType == null || taskType.isBlank() ? null : TaskType.fromWireValue(taskType);
        return conversationService.listSessions(userId, filter, limit).stream()
                .map(SessionView::of)
                .toList();
    }

    @GetMapping("/{sessionId}")
    public SessionView get(@PathVariable("sessionId") UUID sessionId) {
        ChatSession session = conversationService.requireSession(sessionId);
        return SessionView.withMessages(session, MessageView.fromAll(conversationService.messages(sessionId)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<ApiResponse> delete(@PathVariable("sessionId") UUID sessionId) {
        conversationService.deleteSession(sessionId);
        return createSuccessResponse("Session " + sessionId + " deleted");
    }
}
