package com.williamcallahan.videochat.web;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.domain.TaskType;
import com.williamcallahan.videochat.model.ChatSession;
import com.williamcallahan.videochat.service.generation.ConversationService;
import com.williamcallahan.videochat.service.generation.SessionNotFoundException;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Verifies session endpoints and their error mapping.
 */
class SessionControllerTest {

    private ConversationService conversationService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        conversationService = mock(ConversationService.class);
        ExceptionResponseBuilder exceptionBuilder = new ExceptionResponseBuilder();
        SessionController controller = new SessionController(conversationService, new AppProperties(), exceptionBuilder);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler(exceptionBuilder))
                .build();
    }

    @Test
    void createFallsBackToDefaultUser() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(conversationService.createSession(TaskType.QUIZ, "Week 3", "default_user"))
                .thenReturn(new ChatSession(sessionId, TaskType.QUIZ, "Week 3", "default_user"));

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_type\":\"quiz\",\"title\":\"Week 3\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(sessionId.toString()))
                .andExpect(jsonPath("$.task_type").value("quiz"))
                .andExpect(jsonPath("$.user_id").value("default_user"));
    }

    @Test
    void createRejectsMissingAndUnknownTaskTypes() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Untyped\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Request validation failed"));

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_type\":\"poetry\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request"));

        verifyNoInteractions(conversationService);
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(conversationService.requireSession(sessionId))
                .thenThrow(new SessionNotFoundException("Session not found: " + sessionId));

        mockMvc.perform(get("/api/sessions/{sessionId}", sessionId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Session not found: " + sessionId));
    }

    @Test
    void detailIncludesMessages() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(conversationService.requireSession(sessionId))
                .thenReturn(new ChatSession(sessionId, TaskType.QA, "What is recursion?", "u1"));
        when(conversationService.messages(sessionId)).thenReturn(List.of());

        mockMvc.perform(get("/api/sessions/{sessionId}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message_count").value(0))
                .andExpect(jsonPath("$.messages").isArray());
    }

    @Test
    void listRejectsUnknownTaskTypeFilter() throws Exception {
        mockMvc.perform(get("/api/sessions").param("task_type", "poetry"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown task type: poetry"));
    }

    @Test
    void listPassesFilters() throws Exception {
        when(conversationService.listSessions("u1", TaskType.VIDEO_SUMMARY, 10)).thenReturn(List.of());

        mockMvc.perform(get("/api/sessions")
                        .param("user_id", "u1")
                        .param("task_type", "video_summary")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(conversationService).listSessions(eq("u1"), eq(TaskType.VIDEO_SUMMARY), eq(10));
    }

    @Test
    void deleteReportsSuccess() throws Exception {
        UUID sessionId = UUID.randomUUID();

        mockMvc.perform(delete("/api/sessions/{sessionId}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        verify(conversationService).deleteSession(sessionId);
    }
}
