package com.williamcallahan.videochat.web;

import jakarta.validation.constraints.NotNull;
import java.util.Map;

/**
 * Submitted answers keyed by question id.
 */
public record GradeQuizRequest(@NotNull(message = "answers is required") Map<String, String> answers) {}
