package com.williamcallahan.videochat.service.generation;

import com.williamcallahan.videochat.model.ChatSession;

/**
 * A session together with how many messages it holds.
 */
public record SessionSummary(ChatSession session, long messageCount) {}
