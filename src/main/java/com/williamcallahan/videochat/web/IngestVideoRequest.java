package com.williamcallahan.videochat.web;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for video ingestion.
 *
 * @param url YouTube watch, short or embed link
 */
public record IngestVideoRequest(@NotBlank(message = "url is required") String url) {}
