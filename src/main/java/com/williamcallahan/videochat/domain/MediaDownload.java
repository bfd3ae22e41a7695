package com.williamcallahan.videochat.domain;

import java.nio.file.Path;

/**
 * Audio file and metadata fetched for one video.
 *
 * @param videoId stable external media identifier
 * @param title video title reported by the source
 * @param durationSeconds reported duration, zero when unknown
 * @param audioPath local audio file to transcribe
 */
public record MediaDownload(String videoId, String title, double durationSeconds, Path audioPath) {}
