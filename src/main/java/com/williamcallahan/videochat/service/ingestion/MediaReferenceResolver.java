package com.williamcallahan.videochat.service.ingestion;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Derives stable YouTube video ids from the URL forms users paste.
 */
@Component
public class MediaReferenceResolver {

    private static final Pattern VIDEO_ID_PATTERN =
            Pattern.compile("(?:youtube\\.com/watch\\?v=|youtu\\.be/|youtube\\.com/embed/)([^&\\n?#]+)");
    private static final String WATCH_URL_PREFIX = "https://www.youtube.com/watch?v=";

    /**
     * Extracts the video id from a watch, short or embed URL.
     *
     * @param videoUrl URL as supplied by the caller
     * @return video id
     * @throws InvalidMediaReferenceException when no supported pattern matches
     */
    public String resolveVideoId(String videoUrl) {
        if (videoUrl == null || videoUrl.isBlank()) {
            throw new InvalidMediaReferenceException("Video URL is required");
        }
        Matcher matcher = VIDEO_ID_PATTERN.matcher(videoUrl.trim());
        if (!matcher.find()) {
            throw new InvalidMediaReferenceException("Invalid YouTube URL: " + videoUrl);
        }
        return matcher.group(1);
    }

    public String canonicalUrl(String videoId) {
        return WATCH_URL_PREFIX + videoId;
    }
}
