package com.williamcallahan.videochat.service.ingestion;

import com.williamcallahan.videochat.domain.MediaDownload;

/**
 * Fetches a video's audio track and basic metadata.
 */
public interface MediaDownloader {

    /**
     * Downloads audio for one video.
     *
     * @param videoUrl canonical video URL
     * @param videoId id used to name the local audio file
     * @return downloaded audio location with title and duration
     * @throws MediaDownloadException when metadata or audio cannot be fetched
     */
    MediaDownload download(String videoUrl, String videoId);
}
