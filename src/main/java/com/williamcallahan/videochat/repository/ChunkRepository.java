package com.williamcallahan.videochat.repository;

import com.williamcallahan.videochat.model.Chunk;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChunkRepository extends JpaRepository<Chunk, Long> {
    List<Chunk> findByVideoIdOrderByStartTimeAscChunkIndexAsc(String videoId);

    List<Chunk> findByVideoIdOrderByStartTimeAscChunkIndexAsc(String videoId, Pageable pageable);

    long countByVideoId(String videoId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Chunk c where c.videoId = :videoId")
    int deleteByVideoId(@Param("videoId") String videoId);
}
