package com.williamcallahan.videochat.repository;

import com.williamcallahan.videochat.model.Video;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VideoRepository extends JpaRepository<Video, String> {
    Optional<Video> findBySourceUrl(String sourceUrl);

    List<Video> findAllByOrderByCreatedAtDesc();

    /**
     * Inserts a placeholder row unless one already exists, so concurrent ingestions of a new video
     * converge on a single row instead of racing on the primary key.
     *
     * @return 1 when the row was created, 0 when it already existed
     */
    @Modifying
    @Query(value = """
            INSERT INTO videos (id, title, source_url, created_at, updated_at)
            VALUES (:id, :title, :sourceUrl, now(), now())
            ON CONFLICT DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") String id, @Param("title") String title, @Param("sourceUrl") String sourceUrl);

    /**
     * Loads a video holding a row lock until the transaction ends; writers of the same video's
     * chunks queue here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select v from Video v where v.id = :id")
    Optional<Video> findByIdForUpdate(@Param("id") String id);
}
