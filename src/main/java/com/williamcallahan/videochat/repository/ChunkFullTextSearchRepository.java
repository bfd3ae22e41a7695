package com.williamcallahan.videochat.repository;

import com.williamcallahan.videochat.domain.EvidenceItem;
import com.williamcallahan.videochat.domain.SourceSignal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * PostgreSQL full-text search over chunk text.
 *
 * <p>Ranks with {@code ts_rank} against the English configuration. Only rows matching the query
 * are returned, so every score is positive. The GIN expression index from {@code schema.sql}
 * backs the {@code @@} predicate.
 */
@Repository
public class ChunkFullTextSearchRepository {

    private static final String BASE_SQL = """
            SELECT c.video_id,
                   v.title AS video_title,
                   v.source_url AS video_url,
                   c.start_time,
                   c.end_time,
                   c.text,
                   c.vector_index_key,
                   ts_rank(to_tsvector('english', c.text), plainto_tsquery('english', :query)) AS score
            FROM chunks c
            JOIN videos v ON v.id = c.video_id
            WHERE to_tsvector('english', c.text) @@ plainto_tsquery('english', :query)
            """;

    private static final String VIDEO_FILTER_SQL = "  AND c.video_id IN (:videoIds)\n";

    private static final String ORDER_SQL = """
            ORDER BY score DESC, c.id ASC
            LIMIT :limit
            """;

    private static final RowMapper<EvidenceItem> EVIDENCE_ROW_MAPPER = new LexicalHitRowMapper();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public ChunkFullTextSearchRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Runs a ranked full-text query.
     *
     * @param query free-text user query
     * @param limit maximum rows to return
     * @param videoIds videos to restrict to, empty for all
     * @return lexical hits ordered by rank descending
     */
    public List<EvidenceItem> search(String query, int limit, Collection<String> videoIds) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("query", query)
                .addValue("limit", limit);
        StringBuilder sql = new StringBuilder(BASE_SQL);
        if (videoIds != null && !videoIds.isEmpty()) {
            sql.append(VIDEO_FILTER_SQL);
            params.addValue("videoIds", videoIds);
        }
        sql.append(ORDER_SQL);
        return jdbcTemplate.query(sql.toString(), params, EVIDENCE_ROW_MAPPER);
    }

    private static final class LexicalHitRowMapper implements RowMapper<EvidenceItem> {
        @Override
        public EvidenceItem mapRow(ResultSet rs, int rowNum) throws SQLException {
            return EvidenceItem.fromSignal(
                    rs.getString("video_id"),
                    rs.getString("video_title"),
                    rs.getString("video_url"),
                    rs.getDouble("start_time"),
                    rs.getDouble("end_time"),
                    rs.getString("text"),
                    rs.getString("vector_index_key"),
                    rs.getDouble("score"),
                    SourceSignal.LEXICAL);
        }
    }
}
