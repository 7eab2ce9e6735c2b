package com.example.DmOracle.repository;

import com.example.DmOracle.model.ScoredPassage;
import com.example.DmOracle.model.SrdPassage;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class SrdPassageRepository {

    private static final RowMapper<SrdPassage> PASSAGE_MAPPER = new SrdPassageRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public List<SrdPassage> findAll() {
        return jdbcTemplate.query(
                "SELECT id, source, chunk_id, content FROM srd_passages ORDER BY id",
                PASSAGE_MAPPER
        );
    }

    /**
     * Nearest passages by pgvector cosine distance `<=>`,
     * with similarity score = 1 - distance. PostgreSQL only.
     */
    public List<ScoredPassage> findNearest(float[] embedding, int limit) {
        PGvector queryVector = new PGvector(embedding);

        String sql = """
                SELECT id,
                       source,
                       chunk_id,
                       content,
                       1 - (embedding <=> ?) AS score
                FROM srd_passages
                WHERE embedding IS NOT NULL
                ORDER BY embedding <=> ?, id
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector);
            ps.setObject(2, queryVector);
            ps.setInt(3, limit);
        }, (rs, rowNum) -> new ScoredPassage(PASSAGE_MAPPER.mapRow(rs, rowNum), rs.getDouble("score")));
    }

    private static class SrdPassageRowMapper implements RowMapper<SrdPassage> {
        @Override
        public SrdPassage mapRow(ResultSet rs, int rowNum) throws SQLException {
            SrdPassage passage = new SrdPassage();
            passage.setId(rs.getLong("id"));
            passage.setSource(rs.getString("source"));
            passage.setChunkId(rs.getString("chunk_id"));
            passage.setContent(rs.getString("content"));
            return passage;
        }
    }
}
