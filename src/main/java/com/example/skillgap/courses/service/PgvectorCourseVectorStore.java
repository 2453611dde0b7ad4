package com.example.skillgap.courses.service;

import com.example.skillgap.courses.config.CourseAvailabilityProperties;
import com.example.skillgap.courses.model.CourseCandidate;
import com.example.skillgap.courses.model.CourseType;
import com.example.skillgap.courses.model.SkillCategory;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * pgvector implementation of the course search against the {@code courses} table:
 * - cosine similarity {@code 1 - (embedding <=> :embedding)}
 * - first pass keeps rows above the global minimum, capped at {@code max-candidates}
 * - second pass applies the category threshold
 * Rows without id, with an unknown type or a null similarity are dropped here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PgvectorCourseVectorStore implements CourseVectorStore {

    static final String SEARCH_SQL = """
            SELECT id, name, provider_standardized, description, course_type_standard, similarity
            FROM (
                SELECT id,
                       name,
                       provider_standardized,
                       description,
                       course_type_standard,
                       1 - (embedding <=> CAST(:embedding AS vector)) AS similarity
                FROM courses
                WHERE platform = :platform
                  AND embedding IS NOT NULL
                  AND 1 - (embedding <=> CAST(:embedding AS vector)) >= :minThreshold
                ORDER BY embedding <=> CAST(:embedding AS vector)
                LIMIT :limit
            ) ranked
            WHERE similarity >= :threshold
            ORDER BY similarity DESC, id
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final CourseAvailabilityProperties properties;

    @Override
    public List<CourseCandidate> search(float[] queryVector,
                                        SkillCategory category,
                                        double minThreshold,
                                        double categoryThreshold) {
        if (queryVector == null || queryVector.length == 0) {
            throw new IllegalArgumentException("query vector is required");
        }
        CourseAvailabilityProperties.Availability availability = properties.getAvailability();

        Map<String, Object> params = new HashMap<>();
        params.put("embedding", new PGvector(queryVector));
        params.put("platform", availability.getPlatform());
        params.put("minThreshold", minThreshold);
        params.put("threshold", Math.max(minThreshold, categoryThreshold));
        params.put("limit", availability.getMaxCandidates());

        List<CourseCandidate> rows = jdbcTemplate.query(SEARCH_SQL, params, (rs, rowNum) -> mapRow(rs).orElse(null));
        List<CourseCandidate> candidates = rows.stream().filter(Objects::nonNull).toList();

        if (candidates.size() < rows.size()) {
            log.debug("Dropped {} malformed course rows for category={}", rows.size() - candidates.size(), category);
        }
        return candidates;
    }

    static Optional<CourseCandidate> mapRow(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        Optional<CourseType> type = CourseType.fromWire(rs.getString("course_type_standard"));
        double similarity = rs.getDouble("similarity");
        boolean similarityMissing = rs.wasNull();

        if (id == null || id.isBlank() || type.isEmpty() || similarityMissing || Double.isNaN(similarity)) {
            return Optional.empty();
        }
        return Optional.of(new CourseCandidate(
                id,
                type.get(),
                similarity,
                rs.getString("name"),
                rs.getString("provider_standardized"),
                rs.getString("description")
        ));
    }
}
