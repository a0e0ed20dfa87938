package io.draftmate.rag.corpus;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * PostgreSQL backed {@link EssayStore}. Similarity search runs on the pgvector
 * cosine distance operator and is served by an {@code ivfflat} index, so it is
 * approximate: {@code ivfflat.probes} trades recall for latency and is set for
 * every query from {@link CorpusProperties#getIvfflatProbes()}.
 * <p>
 * Expected table layout:
 * {@code id uuid, title text, content text, type text, college text, prompt text,
 * topics text[], structure_analysis jsonb, metadata jsonb, embedding vector(384),
 * created_at timestamptz, updated_at timestamptz}.
 */
class PostgresEssayStore extends AbstractEssayStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresEssayStore.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final String COLUMNS = """
            id, title, content, type, college, prompt, topics,
            structure_analysis::text AS structure_json,
            metadata::text AS metadata_json,
            embedding::text AS embedding_text,
            created_at, updated_at""";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final int probes;
    private final String table;
    private final RowMapper<Essay> essayMapper;

    PostgresEssayStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, ObjectMapper objectMapper,
            CorpusProperties properties, int dimension, Clock clock) {
        super(dimension, properties.getMatchThreshold(), clock);
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        if (properties.getIvfflatProbes() <= 0) {
            throw new IllegalArgumentException("writing.corpus.ivfflat-probes must be positive");
        }
        this.probes = properties.getIvfflatProbes();
        if (!TABLE_NAME.matcher(properties.getTable()).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + properties.getTable());
        }
        this.table = properties.getTable();
        this.essayMapper = (rs, rowNum) -> mapEssay(rs);
    }

    @Override
    protected Essay doInsert(Essay essay) {
        String sql = """
                INSERT INTO %s (id, title, content, type, college, prompt, topics, structure_analysis, metadata,
                                embedding, created_at, updated_at)
                VALUES (:id, :title, :content, :type, :college, :prompt,
                        ARRAY(SELECT jsonb_array_elements_text(CAST(:topics AS jsonb))),
                        CAST(:structure AS jsonb), CAST(:metadata AS jsonb), CAST(:embedding AS vector),
                        :createdAt, :updatedAt)
                RETURNING %s
                """.formatted(table, COLUMNS);

        Essay stored = jdbcClient.sql(sql)
                .param("id", essay.id())
                .param("title", essay.title())
                .param("content", essay.content())
                .param("type", essay.category().wireName())
                .param("college", essay.college())
                .param("prompt", essay.prompt())
                .param("topics", toJson(essay.topics()))
                .param("structure", essay.structure() == null ? null : toJson(essay.structure()))
                .param("metadata", toJson(essay.metadata()))
                .param("embedding", essay.hasEmbedding() ? toPgVectorLiteral(essay.embedding()) : null)
                .param("createdAt", Timestamp.from(essay.createdAt()))
                .param("updatedAt", Timestamp.from(essay.updatedAt()))
                .query(essayMapper)
                .single();
        LOGGER.debug("Inserted essay {}", stored.id());
        return stored;
    }

    @Override
    protected List<ScoredEssay> doQuery(float[] queryVector, EssayCategory category, double threshold, int limit) {
        String categoryClause = category == null ? "" : "AND type = :type";
        String sql = """
                SELECT %s,
                       1 - (embedding <=> CAST(:embedding AS vector)) AS similarity
                FROM %s
                WHERE embedding IS NOT NULL
                  %s
                  AND 1 - (embedding <=> CAST(:embedding AS vector)) > :threshold
                ORDER BY embedding <=> CAST(:embedding AS vector)
                LIMIT :limit
                """.formatted(COLUMNS, table, categoryClause);

        String vectorLiteral = toPgVectorLiteral(queryVector);
        List<ScoredEssay> matches = transactionTemplate.execute(status -> {
            jdbcClient.sql("SELECT set_config('ivfflat.probes', :probes, true)")
                    .param("probes", String.valueOf(probes))
                    .query(String.class)
                    .single();
            JdbcClient.StatementSpec statement = jdbcClient.sql(sql)
                    .param("embedding", vectorLiteral)
                    .param("threshold", threshold)
                    .param("limit", limit);
            if (category != null) {
                statement = statement.param("type", category.wireName());
            }
            return statement
                    .query((rs, rowNum) -> new ScoredEssay(mapEssay(rs), rs.getDouble("similarity")))
                    .list();
        });
        LOGGER.debug("Similarity query returned {} essays (threshold={}, limit={}, probes={})",
                matches == null ? 0 : matches.size(), threshold, limit, probes);
        return matches == null ? List.of() : matches;
    }

    @Override
    public Optional<Essay> findById(UUID id) {
        return jdbcClient.sql("SELECT %s FROM %s WHERE id = :id".formatted(COLUMNS, table))
                .param("id", id)
                .query(essayMapper)
                .optional();
    }

    @Override
    public List<Essay> findByTopic(String topic, EssayCategory category, int limit) {
        String categoryClause = category == null ? "" : "AND type = :type";
        String sql = """
                SELECT %s
                FROM %s
                WHERE :topic = ANY(topics)
                  %s
                ORDER BY created_at
                LIMIT :limit
                """.formatted(COLUMNS, table, categoryClause);
        JdbcClient.StatementSpec statement = jdbcClient.sql(sql)
                .param("topic", topic)
                .param("limit", limit);
        if (category != null) {
            statement = statement.param("type", category.wireName());
        }
        return statement.query(essayMapper).list();
    }

    @Override
    protected void doUpdateEmbedding(UUID id, float[] embedding, Instant updatedAt) {
        int updated = jdbcClient.sql("""
                UPDATE %s
                SET embedding = CAST(:embedding AS vector), updated_at = :updatedAt
                WHERE id = :id
                """.formatted(table))
                .param("embedding", toPgVectorLiteral(embedding))
                .param("updatedAt", Timestamp.from(updatedAt))
                .param("id", id)
                .update();
        if (updated == 0) {
            throw new EssayNotFoundException(id);
        }
    }

    @Override
    public void delete(UUID id) {
        int deleted = jdbcClient.sql("DELETE FROM %s WHERE id = :id".formatted(table))
                .param("id", id)
                .update();
        if (deleted == 0) {
            throw new EssayNotFoundException(id);
        }
    }

    @Override
    public EssayStats stats() {
        long total = jdbcClient.sql("SELECT count(*) FROM %s".formatted(table))
                .query(Long.class)
                .single();

        Map<String, Long> byCategory = new LinkedHashMap<>();
        jdbcClient.sql("SELECT type, count(*) AS essays FROM %s GROUP BY type ORDER BY type".formatted(table))
                .query((RowCallbackHandler) rs -> byCategory.put(rs.getString("type"), rs.getLong("essays")));

        Map<String, Long> byTopic = new LinkedHashMap<>();
        jdbcClient.sql("""
                SELECT topic, count(*) AS essays
                FROM %s, unnest(topics) AS topic
                GROUP BY topic
                ORDER BY topic
                """.formatted(table))
                .query((RowCallbackHandler) rs -> byTopic.put(rs.getString("topic"), rs.getLong("essays")));

        return new EssayStats(total, byCategory, byTopic);
    }

    private Essay mapEssay(ResultSet rs) throws SQLException {
        return new Essay(
                rs.getObject("id", UUID.class),
                rs.getString("title"),
                rs.getString("content"),
                EssayCategory.fromWireName(rs.getString("type")),
                rs.getString("college"),
                rs.getString("prompt"),
                toTopics(rs.getArray("topics")),
                fromJson(rs.getString("structure_json"), StructureAnalysis.class),
                readMetadata(rs.getString("metadata_json")),
                parsePgVectorLiteral(rs.getString("embedding_text")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private Set<String> toTopics(Array array) throws SQLException {
        if (array == null) {
            return Set.of();
        }
        String[] values = (String[]) array.getArray();
        return new LinkedHashSet<>(Arrays.asList(values));
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored metadata is not valid JSON", ex);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored " + type.getSimpleName() + " is not valid JSON", ex);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot serialise " + value.getClass().getSimpleName(), ex);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(Float.toString(embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    static float[] parsePgVectorLiteral(String literal) {
        if (literal == null) {
            return null;
        }
        String body = literal.trim();
        if (!body.startsWith("[") || !body.endsWith("]")) {
            throw new IllegalArgumentException("Not a pgvector literal: " + literal);
        }
        body = body.substring(1, body.length() - 1).trim();
        if (body.isEmpty()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }
}
