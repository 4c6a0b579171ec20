package com.yescount.planner.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.EventQuery;
import com.yescount.planner.domain.model.EventSource;
import com.yescount.planner.domain.port.out.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Postgres implementation of EventRepository.
 * Tags are stored as a JSON array in a text column and filtered after the SQL read.
 */
@Repository
public class DatabaseEventRepository implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseEventRepository.class);

    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

    private static final String COLUMNS = """
            id, title, description, date_start, date_end, location, price_min, price_max,
            url, source, source_id, raw_payload::text AS raw_payload, tags
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public DatabaseEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public long upsert(Event event) {
        String sql = """
            INSERT INTO events (
                title, description, date_start, date_end, location, price_min, price_max,
                url, source, source_id, raw_payload, tags, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (source, source_id) DO UPDATE SET
                title = EXCLUDED.title,
                description = EXCLUDED.description,
                date_start = EXCLUDED.date_start,
                date_end = EXCLUDED.date_end,
                location = EXCLUDED.location,
                price_min = EXCLUDED.price_min,
                price_max = EXCLUDED.price_max,
                url = EXCLUDED.url,
                raw_payload = EXCLUDED.raw_payload,
                tags = EXCLUDED.tags,
                updated_at = CURRENT_TIMESTAMP
            RETURNING id
            """;

        Long id = jdbcTemplate.queryForObject(sql, Long.class,
                event.title(),
                event.description(),
                event.dateStart(),
                event.dateEnd(),
                event.location(),
                event.priceMin(),
                event.priceMax(),
                event.url(),
                event.source().code(),
                event.sourceId(),
                event.rawPayload() == null || event.rawPayload().isBlank() ? "{}" : event.rawPayload(),
                writeTags(event.tags()));
        return Objects.requireNonNull(id, "upsert returned no id");
    }

    @Override
    public List<Event> findAll() {
        try {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM events ORDER BY id", eventRowMapper());
        } catch (DataAccessException e) {
            logger.error("Database error while loading events", e);
            return Collections.emptyList();
        }
    }

    @Override
    public List<Event> findByFilter(EventQuery query) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM events WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (!query.text().isBlank()) {
            sql.append(" AND (title ILIKE ? OR description ILIKE ? OR location ILIKE ?)");
            String pattern = "%" + escapeLike(query.text()) + "%";
            params.add(pattern);
            params.add(pattern);
            params.add(pattern);
        }
        if (query.dateFrom() != null) {
            sql.append(" AND date_start >= ?");
            params.add(startOfDay(query.dateFrom()));
        }
        if (query.dateTo() != null) {
            // inclusive of the whole last day
            sql.append(" AND date_start < ?");
            params.add(startOfDay(query.dateTo().plusDays(1)));
        }
        if (query.priceMax() != null) {
            sql.append(" AND (price_max IS NULL OR price_max <= ?)");
            params.add(query.priceMax());
        }
        sql.append(" ORDER BY date_start ASC NULLS LAST, id ASC LIMIT ").append(EventQuery.MAX_RESULTS);

        try {
            return jdbcTemplate.query(sql.toString(), eventRowMapper(), params.toArray()).stream()
                    .filter(query::matchesTags)
                    .toList();
        } catch (DataAccessException e) {
            logger.error("Database error while filtering events", e);
            return Collections.emptyList();
        }
    }

    @Override
    public List<Event> findByIds(List<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String placeholders = ids.stream().map(id -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT " + COLUMNS + " FROM events WHERE id IN (" + placeholders + ")";

        try {
            Map<Long, Event> byId = jdbcTemplate.query(sql, eventRowMapper(), ids.toArray()).stream()
                    .collect(Collectors.toMap(Event::id, Function.identity()));
            return ids.stream()
                    .distinct()
                    .map(byId::get)
                    .filter(Objects::nonNull)
                    .toList();
        } catch (DataAccessException e) {
            logger.error("Database error while loading events by id", e);
            return Collections.emptyList();
        }
    }

    // ===== Private Helper Methods =====

    private RowMapper<Event> eventRowMapper() {
        return (rs, rowNum) -> new Event(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getObject("date_start", OffsetDateTime.class),
                rs.getObject("date_end", OffsetDateTime.class),
                rs.getString("location"),
                rs.getBigDecimal("price_min"),
                rs.getBigDecimal("price_max"),
                rs.getString("url"),
                EventSource.fromCode(rs.getString("source")),
                rs.getString("source_id"),
                rs.getString("raw_payload"),
                readTags(rs));
    }

    private String writeTags(List<String> tags) {
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tags are not serializable: " + tags, e);
        }
    }

    private List<String> readTags(ResultSet rs) throws SQLException {
        String json = rs.getString("tags");
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, TAG_LIST);
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed tags for event {}: {}", rs.getLong("id"), e.getMessage());
            return List.of();
        }
    }

    private static OffsetDateTime startOfDay(LocalDate day) {
        return day.atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
