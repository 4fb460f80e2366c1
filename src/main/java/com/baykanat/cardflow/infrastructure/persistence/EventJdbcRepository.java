package com.baykanat.cardflow.infrastructure.persistence;

import com.baykanat.cardflow.domain.model.Event;
import com.baykanat.cardflow.domain.model.EventAction;
import com.baykanat.cardflow.domain.model.EventTarget;
import com.baykanat.cardflow.domain.model.TargetType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.getInstant;
import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.toTimestamp;

/** events tablosu: yalnızca INSERT ve okuma; UPDATE/DELETE yok. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventJdbcRepository {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String INSERT_SQL = """
            INSERT INTO events (id, tenant_id, board_id, actor_id, action, target_type, target_id, payload, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            """;

    public void insert(Event event) {
        jdbcTemplate.update(INSERT_SQL,
                event.getId(), event.getTenantId(), event.getBoardId(), event.getActorId(),
                event.getAction().getValue(), event.getTarget().getType().getValue(), event.getTarget().getId(),
                toJson(event.getPayload()), toTimestamp(event.getCreatedAt()));
    }

    /** Hedefe ait event zinciri (audit / yorum akışı), eskiden yeniye. */
    public List<Event> findByTarget(String tenantId, EventTarget target) {
        return jdbcTemplate.query("""
                SELECT * FROM events
                WHERE tenant_id = ? AND target_type = ? AND target_id = ?
                ORDER BY created_at, seq
                """, rowMapper(), tenantId, target.getType().getValue(), target.getId());
    }

    public List<Event> findByAction(String tenantId, EventAction action, Instant since) {
        return jdbcTemplate.query("""
                SELECT * FROM events
                WHERE tenant_id = ? AND action = ? AND created_at >= ?
                ORDER BY created_at, seq
                """, rowMapper(), tenantId, action.getValue(), toTimestamp(since));
    }

    public int countByTargetSince(String tenantId, EventTarget target, EventAction action, Instant since) {
        Integer count = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM events
                WHERE tenant_id = ? AND target_type = ? AND target_id = ? AND action = ? AND created_at >= ?
                """, Integer.class,
                tenantId, target.getType().getValue(), target.getId(), action.getValue(), toTimestamp(since));
        return count != null ? count : 0;
    }

    private RowMapper<Event> rowMapper() {
        return (rs, rowNum) -> Event.builder()
                .id(rs.getString("id"))
                .tenantId(rs.getString("tenant_id"))
                .boardId(rs.getString("board_id"))
                .actorId(rs.getString("actor_id"))
                .action(EventAction.fromValue(rs.getString("action")))
                .target(new EventTarget(TargetType.fromValue(rs.getString("target_type")), rs.getString("target_id")))
                .payload(fromJson(rs.getString("payload")))
                .createdAt(getInstant(rs, "created_at"))
                .build();
    }

    String toJson(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable", e);
        }
    }

    Map<String, Object> fromJson(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable event payload, returning empty map: {}", e.getMessage());
            return Map.of();
        }
    }
}
