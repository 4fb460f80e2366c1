package com.baykanat.cardflow.infrastructure.persistence;

import com.baykanat.cardflow.domain.model.Card;
import com.baykanat.cardflow.domain.model.CardStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.getInstant;
import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.toTimestamp;

/** cards tablosu; tüm sorgular tenant_id ile sınırlı, güncellemeler version guard'lı. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CardJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_COLUMNS = """
            SELECT id, tenant_id, number, board_id, column_id, title, due_on, creator_id, status,
                   closed_at, closed_by, postponed_at, postponed_by, last_active_at,
                   golden, activity_spike_at, created_at, version
            FROM cards
            """;

    private static final String INSERT_SQL = """
            INSERT INTO cards (id, tenant_id, number, board_id, column_id, title, due_on, creator_id, status,
                               closed_at, closed_by, postponed_at, postponed_by, last_active_at,
                               golden, activity_spike_at, created_at, version)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_SQL = """
            UPDATE cards
            SET column_id = ?, title = ?, status = ?, closed_at = ?, closed_by = ?,
                postponed_at = ?, postponed_by = ?, last_active_at = ?, golden = ?,
                activity_spike_at = ?, version = ?
            WHERE id = ? AND tenant_id = ? AND version = ?
            """;

    private static final RowMapper<Card> ROW_MAPPER = (rs, rowNum) -> Card.builder()
            .id(rs.getString("id"))
            .tenantId(rs.getString("tenant_id"))
            .number(rs.getLong("number"))
            .boardId(rs.getString("board_id"))
            .columnId(rs.getString("column_id"))
            .title(rs.getString("title"))
            .dueOn(rs.getObject("due_on", LocalDate.class))
            .creatorId(rs.getString("creator_id"))
            .status(CardStatus.fromDbValue(rs.getString("status")))
            .closedAt(getInstant(rs, "closed_at"))
            .closedBy(rs.getString("closed_by"))
            .postponedAt(getInstant(rs, "postponed_at"))
            .postponedBy(rs.getString("postponed_by"))
            .lastActiveAt(getInstant(rs, "last_active_at"))
            .golden(rs.getBoolean("golden"))
            .activitySpikeAt(getInstant(rs, "activity_spike_at"))
            .createdAt(getInstant(rs, "created_at"))
            .version(rs.getLong("version"))
            .build();

    public void insert(Card card) {
        jdbcTemplate.update(INSERT_SQL,
                card.getId(), card.getTenantId(), card.getNumber(), card.getBoardId(), card.getColumnId(),
                card.getTitle(), card.getDueOn(), card.getCreatorId(), card.getStatus().getDbValue(),
                toTimestamp(card.getClosedAt()), card.getClosedBy(),
                toTimestamp(card.getPostponedAt()), card.getPostponedBy(),
                toTimestamp(card.getLastActiveAt()), card.isGolden(),
                toTimestamp(card.getActivitySpikeAt()), toTimestamp(card.getCreatedAt()),
                card.getVersion());
    }

    /** Tenant'ın bir sonraki kart numarası; sayaç satırı kilitlendiği için eşzamanlı create'ler aynı numarayı alamaz. */
    public long nextNumber(String tenantId) {
        Long number = jdbcTemplate.queryForObject("""
                INSERT INTO card_numbers (tenant_id, last_number) VALUES (?, 1)
                ON CONFLICT (tenant_id) DO UPDATE SET last_number = card_numbers.last_number + 1
                RETURNING last_number
                """, Long.class, tenantId);
        return Objects.requireNonNull(number, "card number");
    }

    /** Başka tenant'ın kartı boş döner. */
    public Optional<Card> findById(String tenantId, String cardId) {
        List<Card> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ? AND tenant_id = ?",
                ROW_MAPPER, cardId, tenantId);
        return rows.stream().findFirst();
    }

    /**
     * Kartı yalnızca okunduğu version hâlâ geçerliyse yazar.
     *
     * @return false ise satır arada değişmiş (veya silinmiş), hiçbir şey yazılmadı
     */
    public boolean update(Card next, long expectedVersion) {
        int updated = jdbcTemplate.update(UPDATE_SQL,
                next.getColumnId(), next.getTitle(), next.getStatus().getDbValue(),
                toTimestamp(next.getClosedAt()), next.getClosedBy(),
                toTimestamp(next.getPostponedAt()), next.getPostponedBy(),
                toTimestamp(next.getLastActiveAt()), next.isGolden(),
                toTimestamp(next.getActivitySpikeAt()), next.getVersion(),
                next.getId(), next.getTenantId(), expectedVersion);
        return updated == 1;
    }

    public boolean delete(String tenantId, String cardId) {
        return jdbcTemplate.update("DELETE FROM cards WHERE id = ? AND tenant_id = ?", cardId, tenantId) > 0;
    }

    /** Yayında, kapanmamış, ertelenmemiş ve last_active_at &lt; cutoff olan kartlar (en eski önce). */
    public List<Card> findOpenInactiveBefore(String tenantId, String boardId, Instant cutoff) {
        return jdbcTemplate.query(SELECT_COLUMNS + """
                 WHERE tenant_id = ? AND board_id = ?
                   AND status = 'published' AND closed_at IS NULL AND postponed_at IS NULL
                   AND last_active_at < ?
                 ORDER BY last_active_at, id
                """, ROW_MAPPER, tenantId, boardId, toTimestamp(cutoff));
    }
}
