package com.baykanat.cardflow.infrastructure.persistence;

import com.baykanat.cardflow.domain.model.Board;
import com.baykanat.cardflow.domain.model.BoardColumn;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.getInstant;
import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.toTimestamp;

/** boards ve board_columns tabloları. */
@Repository
@RequiredArgsConstructor
public class BoardJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<Board> BOARD_MAPPER = (rs, rowNum) -> Board.builder()
            .id(rs.getString("id"))
            .tenantId(rs.getString("tenant_id"))
            .name(rs.getString("name"))
            .createdAt(getInstant(rs, "created_at"))
            .build();

    private static final RowMapper<BoardColumn> COLUMN_MAPPER = (rs, rowNum) -> BoardColumn.builder()
            .id(rs.getString("id"))
            .tenantId(rs.getString("tenant_id"))
            .boardId(rs.getString("board_id"))
            .name(rs.getString("name"))
            .position(rs.getInt("position"))
            .createdAt(getInstant(rs, "created_at"))
            .build();

    public void insertBoard(Board board) {
        jdbcTemplate.update("INSERT INTO boards (id, tenant_id, name, created_at) VALUES (?, ?, ?, ?)",
                board.getId(), board.getTenantId(), board.getName(), toTimestamp(board.getCreatedAt()));
    }

    public void insertColumn(BoardColumn column) {
        jdbcTemplate.update("""
                INSERT INTO board_columns (id, tenant_id, board_id, name, position, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                column.getId(), column.getTenantId(), column.getBoardId(), column.getName(),
                column.getPosition(), toTimestamp(column.getCreatedAt()));
    }

    public Optional<Board> findBoard(String tenantId, String boardId) {
        return jdbcTemplate.query("SELECT * FROM boards WHERE id = ? AND tenant_id = ?",
                BOARD_MAPPER, boardId, tenantId).stream().findFirst();
    }

    public List<Board> findBoardsByTenant(String tenantId) {
        return jdbcTemplate.query("SELECT * FROM boards WHERE tenant_id = ? ORDER BY created_at, id",
                BOARD_MAPPER, tenantId);
    }

    public Optional<BoardColumn> findColumn(String tenantId, String columnId) {
        return jdbcTemplate.query("SELECT * FROM board_columns WHERE id = ? AND tenant_id = ?",
                COLUMN_MAPPER, columnId, tenantId).stream().findFirst();
    }

    /** Sonraki kolon sırası (board'daki en büyük position + 1). */
    public int nextColumnPosition(String tenantId, String boardId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT MAX(position) FROM board_columns WHERE tenant_id = ? AND board_id = ?",
                Integer.class, tenantId, boardId);
        return max != null ? max + 1 : 0;
    }

    /** Board sahibi olan tüm tenant'lar; entropy taraması bu liste üzerinde döner. */
    public List<String> findTenantIds() {
        return jdbcTemplate.queryForList("SELECT DISTINCT tenant_id FROM boards ORDER BY tenant_id", String.class);
    }
}
