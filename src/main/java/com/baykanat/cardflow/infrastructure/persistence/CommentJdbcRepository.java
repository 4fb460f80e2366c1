package com.baykanat.cardflow.infrastructure.persistence;

import com.baykanat.cardflow.domain.model.Comment;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.getInstant;
import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.toTimestamp;

@Repository
@RequiredArgsConstructor
public class CommentJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    public void insert(Comment comment) {
        jdbcTemplate.update("""
                INSERT INTO comments (id, tenant_id, card_id, author_id, body, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                comment.getId(), comment.getTenantId(), comment.getCardId(), comment.getAuthorId(),
                comment.getBody(), toTimestamp(comment.getCreatedAt()));
    }

    public List<Comment> findByCard(String tenantId, String cardId) {
        return jdbcTemplate.query(
                "SELECT * FROM comments WHERE tenant_id = ? AND card_id = ? ORDER BY created_at, id",
                (rs, rowNum) -> Comment.builder()
                        .id(rs.getString("id"))
                        .tenantId(rs.getString("tenant_id"))
                        .cardId(rs.getString("card_id"))
                        .authorId(rs.getString("author_id"))
                        .body(rs.getString("body"))
                        .createdAt(getInstant(rs, "created_at"))
                        .build(),
                tenantId, cardId);
    }
}
