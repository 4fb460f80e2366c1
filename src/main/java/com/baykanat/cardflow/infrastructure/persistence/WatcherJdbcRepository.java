package com.baykanat.cardflow.infrastructure.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/** card_watchers; ekleme ON CONFLICT DO NOTHING ile idempotent. */
@Repository
@RequiredArgsConstructor
public class WatcherJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** true → yeni izleyici eklendi; false → zaten izliyordu. */
    public boolean add(String tenantId, String cardId, String userId) {
        return jdbcTemplate.update(
                "INSERT INTO card_watchers (tenant_id, card_id, user_id) VALUES (?, ?, ?) ON CONFLICT DO NOTHING",
                tenantId, cardId, userId) > 0;
    }

    public boolean remove(String tenantId, String cardId, String userId) {
        return jdbcTemplate.update(
                "DELETE FROM card_watchers WHERE tenant_id = ? AND card_id = ? AND user_id = ?",
                tenantId, cardId, userId) > 0;
    }

    public List<String> findUserIds(String tenantId, String cardId) {
        return jdbcTemplate.queryForList(
                "SELECT user_id FROM card_watchers WHERE tenant_id = ? AND card_id = ? ORDER BY user_id",
                String.class, tenantId, cardId);
    }
}
