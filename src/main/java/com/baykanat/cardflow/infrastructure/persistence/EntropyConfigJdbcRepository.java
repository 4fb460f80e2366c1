package com.baykanat.cardflow.infrastructure.persistence;

import com.baykanat.cardflow.domain.model.ConfigScope;
import com.baykanat.cardflow.domain.model.EntropyConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.getInstant;
import static com.baykanat.cardflow.infrastructure.persistence.SqlTimestamps.toTimestamp;

/** entropy_configs; (tenant, scope, scope_id) başına tek satır, upsert ile güncellenir. */
@Repository
@RequiredArgsConstructor
public class EntropyConfigJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<EntropyConfig> ROW_MAPPER = (rs, rowNum) -> EntropyConfig.builder()
            .tenantId(rs.getString("tenant_id"))
            .scope(new ConfigScope(ConfigScope.Kind.fromDbValue(rs.getString("scope")), rs.getString("scope_id")))
            .autoPostponePeriod(Duration.ofSeconds(rs.getLong("auto_postpone_period_seconds")))
            .updatedBy(rs.getString("updated_by"))
            .updatedAt(getInstant(rs, "updated_at"))
            .build();

    public void upsert(EntropyConfig config) {
        jdbcTemplate.update("""
                INSERT INTO entropy_configs (tenant_id, scope, scope_id, auto_postpone_period_seconds, updated_by, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT (tenant_id, scope, scope_id) DO UPDATE
                SET auto_postpone_period_seconds = EXCLUDED.auto_postpone_period_seconds,
                    updated_by = EXCLUDED.updated_by,
                    updated_at = EXCLUDED.updated_at
                """,
                config.getTenantId(), config.getScope().getKind().getDbValue(), config.getScope().getId(),
                config.getAutoPostponePeriod().getSeconds(), config.getUpdatedBy(),
                toTimestamp(config.getUpdatedAt()));
    }

    public Optional<EntropyConfig> find(String tenantId, ConfigScope scope) {
        return jdbcTemplate.query(
                "SELECT * FROM entropy_configs WHERE tenant_id = ? AND scope = ? AND scope_id = ?",
                ROW_MAPPER, tenantId, scope.getKind().getDbValue(), scope.getId()).stream().findFirst();
    }

    /** Tenant'ın tüm ayarları (tenant + board kapsamları); tarama başına tek sorgu. */
    public List<EntropyConfig> findByTenant(String tenantId) {
        return jdbcTemplate.query("SELECT * FROM entropy_configs WHERE tenant_id = ?", ROW_MAPPER, tenantId);
    }
}
