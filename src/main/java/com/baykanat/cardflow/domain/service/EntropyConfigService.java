package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.config.AppProperties;
import com.baykanat.cardflow.domain.exception.AuthorizationException;
import com.baykanat.cardflow.domain.exception.NotFoundException;
import com.baykanat.cardflow.domain.exception.ValidationException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.ConfigScope;
import com.baykanat.cardflow.domain.model.EntropyConfig;
import com.baykanat.cardflow.infrastructure.persistence.BoardJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.EntropyConfigJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Entropy süresi ayarları: admin tarafından yazılır, board → tenant → varsayılan sırasıyla çözülür. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntropyConfigService {

    private final EntropyConfigJdbcRepository configRepository;
    private final BoardJdbcRepository boardRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @Transactional
    public EntropyConfig configure(AccessContext ctx, ConfigScope scope, Duration period) {
        if (!ctx.isAdmin()) {
            throw new AuthorizationException("Only admins can configure auto-postpone periods");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new ValidationException("autoPostponePeriod must be a positive duration");
        }
        switch (scope.getKind()) {
            case TENANT -> {
                if (!scope.getId().equals(ctx.getTenantId())) {
                    throw new NotFoundException("Tenant", scope.getId());
                }
            }
            case BOARD -> boardRepository.findBoard(ctx.getTenantId(), scope.getId())
                    .orElseThrow(() -> new NotFoundException("Board", scope.getId()));
        }

        EntropyConfig config = EntropyConfig.builder()
                .tenantId(ctx.getTenantId())
                .scope(scope)
                .autoPostponePeriod(period)
                .updatedBy(ctx.getActorId())
                .updatedAt(clock.instant())
                .build();
        configRepository.upsert(config);
        log.info("Entropy period for {} {} set to {} by {}",
                scope.getKind().getDbValue(), scope.getId(), period, ctx.getActorId());
        return config;
    }

    /** Çağıranın tenant'ındaki board için geçerli süre; board yoksa NotFound. */
    public Duration effectivePeriod(AccessContext ctx, String boardId) {
        boardRepository.findBoard(ctx.getTenantId(), boardId)
                .orElseThrow(() -> new NotFoundException("Board", boardId));
        return resolve(ctx.getTenantId(), boardId);
    }

    /** Tek board için geçerli süre. */
    public Duration resolve(String tenantId, String boardId) {
        return periodsFor(tenantId).forBoard(boardId);
    }

    /** Tenant'ın tüm ayarlarını tek sorguda yükler; tarama boyunca board başına çözüm yapar. */
    public EntropyPeriods periodsFor(String tenantId) {
        List<EntropyConfig> configs = configRepository.findByTenant(tenantId);
        Duration tenantPeriod = null;
        Map<String, Duration> boardPeriods = new HashMap<>();
        for (EntropyConfig config : configs) {
            switch (config.getScope().getKind()) {
                case TENANT -> tenantPeriod = config.getAutoPostponePeriod();
                case BOARD -> boardPeriods.put(config.getScope().getId(), config.getAutoPostponePeriod());
            }
        }
        Duration fallback = tenantPeriod != null ? tenantPeriod : appProperties.getEntropy().getDefaultPeriod();
        return new EntropyPeriods(boardPeriods, fallback);
    }

    /** Bir tenant için çözülmüş süreler. */
    public static final class EntropyPeriods {

        private final Map<String, Duration> boardPeriods;
        private final Duration fallback;

        EntropyPeriods(Map<String, Duration> boardPeriods, Duration fallback) {
            this.boardPeriods = Map.copyOf(boardPeriods);
            this.fallback = fallback;
        }

        public Duration forBoard(String boardId) {
            return boardPeriods.getOrDefault(boardId, fallback);
        }
    }
}
