package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.config.AppProperties;
import com.baykanat.cardflow.domain.exception.CardflowException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.Board;
import com.baykanat.cardflow.domain.model.Card;
import com.baykanat.cardflow.domain.model.ExpiryWarning;
import com.baykanat.cardflow.domain.model.SweepReport;
import com.baykanat.cardflow.infrastructure.persistence.BoardJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.CardJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entropy: süresi boyunca dokunulmamış açık kartları sistem aktörü ile erteler.
 *
 * <p>Tarama yeniden çalıştırılabilir; yalnızca gerçekten uygun kartlar etkilenir. Tek kartın veya
 * tek tenant'ın hatası loglanır, tarama devam eder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntropyScheduler {

    private final BoardJdbcRepository boardRepository;
    private final CardJdbcRepository cardRepository;
    private final EntropyConfigService configService;
    private final LifecycleEngine lifecycleEngine;
    private final AppProperties appProperties;
    private final Clock clock;

    public SweepReport sweep(Instant now) {
        Tally tally = new Tally();
        for (String tenantId : boardRepository.findTenantIds()) {
            tally.tenants++;
            try {
                sweepTenant(tenantId, now, tally);
            } catch (RuntimeException e) {
                log.error("Entropy sweep failed for tenant {}: {}", tenantId, e.getMessage(), e);
            }
        }

        SweepReport report = SweepReport.builder()
                .startedAt(now)
                .finishedAt(clock.instant())
                .tenantsScanned(tally.tenants)
                .boardsScanned(tally.boards)
                .candidates(tally.candidates)
                .postponed(tally.postponed)
                .skipped(tally.skipped)
                .failed(tally.failed)
                .build();
        log.info("Entropy sweep: {} tenants, {} boards, {} candidates, {} postponed, {} skipped, {} failed",
                report.getTenantsScanned(), report.getBoardsScanned(), report.getCandidates(),
                report.getPostponed(), report.getSkipped(), report.getFailed());
        return report;
    }

    /** Süresinin uyarı oranını (varsayılan %75) geçmiş açık kartlar; yan etkisi yok. */
    public List<ExpiryWarning> listApproachingExpiry(AccessContext ctx, Instant now) {
        EntropyConfigService.EntropyPeriods periods = configService.periodsFor(ctx.getTenantId());
        double ratio = appProperties.getEntropy().getWarningRatio();
        List<ExpiryWarning> warnings = new ArrayList<>();

        for (Board board : boardRepository.findBoardsByTenant(ctx.getTenantId())) {
            Duration period = periods.forBoard(board.getId());
            Duration warnAfter = Duration.ofMillis((long) (period.toMillis() * ratio));
            for (Card card : cardRepository.findOpenInactiveBefore(ctx.getTenantId(), board.getId(), now.minus(warnAfter))) {
                warnings.add(ExpiryWarning.builder()
                        .cardId(card.getId())
                        .boardId(board.getId())
                        .title(card.getTitle())
                        .lastActiveAt(card.getLastActiveAt())
                        .period(period)
                        .postponeAt(card.getLastActiveAt().plus(period))
                        .build());
            }
        }
        warnings.sort(Comparator.comparing(ExpiryWarning::getPostponeAt));
        return warnings;
    }

    private void sweepTenant(String tenantId, Instant now, Tally tally) {
        AccessContext system = AccessContext.system(tenantId);
        EntropyConfigService.EntropyPeriods periods = configService.periodsFor(tenantId);

        for (Board board : boardRepository.findBoardsByTenant(tenantId)) {
            tally.boards++;
            Instant cutoff = now.minus(periods.forBoard(board.getId()));
            List<Card> candidates = cardRepository.findOpenInactiveBefore(tenantId, board.getId(), cutoff);
            if (!candidates.isEmpty()) {
                log.debug("Tenant {} board {}: {} cards inactive since before {}",
                        tenantId, board.getId(), candidates.size(), cutoff);
            }
            for (Card card : candidates) {
                tally.candidates++;
                try {
                    if (lifecycleEngine.autoPostpone(system, card.getId(), cutoff)) {
                        tally.postponed++;
                    } else {
                        tally.skipped++;
                    }
                } catch (CardflowException e) {
                    tally.failed++;
                    log.warn("Auto-postpone of card {} failed: {}", card.getId(), e.getMessage());
                } catch (RuntimeException e) {
                    tally.failed++;
                    log.error("Unexpected error postponing card {}: {}", card.getId(), e.getMessage(), e);
                }
            }
        }
    }

    private static final class Tally {
        int tenants;
        int boards;
        int candidates;
        int postponed;
        int skipped;
        int failed;
    }
}
