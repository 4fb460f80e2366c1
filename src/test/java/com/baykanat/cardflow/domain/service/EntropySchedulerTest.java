package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.config.AppProperties;
import com.baykanat.cardflow.domain.exception.ConcurrencyConflictException;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.Board;
import com.baykanat.cardflow.domain.model.Card;
import com.baykanat.cardflow.domain.model.CardStatus;
import com.baykanat.cardflow.domain.model.ExpiryWarning;
import com.baykanat.cardflow.domain.model.Role;
import com.baykanat.cardflow.domain.model.SweepReport;
import com.baykanat.cardflow.infrastructure.persistence.BoardJdbcRepository;
import com.baykanat.cardflow.infrastructure.persistence.CardJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EntropyScheduler.
 *
 * <p>Verifies cutoff computation per board, failure isolation and the read-only expiry listing.
 */
@ExtendWith(MockitoExtension.class)
class EntropySchedulerTest {

    private static final Instant NOW = Instant.parse("2026-04-01T00:00:00Z");

    @Mock
    private BoardJdbcRepository boardRepository;

    @Mock
    private CardJdbcRepository cardRepository;

    @Mock
    private EntropyConfigService configService;

    @Mock
    private LifecycleEngine lifecycleEngine;

    private EntropyScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new EntropyScheduler(boardRepository, cardRepository, configService, lifecycleEngine,
                new AppProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Board board(String tenantId, String id) {
        return Board.builder().id(id).tenantId(tenantId).name(id).build();
    }

    private static Card card(String id, String boardId, Instant lastActiveAt) {
        return Card.builder().id(id).tenantId("t1").boardId(boardId).title("card " + id)
                .status(CardStatus.PUBLISHED).columnId("col").lastActiveAt(lastActiveAt).build();
    }

    @Test
    @DisplayName("sweep - each board uses its own resolved period for the cutoff")
    void sweepUsesPerBoardCutoff() {
        when(boardRepository.findTenantIds()).thenReturn(List.of("t1"));
        when(configService.periodsFor("t1")).thenReturn(
                new EntropyConfigService.EntropyPeriods(Map.of("b1", Duration.ofDays(7)), Duration.ofDays(30)));
        when(boardRepository.findBoardsByTenant("t1")).thenReturn(List.of(board("t1", "b1"), board("t1", "b2")));
        Instant cutoffB1 = NOW.minus(Duration.ofDays(7));
        Instant cutoffB2 = NOW.minus(Duration.ofDays(30));
        when(cardRepository.findOpenInactiveBefore("t1", "b1", cutoffB1))
                .thenReturn(List.of(card("c1", "b1", cutoffB1.minusSeconds(60))));
        when(cardRepository.findOpenInactiveBefore("t1", "b2", cutoffB2)).thenReturn(List.of());
        when(lifecycleEngine.autoPostpone(AccessContext.system("t1"), "c1", cutoffB1)).thenReturn(true);

        SweepReport report = scheduler.sweep(NOW);

        assertThat(report.getTenantsScanned()).isEqualTo(1);
        assertThat(report.getBoardsScanned()).isEqualTo(2);
        assertThat(report.getCandidates()).isEqualTo(1);
        assertThat(report.getPostponed()).isEqualTo(1);
        assertThat(report.getStartedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("sweep - running twice at the same instant postpones each card only once")
    void sweepTwiceIsIdempotent() {
        Instant cutoff = NOW.minus(Duration.ofDays(30));
        AccessContext system = AccessContext.system("t1");
        Card stale = card("c1", "b1", cutoff.minusSeconds(60));
        when(boardRepository.findTenantIds()).thenReturn(List.of("t1"));
        when(configService.periodsFor("t1")).thenReturn(
                new EntropyConfigService.EntropyPeriods(Map.of(), Duration.ofDays(30)));
        when(boardRepository.findBoardsByTenant("t1")).thenReturn(List.of(board("t1", "b1")));
        // Second read still sees the card (e.g. a lagging replica); the engine re-checks and declines
        when(cardRepository.findOpenInactiveBefore("t1", "b1", cutoff)).thenReturn(List.of(stale));
        when(lifecycleEngine.autoPostpone(system, "c1", cutoff)).thenReturn(true).thenReturn(false);

        SweepReport first = scheduler.sweep(NOW);
        SweepReport second = scheduler.sweep(NOW);

        assertThat(first.getPostponed()).isEqualTo(1);
        assertThat(second.getPostponed()).isZero();
        assertThat(second.getSkipped()).isEqualTo(1);
        assertThat(second.getFailed()).isZero();
        verify(lifecycleEngine, times(2)).autoPostpone(system, "c1", cutoff);
    }

    @Test
    @DisplayName("sweep - skipped and failing cards do not stop the remaining candidates")
    void sweepIsolatesCardFailures() {
        Instant cutoff = NOW.minus(Duration.ofDays(30));
        when(boardRepository.findTenantIds()).thenReturn(List.of("t1"));
        when(configService.periodsFor("t1")).thenReturn(
                new EntropyConfigService.EntropyPeriods(Map.of(), Duration.ofDays(30)));
        when(boardRepository.findBoardsByTenant("t1")).thenReturn(List.of(board("t1", "b1")));
        when(cardRepository.findOpenInactiveBefore("t1", "b1", cutoff)).thenReturn(List.of(
                card("c1", "b1", cutoff.minusSeconds(1)),
                card("c2", "b1", cutoff.minusSeconds(1)),
                card("c3", "b1", cutoff.minusSeconds(1)),
                card("c4", "b1", cutoff.minusSeconds(1))));
        AccessContext system = AccessContext.system("t1");
        when(lifecycleEngine.autoPostpone(system, "c1", cutoff)).thenReturn(false);
        when(lifecycleEngine.autoPostpone(system, "c2", cutoff)).thenThrow(new ConcurrencyConflictException("c2", 3));
        when(lifecycleEngine.autoPostpone(system, "c3", cutoff)).thenThrow(new IllegalStateException("db down"));
        when(lifecycleEngine.autoPostpone(system, "c4", cutoff)).thenReturn(true);

        SweepReport report = scheduler.sweep(NOW);

        assertThat(report.getCandidates()).isEqualTo(4);
        assertThat(report.getSkipped()).isEqualTo(1);
        assertThat(report.getFailed()).isEqualTo(2);
        assertThat(report.getPostponed()).isEqualTo(1);
    }

    @Test
    @DisplayName("sweep - a failing tenant does not prevent the next tenant from being swept")
    void sweepIsolatesTenantFailures() {
        when(boardRepository.findTenantIds()).thenReturn(List.of("broken", "t1"));
        when(configService.periodsFor("broken")).thenThrow(new IllegalStateException("bad config"));
        when(configService.periodsFor("t1")).thenReturn(
                new EntropyConfigService.EntropyPeriods(Map.of(), Duration.ofDays(30)));
        when(boardRepository.findBoardsByTenant("t1")).thenReturn(List.of(board("t1", "b1")));
        when(cardRepository.findOpenInactiveBefore("t1", "b1", NOW.minus(Duration.ofDays(30)))).thenReturn(List.of());

        SweepReport report = scheduler.sweep(NOW);

        assertThat(report.getTenantsScanned()).isEqualTo(2);
        assertThat(report.getBoardsScanned()).isEqualTo(1);
        verifyNoInteractions(lifecycleEngine);
    }

    @Test
    @DisplayName("listApproachingExpiry - cards past 75% of the period, soonest postpone first, no writes")
    void listApproachingExpiry() {
        AccessContext ctx = new AccessContext("t1", "alice", Role.MEMBER);
        Duration period = Duration.ofDays(20);
        Instant warnCutoff = NOW.minus(Duration.ofDays(15));
        when(configService.periodsFor("t1")).thenReturn(
                new EntropyConfigService.EntropyPeriods(Map.of(), period));
        when(boardRepository.findBoardsByTenant("t1")).thenReturn(List.of(board("t1", "b1")));
        Card older = card("old", "b1", NOW.minus(Duration.ofDays(19)));
        Card newer = card("new", "b1", NOW.minus(Duration.ofDays(16)));
        when(cardRepository.findOpenInactiveBefore("t1", "b1", warnCutoff)).thenReturn(List.of(newer, older));

        List<ExpiryWarning> warnings = scheduler.listApproachingExpiry(ctx, NOW);

        assertThat(warnings).extracting(ExpiryWarning::getCardId).containsExactly("old", "new");
        assertThat(warnings.get(0).getPostponeAt()).isEqualTo(NOW.plus(Duration.ofDays(1)));
        assertThat(warnings.get(0).getPeriod()).isEqualTo(period);
        verifyNoInteractions(lifecycleEngine);
    }
}
