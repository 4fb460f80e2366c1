package com.baykanat.cardflow.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the derived effective state of a card.
 */
class EffectiveStateTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private Card.CardBuilder published() {
        return Card.builder().id("c1").tenantId("t1").boardId("b1").status(CardStatus.PUBLISHED).lastActiveAt(NOW);
    }

    @Test
    @DisplayName("Drafted status wins over every other field")
    void draftedWinsOverEverything() {
        Card card = published().status(CardStatus.DRAFTED).closedAt(NOW).columnId("col1").build();

        assertThat(card.effectiveState()).isEqualTo(EffectiveState.DRAFTED);
    }

    @Test
    @DisplayName("Published card without a column awaits triage")
    void publishedWithoutColumnIsTriage() {
        assertThat(published().build().effectiveState()).isEqualTo(EffectiveState.TRIAGE);
    }

    @Test
    @DisplayName("Published card in a column is active")
    void publishedInColumnIsActive() {
        assertThat(published().columnId("col1").build().effectiveState()).isEqualTo(EffectiveState.ACTIVE);
    }

    @Test
    @DisplayName("closedAt takes precedence over column placement")
    void closedTakesPrecedence() {
        assertThat(published().columnId("col1").closedAt(NOW).build().effectiveState())
                .isEqualTo(EffectiveState.CLOSED);
    }

    @Test
    @DisplayName("postponedAt makes the card not_now")
    void postponedIsNotNow() {
        assertThat(published().postponedAt(NOW).build().effectiveState()).isEqualTo(EffectiveState.NOT_NOW);
    }

    @Test
    @DisplayName("Only active and triage count as open")
    void openStates() {
        assertThat(EffectiveState.ACTIVE.isOpen()).isTrue();
        assertThat(EffectiveState.TRIAGE.isOpen()).isTrue();
        assertThat(EffectiveState.DRAFTED.isOpen()).isFalse();
        assertThat(EffectiveState.CLOSED.isOpen()).isFalse();
        assertThat(EffectiveState.NOT_NOW.isOpen()).isFalse();
    }

    @Test
    @DisplayName("Lifecycle actions parse from API value, enum name and event value")
    void lifecycleActionParsing() {
        assertThat(LifecycleAction.fromValue("triageInto")).isEqualTo(LifecycleAction.TRIAGE_INTO);
        assertThat(LifecycleAction.fromValue("TRIAGE_INTO")).isEqualTo(LifecycleAction.TRIAGE_INTO);
        assertThat(LifecycleAction.fromValue("triage_into")).isEqualTo(LifecycleAction.TRIAGE_INTO);
        assertThat(LifecycleAction.fromValue("close")).isEqualTo(LifecycleAction.CLOSE);
    }
}
