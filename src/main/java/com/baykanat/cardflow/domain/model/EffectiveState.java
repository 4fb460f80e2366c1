package com.baykanat.cardflow.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kartın türetilmiş yaşam döngüsü durumu; hiçbir zaman saklanmaz.
 *
 * <p>Öncelik sırası: drafted, closed, not_now, triage, active.
 */
public enum EffectiveState {
    DRAFTED("drafted"),
    ACTIVE("active"),
    TRIAGE("triage"),
    CLOSED("closed"),
    NOT_NOW("not_now");

    private final String value;

    EffectiveState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Yayında, kapanmamış ve ertelenmemiş (active veya triage). */
    public boolean isOpen() {
        return this == ACTIVE || this == TRIAGE;
    }

    public static EffectiveState of(Card card) {
        if (card.getStatus() == CardStatus.DRAFTED) {
            return DRAFTED;
        }
        if (card.getClosedAt() != null) {
            return CLOSED;
        }
        if (card.getPostponedAt() != null) {
            return NOT_NOW;
        }
        if (card.getColumnId() == null) {
            return TRIAGE;
        }
        return ACTIVE;
    }
}
