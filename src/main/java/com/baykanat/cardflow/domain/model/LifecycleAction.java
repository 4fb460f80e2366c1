package com.baykanat.cardflow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/** Kart geçişleri ve izin verilen başlangıç durumları. */
public enum LifecycleAction {
    PUBLISH("publish", EventAction.PUBLISH, EnumSet.of(EffectiveState.DRAFTED)),
    CLOSE("close", EventAction.CLOSE,
            EnumSet.of(EffectiveState.ACTIVE, EffectiveState.TRIAGE, EffectiveState.NOT_NOW)),
    POSTPONE("postpone", EventAction.POSTPONE, EnumSet.of(EffectiveState.ACTIVE, EffectiveState.TRIAGE)),
    REOPEN("reopen", EventAction.REOPEN, EnumSet.of(EffectiveState.CLOSED)),
    RESUME("resume", EventAction.RESUME, EnumSet.of(EffectiveState.NOT_NOW)),
    TRIAGE_INTO("triageInto", EventAction.TRIAGE_INTO,
            EnumSet.complementOf(EnumSet.of(EffectiveState.DRAFTED)));

    private final String value;
    private final EventAction eventAction;
    private final Set<EffectiveState> allowedFrom;

    LifecycleAction(String value, EventAction eventAction, Set<EffectiveState> allowedFrom) {
        this.value = value;
        this.eventAction = eventAction;
        this.allowedFrom = allowedFrom;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public EventAction getEventAction() {
        return eventAction;
    }

    public Set<EffectiveState> getAllowedFrom() {
        return allowedFrom;
    }

    public boolean isAllowedFrom(EffectiveState state) {
        return allowedFrom.contains(state);
    }

    /** "triageInto", "triage_into" ve enum adı kabul edilir. */
    @JsonCreator
    public static LifecycleAction fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (LifecycleAction action : values()) {
            if (action.value.equalsIgnoreCase(value)
                    || action.name().equalsIgnoreCase(value)
                    || action.eventAction.getValue().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle action: " + value);
    }
}
