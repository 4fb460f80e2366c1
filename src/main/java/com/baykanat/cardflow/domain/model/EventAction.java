package com.baykanat.cardflow.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** events.action değerleri. notifiable=true olanlar izleyicilere bildirim üretir. */
public enum EventAction {
    CREATE("create", false),
    PUBLISH("publish", true),
    CLOSE("close", true),
    POSTPONE("postpone", true),
    REOPEN("reopen", true),
    RESUME("resume", true),
    TRIAGE_INTO("triage_into", false),
    COMMENT("comment", true),
    GILD("gild", false),
    UNGILD("ungild", false),
    DELETE("delete", false);

    private final String value;
    private final boolean notifiable;

    EventAction(String value, boolean notifiable) {
        this.value = value;
        this.notifiable = notifiable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isNotifiable() {
        return notifiable;
    }

    public static EventAction fromValue(String value) {
        for (EventAction action : values()) {
            if (action.value.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown event action: " + value);
    }
}
