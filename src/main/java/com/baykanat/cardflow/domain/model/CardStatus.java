package com.baykanat.cardflow.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** cards.status sütunu; kapanma ve erteleme ayrı alanlarda tutulur. */
public enum CardStatus {
    DRAFTED("drafted"),
    PUBLISHED("published");

    private final String dbValue;

    CardStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String getDbValue() {
        return dbValue;
    }

    public static CardStatus fromDbValue(String value) {
        for (CardStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown card status: " + value);
    }
}
