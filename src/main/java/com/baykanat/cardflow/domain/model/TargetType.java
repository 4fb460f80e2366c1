package com.baykanat.cardflow.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Event hedefinin türü; kapalı küme. */
public enum TargetType {
    CARD("card"),
    COMMENT("comment"),
    BOARD("board");

    private final String value;

    TargetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TargetType fromValue(String value) {
        for (TargetType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown target type: " + value);
    }
}
