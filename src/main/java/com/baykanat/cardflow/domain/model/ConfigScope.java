package com.baykanat.cardflow.domain.model;

import lombok.NonNull;
import lombok.Value;

/** Entropy ayarının kapsamı: {scope: tenant|board, id}. */
@Value
public class ConfigScope {

    public enum Kind {
        TENANT("tenant"),
        BOARD("board");

        private final String dbValue;

        Kind(String dbValue) {
            this.dbValue = dbValue;
        }

        public String getDbValue() {
            return dbValue;
        }

        public static Kind fromDbValue(String value) {
            for (Kind kind : values()) {
                if (kind.dbValue.equals(value)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown config scope: " + value);
        }
    }

    @NonNull
    Kind kind;
    @NonNull
    String id;

    public static ConfigScope tenant(String tenantId) {
        return new ConfigScope(Kind.TENANT, tenantId);
    }

    public static ConfigScope board(String boardId) {
        return new ConfigScope(Kind.BOARD, boardId);
    }
}
