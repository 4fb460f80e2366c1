package com.baykanat.cardflow.domain.model;

/** pending → processing → delivered; geri dönüş yok. */
public enum BundleStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    DELIVERED("delivered");

    private final String dbValue;

    BundleStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public static BundleStatus fromDbValue(String value) {
        for (BundleStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown bundle status: " + value);
    }
}
