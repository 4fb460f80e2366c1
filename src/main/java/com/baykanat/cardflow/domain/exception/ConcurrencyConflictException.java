package com.baykanat.cardflow.domain.exception;

/** Yazma sırasında version guard tutmadı; kart okunduktan sonra başka biri değiştirdi. */
public class ConcurrencyConflictException extends CardflowException {

    public ConcurrencyConflictException(String cardId, long expectedVersion) {
        super("Card " + cardId + " was modified concurrently (expected version " + expectedVersion + ")");
    }
}
