package com.baykanat.cardflow.domain.model;

/** deliver çağrısının sonucu; SKIPPED → bundle yok, pending değil ya da başka çağıran aldı. */
public enum DeliveryOutcome {
    DELIVERED,
    FAILED,
    SKIPPED
}
