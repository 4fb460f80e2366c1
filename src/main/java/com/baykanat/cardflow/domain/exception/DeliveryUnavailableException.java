package com.baykanat.cardflow.domain.exception;

/** Teslim kanalı (Kafka) ulaşılamaz ya da circuit breaker açık; bundle yeniden denenir. */
public class DeliveryUnavailableException extends CardflowException {

    public DeliveryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
