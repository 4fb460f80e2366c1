package com.baykanat.cardflow.domain.exception;

/** Domain hatalarının ortak tabanı; GlobalExceptionHandler HTTP durum koduna çevirir. */
public abstract class CardflowException extends RuntimeException {

    protected CardflowException(String message) {
        super(message);
    }

    protected CardflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
