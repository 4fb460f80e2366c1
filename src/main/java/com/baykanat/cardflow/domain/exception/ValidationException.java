package com.baykanat.cardflow.domain.exception;

/** Hatalı girdi (boş yorum, pozitif olmayan süre, eksik kolon vb.). */
public class ValidationException extends CardflowException {

    public ValidationException(String message) {
        super(message);
    }
}
