package com.baykanat.cardflow.domain.exception;

/** Erişim katmanının verdiği rol bu işlem için yetersiz. */
public class AuthorizationException extends CardflowException {

    public AuthorizationException(String message) {
        super(message);
    }
}
