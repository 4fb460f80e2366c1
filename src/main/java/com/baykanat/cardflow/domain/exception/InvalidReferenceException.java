package com.baykanat.cardflow.domain.exception;

/** Var olmayan ya da kartın board'una ait olmayan kolon referansı. */
public class InvalidReferenceException extends CardflowException {

    public InvalidReferenceException(String message) {
        super(message);
    }
}
