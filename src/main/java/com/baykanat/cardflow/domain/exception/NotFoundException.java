package com.baykanat.cardflow.domain.exception;

/** Kayıt yok veya başka tenant'a ait; iki durum dışarıya ayırt edilmez. */
public class NotFoundException extends CardflowException {

    public NotFoundException(String entity, String id) {
        super(entity + " not found: " + id);
    }
}
