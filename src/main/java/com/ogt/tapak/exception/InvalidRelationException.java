package com.ogt.tapak.exception;

import org.springframework.http.HttpStatus;

/**
 * Nombre de relación sin esquema o relación inexistente: error de configuración, no del cliente.
 */
public class InvalidRelationException extends TapakException {

    public InvalidRelationException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
