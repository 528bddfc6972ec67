package com.ogt.tapak.exception;

import org.springframework.http.HttpStatus;

/**
 * Entrada del cliente inválida (extensión, ZIP corrupto, lista de ids). Nunca se reintenta.
 */
public class BadInputException extends TapakException {

    public BadInputException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public BadInputException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, cause);
    }

    protected BadInputException(HttpStatus status, String message) {
        super(status, message);
    }
}
