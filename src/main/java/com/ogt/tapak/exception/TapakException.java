package com.ogt.tapak.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base de los errores del pipeline. Cada subtipo fija el status HTTP con el que se responde.
 */
@Getter
public abstract class TapakException extends RuntimeException {

    private final HttpStatus status;

    protected TapakException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected TapakException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
