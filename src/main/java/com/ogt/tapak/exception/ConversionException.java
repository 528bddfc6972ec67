package com.ogt.tapak.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Falla de ogr2ogr (exit != 0, timeout) o ausencia del archivo fuente.
 * {@code stderr} conserva la salida de error de la herramienta.
 */
@Getter
public class ConversionException extends TapakException {

    private final String stderr;

    public ConversionException(String message, String stderr) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, stderr == null || stderr.isBlank() ? message : message + ": " + stderr.strip());
        this.stderr = stderr;
    }

    public ConversionException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
        this.stderr = null;
    }
}
