package com.ogt.tapak.exception;

import org.springframework.http.HttpStatus;

public class ExportFailedException extends TapakException {

    public ExportFailedException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
