package com.ogt.tapak.exception;

import org.springframework.http.HttpStatus;

public class FeatureNotFoundException extends TapakException {

    public FeatureNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }

    public FeatureNotFoundException(String message, Throwable cause) {
        super(HttpStatus.NOT_FOUND, message, cause);
    }
}
