package com.ogt.tapak.exception;

import org.springframework.http.HttpStatus;

public class PayloadTooLargeException extends BadInputException {

    public PayloadTooLargeException(long size, long max) {
        super(HttpStatus.PAYLOAD_TOO_LARGE, "File too large: " + size + " bytes (max " + max + ")");
    }
}
