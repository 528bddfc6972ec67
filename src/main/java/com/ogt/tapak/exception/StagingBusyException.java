package com.ogt.tapak.exception;

import org.springframework.http.HttpStatus;

public class StagingBusyException extends TapakException {

    public StagingBusyException(String stagingRelation) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "Staging relation " + stagingRelation + " is busy, try again later");
    }
}
