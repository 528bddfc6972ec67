package com.ogt.tapak.exception;

import org.springframework.http.HttpStatus;

public class NothingToInsertException extends TapakException {

    public NothingToInsertException(String targetRelation) {
        super(HttpStatus.INTERNAL_SERVER_ERROR,
                "Target relation " + targetRelation + " has no insertable columns besides the identifier");
    }
}
