package com.calai.dietworkout.prediction.exception;

import lombok.Getter;

@Getter
public class MissingParameterException extends RuntimeException {
    private final String field;

    public MissingParameterException(String field) {
        super("Missing parameter: '" + field + "'");
        this.field = field;
    }
}
