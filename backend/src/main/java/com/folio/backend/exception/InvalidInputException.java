package com.folio.backend.exception;

import lombok.Getter;

@Getter
public class InvalidInputException extends BadRequestException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }
}
