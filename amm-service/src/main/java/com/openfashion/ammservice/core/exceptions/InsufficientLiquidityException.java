package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class InsufficientLiquidityException extends RuntimeException {
    public InsufficientLiquidityException(String msg) {
        super(msg);
    }
}
