package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class SlippageExceededException extends RuntimeException {
    public SlippageExceededException(String quantity, long actual, long minimum) {
        super("Slippage exceeded: " + quantity + " " + actual + " is below the minimum " + minimum);
    }
}
