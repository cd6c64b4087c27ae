package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class SwapNotFoundException extends RuntimeException {
    public SwapNotFoundException(long swapId) {
        super("Cannot find swap with id: " + swapId);
    }
}
