package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class PoolNotFoundException extends RuntimeException {
    public PoolNotFoundException(long poolId) {
        super("Cannot find pool with id: " + poolId);
    }
}
