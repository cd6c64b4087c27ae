package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class PoolInactiveException extends RuntimeException {
    public PoolInactiveException(long poolId) {
        super("Pool " + poolId + " is not active");
    }
}
