package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class FarmingPoolAlreadyExistsException extends RuntimeException {
    public FarmingPoolAlreadyExistsException(long poolId) {
        super("Pool " + poolId + " already has a farming pool");
    }
}
