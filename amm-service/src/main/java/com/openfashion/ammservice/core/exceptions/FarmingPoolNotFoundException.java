package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class FarmingPoolNotFoundException extends RuntimeException {
    public FarmingPoolNotFoundException(long poolId) {
        super("No farming pool for pool " + poolId);
    }
}
