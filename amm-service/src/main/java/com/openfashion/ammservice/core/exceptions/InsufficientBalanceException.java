package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class InsufficientBalanceException extends RuntimeException {
    public InsufficientBalanceException(String provider, long poolId, long requested, long held) {
        super("Provider " + provider + " holds " + held + " shares of pool " + poolId + ", cannot burn " + requested);
    }
}
