package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class TransferFailedException extends RuntimeException {
    public TransferFailedException(String from, String to, long amount, String reason) {
        super("Transfer of " + amount + " from " + from + " to " + to + " failed: " + reason);
    }
}
