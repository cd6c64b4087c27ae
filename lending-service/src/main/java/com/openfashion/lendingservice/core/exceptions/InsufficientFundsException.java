package com.openfashion.lendingservice.core.exceptions;

import com.openfashion.lendingservice.model.StatKey;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.PAYMENT_REQUIRED)
public class InsufficientFundsException extends RuntimeException {
    public InsufficientFundsException(String accountId, long requested, long available) {
        super("Insufficient funds on account " + accountId + ": requested " + requested + ", available " + available);
    }

    public InsufficientFundsException(StatKey counter, long requested, long available) {
        super("Protocol counter " + counter + " cannot be reduced by " + requested + ": only " + available + " recorded");
    }
}
