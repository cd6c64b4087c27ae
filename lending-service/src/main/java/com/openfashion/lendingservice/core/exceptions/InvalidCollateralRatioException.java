package com.openfashion.lendingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class InvalidCollateralRatioException extends RuntimeException {
    public InvalidCollateralRatioException(long ratio, long threshold) {
        super("Collateral ratio " + ratio + " violates threshold " + threshold);
    }
}
