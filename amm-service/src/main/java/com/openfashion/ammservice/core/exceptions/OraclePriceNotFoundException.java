package com.openfashion.ammservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class OraclePriceNotFoundException extends RuntimeException {
    public OraclePriceNotFoundException(String asset) {
        super("No oracle price recorded for asset " + asset);
    }
}
