package com.openfashion.lendingservice.core.config;

import com.openfashion.lendingservice.core.exceptions.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<Object> handleNSF(InsufficientFundsException ex) {
        return buildResponse(HttpStatus.PAYMENT_REQUIRED, "INSUFFICIENT_FUNDS", ex.getMessage());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Object> handleUnauthorized(UnauthorizedException ex) {
        return buildResponse(HttpStatus.FORBIDDEN, "UNAUTHORIZED", ex.getMessage());
    }

    @ExceptionHandler(LoanNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(LoanNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "LOAN_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidAmountException.class)
    public ResponseEntity<Object> handleInvalidAmount(InvalidAmountException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_AMOUNT", ex.getMessage());
    }

    @ExceptionHandler(InvalidCollateralRatioException.class)
    public ResponseEntity<Object> handleRatio(InvalidCollateralRatioException ex) {
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_COLLATERAL_RATIO", ex.getMessage());
    }

    @ExceptionHandler(TransferFailedException.class)
    public ResponseEntity<Object> handleTransfer(TransferFailedException ex) {
        return buildResponse(HttpStatus.BAD_GATEWAY, "TRANSFER_FAILED", ex.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Object> handleMissingIdentity(MissingRequestHeaderException ex) {
        return buildResponse(HttpStatus.UNAUTHORIZED, "MISSING_IDENTITY", ex.getMessage());
    }

    private ResponseEntity<Object> buildResponse(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
