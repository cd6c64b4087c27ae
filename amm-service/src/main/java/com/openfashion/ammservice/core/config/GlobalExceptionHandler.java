package com.openfashion.ammservice.core.config;

import com.openfashion.ammservice.core.exceptions.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.time.Instant;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler({PoolNotFoundException.class, SwapNotFoundException.class,
            FarmingPoolNotFoundException.class, OraclePriceNotFoundException.class})
    public ProblemDetail handleNotFound(RuntimeException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ProblemDetail handleUnauthorized(UnauthorizedException ex) {
        return problem(HttpStatus.FORBIDDEN, "Unauthorized", ex);
    }

    @ExceptionHandler(PoolInactiveException.class)
    public ProblemDetail handlePoolInactive(PoolInactiveException ex) {
        return problem(HttpStatus.FORBIDDEN, "Pool Inactive", ex);
    }

    @ExceptionHandler(InvalidAmountException.class)
    public ProblemDetail handleInvalidAmount(InvalidAmountException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid Amount", ex);
    }

    @ExceptionHandler(InvalidAssetException.class)
    public ProblemDetail handleInvalidAsset(InvalidAssetException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid Asset", ex);
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ProblemDetail handleInsufficientBalance(InsufficientBalanceException ex) {
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Balance", ex);
    }

    @ExceptionHandler(InsufficientLiquidityException.class)
    public ProblemDetail handleInsufficientLiquidity(InsufficientLiquidityException ex) {
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Liquidity", ex);
    }

    @ExceptionHandler(SlippageExceededException.class)
    public ProblemDetail handleSlippage(SlippageExceededException ex) {
        return problem(HttpStatus.CONFLICT, "Slippage Exceeded", ex);
    }

    @ExceptionHandler(FarmingPoolAlreadyExistsException.class)
    public ProblemDetail handleAlreadyExists(FarmingPoolAlreadyExistsException ex) {
        return problem(HttpStatus.CONFLICT, "Already Exists", ex);
    }

    @ExceptionHandler(TransferFailedException.class)
    public ProblemDetail handleTransferFailed(TransferFailedException ex) {
        return problem(HttpStatus.BAD_GATEWAY, "Transfer Failed", ex);
    }

    private ProblemDetail problem(HttpStatus status, String title, RuntimeException ex) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(title);
        problemDetail.setProperty("timestamp", Instant.now());
        return problemDetail;
    }
}
