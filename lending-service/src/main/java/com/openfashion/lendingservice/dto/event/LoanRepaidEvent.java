package com.openfashion.lendingservice.dto.event;

public record LoanRepaidEvent(
        long loanId,
        String borrower,
        long amount,
        long interest,
        long remainingPrincipal,
        boolean fullRepayment,
        long block
) {}
