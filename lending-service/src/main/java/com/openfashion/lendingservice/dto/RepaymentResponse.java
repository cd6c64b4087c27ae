package com.openfashion.lendingservice.dto;

public record RepaymentResponse(
        long loanId,
        long amountPaid,
        long interest,
        long remainingPrincipal,
        boolean fullRepayment
) {}
