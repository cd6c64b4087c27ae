package com.openfashion.lendingservice.dto.event;

public record LoanCreatedEvent(
        long loanId,
        String borrower,
        long principal,
        long collateral,
        long interestRate,
        long block
) {}
