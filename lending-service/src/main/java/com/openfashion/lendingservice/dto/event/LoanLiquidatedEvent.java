package com.openfashion.lendingservice.dto.event;

public record LoanLiquidatedEvent(
        long loanId,
        String borrower,
        String liquidator,
        long principal,
        long collateral,
        long totalOwed,
        long collateralRatio,
        long block
) {}
