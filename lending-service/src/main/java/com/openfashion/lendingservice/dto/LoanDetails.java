package com.openfashion.lendingservice.dto;

import com.openfashion.lendingservice.model.Loan;

public record LoanDetails(
        long loanId,
        String borrower,
        long principal,
        long collateral,
        long interestRate,
        long startBlock,
        long lastUpdateBlock
) {

    public static LoanDetails from(Loan loan) {
        return new LoanDetails(
                loan.getId(),
                loan.getBorrower(),
                loan.getPrincipal(),
                loan.getCollateral(),
                loan.getInterestRate(),
                loan.getStartBlock(),
                loan.getLastUpdateBlock()
        );
    }
}
