package com.openfashion.lendingservice.service;

import com.openfashion.lendingservice.dto.AccountPosition;
import com.openfashion.lendingservice.dto.LoanDetails;
import com.openfashion.lendingservice.dto.ProtocolStats;
import com.openfashion.lendingservice.dto.RepaymentResponse;

import java.util.List;

public interface LendingService {

    void deposit(String caller, long amount);

    void withdraw(String caller, long amount);

    /**
     * @return id of the new loan
     */
    long borrow(String caller, long amount, long collateralAmount);

    RepaymentResponse repay(String caller, long loanId, long amount);

    /**
     * @return collateral paid out to the liquidator
     */
    long liquidate(String caller, long loanId);

    long getDepositBalance(String accountId);

    long getBorrowBalance(String accountId);

    long getCollateralBalance(String accountId);

    AccountPosition getPosition(String accountId);

    LoanDetails getLoanDetails(long loanId);

    List<LoanDetails> getLoans(String borrower);

    long getAmountOwed(long loanId);

    boolean isHealthy(long loanId);

    ProtocolStats getProtocolStats();

    long getUtilizationRate();
}
