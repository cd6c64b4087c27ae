package com.openfashion.lendingservice.model;

public enum BalanceKind {

    /**
     * Settlement asset supplied to the shared pool.
     */
    DEPOSIT,

    /**
     * Aggregate principal borrowed across every loan of the account.
     * Partial repayments do not touch it, only full repayment and liquidation do.
     */
    BORROW,

    /**
     * Aggregate collateral posted across every loan of the account.
     */
    COLLATERAL
}
