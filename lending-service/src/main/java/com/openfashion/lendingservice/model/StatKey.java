package com.openfashion.lendingservice.model;

public enum StatKey {
    TOTAL_DEPOSITED,
    TOTAL_BORROWED,
    LOAN_COUNT
}
