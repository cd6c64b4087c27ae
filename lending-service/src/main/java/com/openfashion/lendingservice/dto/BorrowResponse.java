package com.openfashion.lendingservice.dto;

public record BorrowResponse(long loanId) {}
