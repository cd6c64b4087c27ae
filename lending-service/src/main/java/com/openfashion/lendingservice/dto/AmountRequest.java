package com.openfashion.lendingservice.dto;

public record AmountRequest(long amount) {}
