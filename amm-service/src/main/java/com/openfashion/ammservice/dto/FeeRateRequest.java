package com.openfashion.ammservice.dto;

public record FeeRateRequest(long feeRate) {}
