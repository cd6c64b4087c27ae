package com.openfashion.ammservice.dto;

public record OraclePriceRequest(long price) {}
