package com.openfashion.ammservice.dto;

public record PoolCreatedResponse(long poolId, long liquidity) {}
