package com.openfashion.ammservice.model;

public enum StatKey {
    POOL_COUNT,
    TOTAL_SWAPS,
    TOTAL_VOLUME,
    TOTAL_FEES_COLLECTED
}
