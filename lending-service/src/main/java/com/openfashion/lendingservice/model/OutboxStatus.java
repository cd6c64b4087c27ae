package com.openfashion.lendingservice.model;

public enum OutboxStatus {
    PENDING,
    PROCESSED
}
