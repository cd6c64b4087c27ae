package com.openfashion.ammservice.model;

public enum OutboxStatus {
    PENDING,
    PROCESSED
}
