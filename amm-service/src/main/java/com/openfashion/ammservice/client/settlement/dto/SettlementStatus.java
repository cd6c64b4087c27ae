package com.openfashion.ammservice.client.settlement.dto;

public enum SettlementStatus {
    APPROVED,
    DECLINED
}
