package com.openfashion.lendingservice.client.settlement.dto;

public enum SettlementStatus {
    APPROVED,
    DECLINED
}
