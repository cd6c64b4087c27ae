package com.openfashion.lendingservice.service;

import com.openfashion.lendingservice.dto.TransferResult;

/**
 * All-or-nothing movement of an asset between two accounts. A failed result means nothing moved.
 */
public interface AssetTransferService {

    TransferResult transfer(String asset, long amount, String from, String to);
}
