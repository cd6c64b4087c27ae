package com.openfashion.ammservice.dto;

import com.openfashion.ammservice.model.OraclePrice;

public record OraclePriceDetails(
        String asset,
        long price,
        long updatedAtBlock
) {

    public static OraclePriceDetails from(OraclePrice price) {
        return new OraclePriceDetails(price.getAsset(), price.getPrice(), price.getUpdatedAtBlock());
    }
}
