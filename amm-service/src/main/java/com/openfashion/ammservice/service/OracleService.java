package com.openfashion.ammservice.service;

import com.openfashion.ammservice.dto.OraclePriceDetails;

public interface OracleService {

    OraclePriceDetails updateOraclePrice(String caller, String asset, long price);

    OraclePriceDetails getOraclePrice(String asset);
}
