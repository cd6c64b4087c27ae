package com.openfashion.ammservice.service.implementation;

import com.openfashion.ammservice.core.config.AmmProperties;
import com.openfashion.ammservice.core.exceptions.InvalidAmountException;
import com.openfashion.ammservice.core.exceptions.InvalidAssetException;
import com.openfashion.ammservice.core.exceptions.OraclePriceNotFoundException;
import com.openfashion.ammservice.core.exceptions.UnauthorizedException;
import com.openfashion.ammservice.dto.OraclePriceDetails;
import com.openfashion.ammservice.dto.event.OraclePriceUpdatedEvent;
import com.openfashion.ammservice.model.OraclePrice;
import com.openfashion.ammservice.repository.OraclePriceRepository;
import com.openfashion.ammservice.service.BlockClock;
import com.openfashion.ammservice.service.OracleService;
import com.openfashion.ammservice.service.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

// Prices are stored and served only; pool pricing never reads them.
@Service
@Slf4j
@RequiredArgsConstructor
public class OracleServiceImp implements OracleService {

    private final OraclePriceRepository oraclePriceRepository;
    private final OutboxService outboxService;
    private final BlockClock blockClock;
    private final AmmProperties properties;

    private static final String ORACLE_PRICE_UPDATED_EVENT = "ORACLE_PRICE_UPDATED";

    @Override
    @Transactional
    public OraclePriceDetails updateOraclePrice(String caller, String asset, long price) {
        if (!properties.isOwner(caller)) {
            throw new UnauthorizedException(caller, "post oracle prices");
        }
        if (asset == null || asset.isBlank()) {
            throw new InvalidAssetException("Oracle asset must be named");
        }
        if (price <= 0) {
            throw new InvalidAmountException("Oracle price must be positive, got " + price);
        }

        long block = blockClock.currentBlock();
        OraclePrice oraclePrice = oraclePriceRepository.findById(asset)
                .orElseGet(() -> OraclePrice.builder().asset(asset).build());
        oraclePrice.setPrice(price);
        oraclePrice.setUpdatedAtBlock(block);
        oraclePriceRepository.save(oraclePrice);

        outboxService.record(ORACLE_PRICE_UPDATED_EVENT, asset, new OraclePriceUpdatedEvent(asset, price, block));
        log.info("Oracle price of {} set to {} at block {}", asset, price, block);

        return OraclePriceDetails.from(oraclePrice);
    }

    @Override
    @Transactional(readOnly = true)
    public OraclePriceDetails getOraclePrice(String asset) {
        return oraclePriceRepository.findById(asset)
                .map(OraclePriceDetails::from)
                .orElseThrow(() -> new OraclePriceNotFoundException(asset));
    }
}
