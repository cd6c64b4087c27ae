package com.openfashion.ammservice.service.implementation;

import com.openfashion.ammservice.client.settlement.dto.SettlementRequest;
import com.openfashion.ammservice.client.settlement.dto.SettlementResponse;
import com.openfashion.ammservice.client.settlement.service.SettlementClient;
import com.openfashion.ammservice.dto.TransferResult;
import com.openfashion.ammservice.service.AssetTransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class SettlementTransferServiceImp implements AssetTransferService {

    private final SettlementClient settlementClient;

    @Override
    public TransferResult transfer(String asset, long amount, String from, String to) {
        SettlementRequest request = new SettlementRequest(UUID.randomUUID(), asset, amount, from, to);

        try {
            SettlementResponse response = settlementClient.transfer(request);

            if (response == null) {
                return TransferResult.failure("Empty settlement response");
            }

            return switch (response.status()) {
                case APPROVED -> TransferResult.success(response.transferId());
                case DECLINED -> {
                    log.warn("Settlement declined {} {} from {} to {}: {}", amount, asset, from, to, response.reasonCode());
                    yield TransferResult.failure(response.reasonCode());
                }
            };
        } catch (RestClientException e) {
            log.error("Settlement call failed for reference {}", request.referenceId(), e);
            return TransferResult.failure("Settlement unavailable");
        }
    }
}
