package com.openfashion.lendingservice.service.imp;

import com.openfashion.lendingservice.client.settlement.dto.SettlementRequest;
import com.openfashion.lendingservice.client.settlement.dto.SettlementResponse;
import com.openfashion.lendingservice.client.settlement.dto.SettlementStatus;
import com.openfashion.lendingservice.client.settlement.service.SettlementClient;
import com.openfashion.lendingservice.dto.TransferResult;
import com.openfashion.lendingservice.service.AssetTransferService;
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

            if (response.status() == SettlementStatus.APPROVED) {
                log.debug("Settlement {} approved: {} {} from {} to {}", request.referenceId(), amount, asset, from, to);
                return TransferResult.success(response.transferId());
            }

            log.warn("Settlement {} declined: {}", request.referenceId(), response.reasonCode());
            return TransferResult.failure(response.reasonCode());
        } catch (RestClientException e) {
            log.error("Settlement endpoint unreachable for transfer {}", request.referenceId(), e);
            return TransferResult.failure("Settlement unavailable");
        }
    }
}
