package com.openfashion.lendingservice.client.settlement.service;

import com.openfashion.lendingservice.client.settlement.dto.SettlementRequest;
import com.openfashion.lendingservice.client.settlement.dto.SettlementResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class SettlementClient {

    private final RestClient restClient;
    private final String settlementUrl;

    public SettlementClient(RestClient restClient, @Value("${app.settlement.url}") String settlementUrl) {
        this.restClient = restClient;
        this.settlementUrl = settlementUrl;
    }

    public SettlementResponse transfer(SettlementRequest request) {
        return restClient.post()
                .uri(settlementUrl + "/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(SettlementResponse.class);
    }
}
