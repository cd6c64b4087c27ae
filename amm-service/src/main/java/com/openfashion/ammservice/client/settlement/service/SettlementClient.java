package com.openfashion.ammservice.client.settlement.service;

import com.openfashion.ammservice.client.settlement.dto.SettlementRequest;
import com.openfashion.ammservice.client.settlement.dto.SettlementResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class SettlementClient {

    private final RestClient restClient;

    public SettlementClient(@Value("${app.settlement.url}") String settlementUrl) {
        this.restClient = RestClient.builder().baseUrl(settlementUrl).build();
    }

    public SettlementResponse transfer(SettlementRequest request) {
        return restClient.post()
                .uri("/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(SettlementResponse.class);
    }

}
