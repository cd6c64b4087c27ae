package com.openfashion.ammservice.controller;

import com.openfashion.ammservice.dto.OraclePriceDetails;
import com.openfashion.ammservice.dto.OraclePriceRequest;
import com.openfashion.ammservice.service.OracleService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/oracle")
@RequiredArgsConstructor
public class OracleController {

    private final OracleService oracleService;

    @PutMapping("/prices/{asset}")
    public OraclePriceDetails updatePrice(@RequestHeader("X-Account-ID") String caller,
                                          @PathVariable String asset,
                                          @RequestBody OraclePriceRequest request) {
        return oracleService.updateOraclePrice(caller, asset, request.price());
    }

    @GetMapping("/prices/{asset}")
    public OraclePriceDetails getPrice(@PathVariable String asset) {
        return oracleService.getOraclePrice(asset);
    }
}
