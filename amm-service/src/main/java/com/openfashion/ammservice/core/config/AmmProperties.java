package com.openfashion.ammservice.core.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "app.amm")
@Getter
@Setter
@Validated
public class AmmProperties {

    // Only identity allowed to change fee rates, create farming pools and post oracle prices.
    @NotBlank
    private String owner;

    // Account that holds every pool's reserves.
    @NotBlank
    private String custodian;

    @Positive
    private long minLiquidity = 1000;

    @PositiveOrZero
    private long defaultFeeRate = 30;

    @Positive
    private long maxFeeRate = 1000;

    @Positive
    private int maxPoolsPerAccount = 20;

    public boolean isOwner(String caller) {
        return owner.equals(caller);
    }
}
