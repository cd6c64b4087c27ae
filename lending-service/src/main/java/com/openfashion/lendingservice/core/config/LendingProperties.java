package com.openfashion.lendingservice.core.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Deployment-time parameters of the lending pool. The custodian identity is fixed for the
 * lifetime of the process.
 */
@Component
@ConfigurationProperties(prefix = "app.lending")
@Getter
@Setter
@Validated
public class LendingProperties {

    // Account that holds deposits and posted collateral.
    @NotBlank
    private String custodian;

    @NotBlank
    private String asset = "STX";

    @Positive
    private long minCollateralRatio = 150;

    @Positive
    private long maxLoanAmount = 1_000_000_000_000L;

    @Positive
    private long interestRatePerBlock = 5;
}
