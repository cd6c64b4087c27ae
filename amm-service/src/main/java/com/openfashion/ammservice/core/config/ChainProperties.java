package com.openfashion.ammservice.core.config;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;

@Component
@ConfigurationProperties(prefix = "app.chain")
@Getter
@Setter
@Validated
public class ChainProperties {

    @NotNull
    private Instant genesis = Instant.parse("2024-01-01T00:00:00Z");

    @NotNull
    private Duration blockTime = Duration.ofMinutes(10);
}
