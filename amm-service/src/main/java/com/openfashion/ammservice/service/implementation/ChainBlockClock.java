package com.openfashion.ammservice.service.implementation;

import com.openfashion.ammservice.core.config.ChainProperties;
import com.openfashion.ammservice.service.BlockClock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives the block height from wall-clock time elapsed since genesis.
 */
@Component
@RequiredArgsConstructor
public class ChainBlockClock implements BlockClock {

    private final ChainProperties chainProperties;
    private final Clock clock = Clock.systemUTC();
    private final AtomicLong highest = new AtomicLong();

    @Override
    public long currentBlock() {
        Duration elapsed = Duration.between(chainProperties.getGenesis(), clock.instant());
        long height = Math.max(0L, elapsed.toMillis() / chainProperties.getBlockTime().toMillis());
        // guards against the wall clock stepping backwards
        return highest.accumulateAndGet(height, Math::max);
    }
}
