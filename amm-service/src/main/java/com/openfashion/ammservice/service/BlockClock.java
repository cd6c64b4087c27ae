package com.openfashion.ammservice.service;

/**
 * Block height supplied by the hosting chain. Never decreases.
 */
public interface BlockClock {

    long currentBlock();
}
