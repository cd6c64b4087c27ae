package com.openfashion.lendingservice.service;

/**
 * Block height supplied by the hosting chain. Never decreases.
 */
public interface BlockClock {

    long currentBlock();
}
