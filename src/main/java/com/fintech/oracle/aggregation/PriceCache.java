package com.fintech.oracle.aggregation;

import com.fintech.oracle.domain.AggregatedPrice;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Latest accepted {@link AggregatedPrice} per symbol.
 *
 * Values are immutable records swapped in whole under the write lock, so readers never see a
 * partially updated price. {@link #getAllPrices()} returns a consistent snapshot taken under
 * one read lock.
 */
public class PriceCache {

    private final Map<String, AggregatedPrice> prices = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Replaces the cached value for the price's symbol. */
    public void publish(AggregatedPrice price) {
        lock.writeLock().lock();
        try {
            prices.put(price.symbol(), price);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<AggregatedPrice> getPrice(String symbol) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(prices.get(symbol));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Read-only snapshot of every cached price. */
    public Map<String, AggregatedPrice> getAllPrices() {
        lock.readLock().lock();
        try {
            return Map.copyOf(prices);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return prices.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
