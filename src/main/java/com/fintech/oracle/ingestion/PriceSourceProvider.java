package com.fintech.oracle.ingestion;

import com.fintech.oracle.domain.PriceSource;

/**
 * One external price source. Implementations perform a single attempt per call
 * and should respect the source's timeout.
 */
public interface PriceSourceProvider {

    /** Static description of this source (name, weight, timeout). */
    PriceSource source();

    /**
     * Fetches the current price of a symbol.
     *
     * @throws PriceFetchException if the source fails or returns an unusable value
     */
    double fetchPrice(String symbol);
}
