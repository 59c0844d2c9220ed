package com.evenexus.domain.model;

import lombok.Value;

/**
 * A (region, solar system) pair. Orders are fetched for the whole region and then
 * filtered down to the hub's system.
 */
@Value
public class TradingHub {

    /** The Forge. */
    public static final int JITA_REGION_ID = 10_000_002;

    /** Jita. */
    public static final int JITA_SYSTEM_ID = 30_000_142;

    int regionId;
    int systemId;

    public static TradingHub of(int regionId, int systemId) {
        return new TradingHub(regionId, systemId);
    }

    public static TradingHub jita() {
        return new TradingHub(JITA_REGION_ID, JITA_SYSTEM_ID);
    }

    /** Region and system ids must both be positive; structure markets are not supported. */
    public boolean isResolvable() {
        return regionId > 0 && systemId > 0;
    }
}
