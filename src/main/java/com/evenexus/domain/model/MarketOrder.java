package com.evenexus.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One entry of a region order book, as published by the market data provider.
 *
 * <p>Immutable once fetched. Only {@code price}, {@code volumeRemain}, {@code buyOrder}
 * and {@code systemId} take part in valuation; the remaining fields are carried so the
 * record stays a faithful copy of the provider's data.
 */
@Value
@Builder
public class MarketOrder {

    long orderId;
    int typeId;
    long locationId;

    /** Solar system the order sits in. Compared against the hub's system id. */
    int systemId;

    /** True for bids (buy orders), false for asks (sell orders). */
    boolean buyOrder;

    BigDecimal price;

    /** Units still available at this price level. */
    long volumeRemain;

    long volumeTotal;
    int minVolume;
    int duration;
    String range;
    Instant issued;
}
