package com.evenexus.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Per-unit price derived from one side of an order book.
 * {@code price} is null when no matching order could fill anything.
 */
@Value
public class PriceQuote {

    BigDecimal price;
    boolean insufficientStock;

    public static PriceQuote none() {
        return new PriceQuote(null, true);
    }

    public boolean isAvailable() {
        return price != null;
    }
}
