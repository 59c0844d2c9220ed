package com.evenexus.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Bundle-level valuation. Recomputed on every request, never persisted.
 *
 * <p>{@code totalMidExecution} is always exactly half of buy + sell. When a discount has been
 * applied, all three totals are scaled by the same factor and {@code discountPercent}
 * records it; the per-item valuations are left unscaled.
 */
@Value
@Builder(toBuilder = true)
public class PortfolioValuation {

    BigDecimal totalBuyExecution;
    BigDecimal totalSellExecution;
    BigDecimal totalMidExecution;

    /** True if any item could not be fully filled on either side. */
    boolean insufficientLiquidity;

    boolean insufficientBuyLiquidity;
    boolean insufficientSellLiquidity;

    /** Items with no orders at all at the hub. */
    int itemsWithoutOrders;

    /** Percent applied to the totals; 100 means undiscounted. */
    int discountPercent;

    List<ItemValuation> items;

    public boolean hasInsufficientLiquidity() {
        return insufficientLiquidity;
    }
}
