package com.evenexus.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/**
 * Result of walking one item's hub order book for its demanded quantity.
 *
 * <p>{@code buyExecutionTotal} is the revenue from selling the demand into standing buy orders,
 * {@code sellExecutionTotal} the cost of buying it from standing sell orders. Partial fills
 * are counted; whatever could not be filled is reported in the unmet quantities.
 */
@Value
@Builder
public class ItemValuation {

    int typeId;
    long demandedQuantity;

    BigDecimal buyExecutionTotal;
    BigDecimal sellExecutionTotal;

    long filledBuyQuantity;
    long filledSellQuantity;

    long unmetBuyQuantity;
    long unmetSellQuantity;

    /** False when the order book held no orders at the hub on either side. */
    boolean hubOrdersPresent;

    public static ItemValuation empty(int typeId, long demandedQuantity) {
        return ItemValuation.builder()
                .typeId(typeId)
                .demandedQuantity(demandedQuantity)
                .buyExecutionTotal(BigDecimal.ZERO)
                .sellExecutionTotal(BigDecimal.ZERO)
                .unmetBuyQuantity(demandedQuantity)
                .unmetSellQuantity(demandedQuantity)
                .hubOrdersPresent(false)
                .build();
    }

    public boolean isInsufficient() {
        return unmetBuyQuantity > 0 || unmetSellQuantity > 0;
    }

    /** Average price per unit sold into bids, or null if nothing filled. */
    public BigDecimal averageBuyPrice() {
        return average(buyExecutionTotal, filledBuyQuantity);
    }

    /** Average price per unit bought from asks, or null if nothing filled. */
    public BigDecimal averageSellPrice() {
        return average(sellExecutionTotal, filledSellQuantity);
    }

    private static BigDecimal average(BigDecimal total, long quantity) {
        if (quantity <= 0) {
            return null;
        }
        return total.divide(BigDecimal.valueOf(quantity), 2, RoundingMode.HALF_UP);
    }
}
