package com.evenexus.api.dto.response;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Hub prices for a single item type.
 *
 * <p>Best prices are the top of each side of the book. When a quantity is requested, the unit
 * prices are the volume-weighted averages of filling it, and the insufficient flags report
 * whether the hub could fill all of it.
 */
@Data
@Builder
public class ItemPriceResponse {

    private int typeId;
    private int regionId;
    private int systemId;

    private BigDecimal bestBuyPrice;
    private BigDecimal bestSellPrice;
    private BigDecimal averagePrice;

    private Long quantity;
    private BigDecimal buyUnitPrice;
    private BigDecimal sellUnitPrice;
    private Boolean buyInsufficient;
    private Boolean sellInsufficient;
}
