package com.evenexus.api.dto.response;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemValuationResponse {

    private int typeId;
    private long demandedQuantity;

    private BigDecimal buyExecutionTotal;
    private BigDecimal sellExecutionTotal;

    /** Null when nothing could be sold into bids. */
    private BigDecimal averageBuyPrice;

    /** Null when nothing could be bought from asks. */
    private BigDecimal averageSellPrice;

    private long unmetBuyQuantity;
    private long unmetSellQuantity;

    private boolean hubOrdersPresent;
}
