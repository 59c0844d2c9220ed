package com.evenexus.api.dto.response;

import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Appraisal result returned by {@code POST /api/appraisals}.
 *
 * <p>Totals already include the discount. {@code hasInsufficientLiquidity} is set when any
 * item could not be completely filled on either side; the side flags say which.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppraisalResponse {

    private BigDecimal totalBuyExecution;
    private BigDecimal totalSellExecution;
    private BigDecimal totalMidExecution;

    private boolean hasInsufficientLiquidity;
    private boolean insufficientBuyLiquidity;
    private boolean insufficientSellLiquidity;
    private int itemsWithoutOrders;

    private int discountPercent;

    private int regionId;
    private int systemId;

    private List<ItemValuationResponse> items;
}
