package com.evenexus.api.dto.response;

import com.evenexus.domain.model.PortfolioValuation;
import java.util.ArrayList;
import java.util.List;

/** Non-fatal conditions reported alongside a successful appraisal or discount update. */
public enum AppraisalWarning {
    INSUFFICIENT_BUY_LIQUIDITY,
    INSUFFICIENT_SELL_LIQUIDITY,
    ITEMS_WITHOUT_ORDERS,
    DISCOUNT_REJECTED;

    public static List<AppraisalWarning> of(PortfolioValuation valuation) {
        List<AppraisalWarning> warnings = new ArrayList<>();
        if (valuation.isInsufficientBuyLiquidity()) {
            warnings.add(INSUFFICIENT_BUY_LIQUIDITY);
        }
        if (valuation.isInsufficientSellLiquidity()) {
            warnings.add(INSUFFICIENT_SELL_LIQUIDITY);
        }
        if (valuation.getItemsWithoutOrders() > 0) {
            warnings.add(ITEMS_WITHOUT_ORDERS);
        }
        return warnings;
    }
}
