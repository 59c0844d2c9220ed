package com.evenexus.appraisal;

import com.evenexus.domain.model.ItemValuation;
import com.evenexus.domain.model.PortfolioValuation;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/** Rolls per-item valuations up into undiscounted bundle totals. */
@Component
public class PortfolioAggregator {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public PortfolioValuation aggregate(List<ItemValuation> items) {
        BigDecimal totalBuy = BigDecimal.ZERO;
        BigDecimal totalSell = BigDecimal.ZERO;
        boolean buyShort = false;
        boolean sellShort = false;
        int withoutOrders = 0;

        for (ItemValuation item : items) {
            totalBuy = totalBuy.add(item.getBuyExecutionTotal());
            totalSell = totalSell.add(item.getSellExecutionTotal());
            buyShort |= item.getUnmetBuyQuantity() > 0;
            sellShort |= item.getUnmetSellQuantity() > 0;
            if (!item.isHubOrdersPresent()) {
                withoutOrders++;
            }
        }

        return PortfolioValuation.builder()
                .totalBuyExecution(totalBuy)
                .totalSellExecution(totalSell)
                .totalMidExecution(midpoint(totalBuy, totalSell))
                .insufficientLiquidity(buyShort || sellShort)
                .insufficientBuyLiquidity(buyShort)
                .insufficientSellLiquidity(sellShort)
                .itemsWithoutOrders(withoutOrders)
                .discountPercent(ValuationPresenter.UNDISCOUNTED_PERCENT)
                .items(List.copyOf(items))
                .build();
    }

    static BigDecimal midpoint(BigDecimal buy, BigDecimal sell) {
        // halving a finite decimal always terminates
        return buy.add(sell).divide(TWO);
    }
}
