package com.evenexus.appraisal;

import com.evenexus.domain.enums.OrderSide;
import com.evenexus.domain.model.ItemValuation;
import com.evenexus.domain.model.MarketOrder;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Walks an item's hub order book to value its demanded quantity.
 *
 * <p>The buy side (bids, best first by highest price) yields what the bundle would fetch if
 * sold; the sell side (asks, best first by lowest price) what it would cost to buy. Each
 * order contributes {@code min(remaining, volumeRemain)} units. Partial fills are counted,
 * and whatever the book cannot absorb is left as unmet quantity.
 */
@Component
public class LiquidityConsumptionCalculator {

    private static final Comparator<MarketOrder> BY_PRICE = Comparator.comparing(MarketOrder::getPrice);

    public ItemValuation consume(int typeId, long demandedQuantity, List<MarketOrder> orders, int hubSystemId) {
        if (orders == null || orders.isEmpty()) {
            return ItemValuation.empty(typeId, demandedQuantity);
        }
        List<MarketOrder> hubOrders = orders.stream()
                .filter(order -> order.getSystemId() == hubSystemId)
                .toList();

        Fill buy = walk(side(hubOrders, OrderSide.BUY), demandedQuantity);
        Fill sell = walk(side(hubOrders, OrderSide.SELL), demandedQuantity);

        return ItemValuation.builder()
                .typeId(typeId)
                .demandedQuantity(demandedQuantity)
                .buyExecutionTotal(buy.total())
                .sellExecutionTotal(sell.total())
                .filledBuyQuantity(buy.filled())
                .filledSellQuantity(sell.filled())
                .unmetBuyQuantity(demandedQuantity - buy.filled())
                .unmetSellQuantity(demandedQuantity - sell.filled())
                .hubOrdersPresent(!hubOrders.isEmpty())
                .build();
    }

    private static List<MarketOrder> side(List<MarketOrder> hubOrders, OrderSide side) {
        return hubOrders.stream()
                .filter(order -> side.matches(order.isBuyOrder()))
                .sorted(side == OrderSide.BUY ? BY_PRICE.reversed() : BY_PRICE)
                .toList();
    }

    private static Fill walk(List<MarketOrder> ranked, long demand) {
        long remaining = demand;
        BigDecimal total = BigDecimal.ZERO;
        for (MarketOrder order : ranked) {
            if (remaining <= 0) {
                break;
            }
            long units = Math.min(remaining, order.getVolumeRemain());
            if (units <= 0) {
                continue;
            }
            total = total.add(order.getPrice().multiply(BigDecimal.valueOf(units)));
            remaining -= units;
        }
        return new Fill(total, demand - remaining);
    }

    private record Fill(BigDecimal total, long filled) {}
}
