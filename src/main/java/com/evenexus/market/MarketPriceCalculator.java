package com.evenexus.market;

import com.evenexus.domain.enums.OrderSide;
import com.evenexus.domain.model.MarketOrder;
import com.evenexus.domain.model.PriceQuote;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Price lookups over a single item's order book.
 *
 * <p>A null {@code systemId} considers the whole region; otherwise only orders in that
 * system count. Buy orders are ranked highest first, sell orders lowest first.
 */
@Component
public class MarketPriceCalculator {

    private static final int PRICE_SCALE = 2;

    /** Top of book for the side, or empty if no matching order exists. */
    public Optional<BigDecimal> bestPrice(List<MarketOrder> orders, OrderSide side, Integer systemId) {
        return ranked(orders, side, systemId).stream().findFirst().map(MarketOrder::getPrice);
    }

    /**
     * Volume-weighted price per unit of filling {@code quantity} from the side's best orders.
     *
     * <p>When the book cannot fill the whole quantity the quote is flagged insufficient and
     * the price is the average over what did fill. When nothing fills there is no price.
     */
    public PriceQuote unitPrice(List<MarketOrder> orders, OrderSide side, long quantity, Integer systemId) {
        List<MarketOrder> ranked = ranked(orders, side, systemId);
        if (ranked.isEmpty() || quantity <= 0) {
            return PriceQuote.none();
        }

        long remaining = quantity;
        long filled = 0;
        BigDecimal total = BigDecimal.ZERO;
        for (MarketOrder order : ranked) {
            if (remaining <= 0) {
                break;
            }
            long take = Math.min(remaining, order.getVolumeRemain());
            if (take <= 0) {
                continue;
            }
            total = total.add(order.getPrice().multiply(BigDecimal.valueOf(take)));
            remaining -= take;
            filled += take;
        }

        if (filled == 0) {
            return PriceQuote.none();
        }
        BigDecimal price = total.divide(BigDecimal.valueOf(filled), PRICE_SCALE, RoundingMode.HALF_UP);
        return new PriceQuote(price, remaining > 0);
    }

    /**
     * Midpoint of best buy and best sell. Falls back to whichever side exists, or zero
     * when the book is empty for the system.
     */
    public BigDecimal averagePrice(List<MarketOrder> orders, Integer systemId) {
        BigDecimal buy = positive(bestPrice(orders, OrderSide.BUY, systemId));
        BigDecimal sell = positive(bestPrice(orders, OrderSide.SELL, systemId));

        if (buy != null && sell != null) {
            return buy.add(sell).divide(BigDecimal.valueOf(2));
        }
        if (sell != null) {
            return sell;
        }
        return buy != null ? buy : BigDecimal.ZERO;
    }

    private static BigDecimal positive(Optional<BigDecimal> price) {
        return price.filter(p -> p.signum() > 0).orElse(null);
    }

    private static List<MarketOrder> ranked(List<MarketOrder> orders, OrderSide side, Integer systemId) {
        if (orders == null || orders.isEmpty()) {
            return List.of();
        }
        Comparator<MarketOrder> byPrice = Comparator.comparing(MarketOrder::getPrice);
        return orders.stream()
                .filter(order -> side.matches(order.isBuyOrder()))
                .filter(order -> systemId == null || order.getSystemId() == systemId)
                .sorted(side == OrderSide.BUY ? byPrice.reversed() : byPrice)
                .toList();
    }
}
