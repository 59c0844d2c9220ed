package com.evenexus.unit.market;

import static org.assertj.core.api.Assertions.assertThat;

import com.evenexus.domain.enums.OrderSide;
import com.evenexus.domain.model.MarketOrder;
import com.evenexus.domain.model.PriceQuote;
import com.evenexus.market.MarketPriceCalculator;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MarketPriceCalculatorTest {

    private static final int JITA = 30_000_142;
    private static final int PERIMETER = 30_000_144;

    private final MarketPriceCalculator calculator = new MarketPriceCalculator();

    private final List<MarketOrder> book = List.of(
            order(false, "5.20", 100, JITA),
            order(false, "5.00", 50, JITA),
            order(false, "4.50", 1000, PERIMETER),
            order(true, "4.80", 200, JITA),
            order(true, "4.90", 10, JITA),
            order(true, "6.00", 1000, PERIMETER));

    @Nested
    @DisplayName("Best price")
    class BestPrice {

        @Test
        @DisplayName("Lowest ask and highest bid at the system")
        void bestAtSystem() {
            assertThat(calculator.bestPrice(book, OrderSide.SELL, JITA)).hasValueSatisfying(
                    price -> assertThat(price).isEqualByComparingTo("5.00"));
            assertThat(calculator.bestPrice(book, OrderSide.BUY, JITA)).hasValueSatisfying(
                    price -> assertThat(price).isEqualByComparingTo("4.90"));
        }

        @Test
        @DisplayName("Without a system filter the whole region counts")
        void bestInRegion() {
            assertThat(calculator.bestPrice(book, OrderSide.SELL, null)).hasValueSatisfying(
                    price -> assertThat(price).isEqualByComparingTo("4.50"));
            assertThat(calculator.bestPrice(book, OrderSide.BUY, null)).hasValueSatisfying(
                    price -> assertThat(price).isEqualByComparingTo("6.00"));
        }

        @Test
        @DisplayName("No matching orders gives no price")
        void emptySide() {
            assertThat(calculator.bestPrice(List.of(), OrderSide.SELL, JITA)).isEmpty();
            assertThat(calculator.bestPrice(book, OrderSide.SELL, 30_000_001)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Unit price for a quantity")
    class UnitPrice {

        @Test
        @DisplayName("Volume-weighted across levels when the book covers the quantity")
        void weighted() {
            // 50 x 5.00 + 50 x 5.20 = 510 over 100 units
            PriceQuote quote = calculator.unitPrice(book, OrderSide.SELL, 100, JITA);

            assertThat(quote.getPrice()).isEqualByComparingTo("5.10");
            assertThat(quote.isInsufficientStock()).isFalse();
        }

        @Test
        @DisplayName("Short book averages over the filled part and flags insufficient")
        void insufficient() {
            // 10 x 4.90 + 200 x 4.80 = 1009 over 210 units
            PriceQuote quote = calculator.unitPrice(book, OrderSide.BUY, 500, JITA);

            assertThat(quote.getPrice()).isEqualByComparingTo("4.80");
            assertThat(quote.isInsufficientStock()).isTrue();
        }

        @Test
        @DisplayName("Nothing to fill gives no price and insufficient")
        void nothingFills() {
            PriceQuote quote = calculator.unitPrice(List.of(), OrderSide.BUY, 10, JITA);

            assertThat(quote.isAvailable()).isFalse();
            assertThat(quote.isInsufficientStock()).isTrue();
        }
    }

    @Nested
    @DisplayName("Average price")
    class AveragePrice {

        @Test
        @DisplayName("Midpoint of best bid and best ask")
        void midpoint() {
            assertThat(calculator.averagePrice(book, JITA)).isEqualByComparingTo("4.95");
        }

        @Test
        @DisplayName("Falls back to the only side present")
        void oneSided() {
            List<MarketOrder> asksOnly = List.of(order(false, "7.25", 5, JITA));

            assertThat(calculator.averagePrice(asksOnly, JITA)).isEqualByComparingTo("7.25");
        }

        @Test
        @DisplayName("Zero when there are no orders")
        void noOrders() {
            assertThat(calculator.averagePrice(List.of(), JITA)).isEqualByComparingTo(BigDecimal.ZERO);
        }
    }

    private static MarketOrder order(boolean buyOrder, String price, long volume, int systemId) {
        return MarketOrder.builder()
                .typeId(34)
                .systemId(systemId)
                .buyOrder(buyOrder)
                .price(new BigDecimal(price))
                .volumeRemain(volume)
                .volumeTotal(volume)
                .build();
    }
}
