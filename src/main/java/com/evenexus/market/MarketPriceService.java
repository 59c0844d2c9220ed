package com.evenexus.market;

import com.evenexus.api.dto.response.ItemPriceResponse;
import com.evenexus.config.AppraisalConfig;
import com.evenexus.domain.enums.OrderSide;
import com.evenexus.domain.model.MarketOrder;
import com.evenexus.domain.model.PriceQuote;
import com.evenexus.domain.model.TradingHub;
import com.evenexus.exception.BusinessException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single-item price checks against a hub. Uses the provider's cache, unlike appraisals,
 * which always refresh.
 */
@Slf4j
@Service
public class MarketPriceService {

    private final MarketDataProvider marketDataProvider;
    private final MarketPriceCalculator marketPriceCalculator;
    private final AppraisalConfig appraisalConfig;

    public MarketPriceService(
            MarketDataProvider marketDataProvider,
            MarketPriceCalculator marketPriceCalculator,
            AppraisalConfig appraisalConfig) {
        this.marketDataProvider = marketDataProvider;
        this.marketPriceCalculator = marketPriceCalculator;
        this.appraisalConfig = appraisalConfig;
    }

    /**
     * Returns best and average prices for the item at the hub and, when {@code quantity} is
     * given, the weighted unit prices of filling it on each side.
     *
     * @param regionId region to query; the configured default hub when null
     * @param systemId system to filter to; the configured default hub when null
     */
    public ItemPriceResponse getPrices(int typeId, Integer regionId, Integer systemId, Long quantity) {
        if (typeId <= 0) {
            throw new BusinessException("typeId must be positive", Map.of("typeId", typeId));
        }
        if (quantity != null && quantity <= 0) {
            throw new BusinessException("quantity must be positive", Map.of("quantity", quantity));
        }
        TradingHub defaultHub = appraisalConfig.defaultHub();
        TradingHub hub = TradingHub.of(
                regionId != null ? regionId : defaultHub.getRegionId(),
                systemId != null ? systemId : defaultHub.getSystemId());
        if (!hub.isResolvable()) {
            throw new BusinessException(
                    "regionId and systemId must be positive",
                    Map.of("regionId", hub.getRegionId(), "systemId", hub.getSystemId()));
        }

        List<MarketOrder> orders = marketDataProvider.fetchOrderBook(typeId, hub.getRegionId(), false);
        log.debug("Pricing type {} from {} orders in region {}", typeId, orders.size(), hub.getRegionId());

        int hubSystem = hub.getSystemId();
        ItemPriceResponse.ItemPriceResponseBuilder builder = ItemPriceResponse.builder()
                .typeId(typeId)
                .regionId(hub.getRegionId())
                .systemId(hubSystem)
                .bestBuyPrice(marketPriceCalculator.bestPrice(orders, OrderSide.BUY, hubSystem).orElse(null))
                .bestSellPrice(marketPriceCalculator.bestPrice(orders, OrderSide.SELL, hubSystem).orElse(null))
                .averagePrice(marketPriceCalculator.averagePrice(orders, hubSystem));

        if (quantity != null) {
            PriceQuote buyQuote = marketPriceCalculator.unitPrice(orders, OrderSide.BUY, quantity, hubSystem);
            PriceQuote sellQuote = marketPriceCalculator.unitPrice(orders, OrderSide.SELL, quantity, hubSystem);
            builder.quantity(quantity)
                    .buyUnitPrice(buyQuote.getPrice())
                    .sellUnitPrice(sellQuote.getPrice())
                    .buyInsufficient(buyQuote.isInsufficientStock())
                    .sellInsufficient(sellQuote.isInsufficientStock());
        }
        return builder.build();
    }
}
