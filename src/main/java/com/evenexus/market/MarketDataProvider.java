package com.evenexus.market;

import com.evenexus.domain.model.MarketOrder;
import java.util.List;

/**
 * Source of region order books.
 *
 * <p>Implementations return every open order for the item in the region, both sides,
 * unfiltered by system. An item with no orders yields an empty list, not an error.
 */
public interface MarketDataProvider {

    /**
     * Fetches the order book for one item in one region.
     *
     * @param typeId       item type id
     * @param regionId     region to query
     * @param forceRefresh bypass any cached copy and fetch fresh data
     * @return all open orders, never null
     * @throws com.evenexus.exception.MarketDataException if the book could not be retrieved
     */
    List<MarketOrder> fetchOrderBook(int typeId, int regionId, boolean forceRefresh);
}
