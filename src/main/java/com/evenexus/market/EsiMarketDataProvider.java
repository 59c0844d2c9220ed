package com.evenexus.market;

import com.evenexus.config.EsiConfig;
import com.evenexus.domain.model.MarketOrder;
import com.evenexus.exception.MarketDataException;
import com.evenexus.exception.ValuationCancelledException;
import com.evenexus.mapper.EsiMarketOrderMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link MarketDataProvider} backed by the public ESI market endpoint.
 *
 * <p>Order books are cached per (type, region) in Caffeine for {@code esi.cache-ttl}.
 * A forced refresh skips the cache read but still stores the fresh book, so later
 * non-forced lookups (such as single-item price checks) benefit from it.
 *
 * <p>HTTP failures are retried by the {@code esiMarket} Resilience4j instance and then
 * surface as {@link MarketDataException}. A fetch aborted by thread interruption is reported
 * as {@link ValuationCancelledException} instead, which is not retried.
 */
@Service
public class EsiMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(EsiMarketDataProvider.class);

    private static final String ORDERS_URI =
            "/markets/{regionId}/orders/?type_id={typeId}&order_type=all&datasource={datasource}";

    private static final ParameterizedTypeReference<List<EsiMarketOrder>> ORDER_LIST = new ParameterizedTypeReference<>() {};

    private final RestClient esiRestClient;
    private final EsiMarketOrderMapper esiMarketOrderMapper;
    private final String datasource;

    /** key = "typeId|regionId" */
    private final Cache<String, List<MarketOrder>> orderBookCache;

    public EsiMarketDataProvider(
            RestClient esiRestClient, EsiMarketOrderMapper esiMarketOrderMapper, EsiConfig esiConfig) {
        this.esiRestClient = esiRestClient;
        this.esiMarketOrderMapper = esiMarketOrderMapper;
        this.datasource = esiConfig.getDatasource();
        this.orderBookCache = Caffeine.newBuilder()
                .expireAfterWrite(esiConfig.getCacheTtl())
                .maximumSize(esiConfig.getCacheMaximumSize())
                .build();
    }

    @Override
    @Retry(name = "esiMarket")
    public List<MarketOrder> fetchOrderBook(int typeId, int regionId, boolean forceRefresh) {
        String cacheKey = typeId + "|" + regionId;
        if (!forceRefresh) {
            List<MarketOrder> cached = orderBookCache.getIfPresent(cacheKey);
            if (cached != null) {
                log.debug("Order book cache hit for type {} in region {}", typeId, regionId);
                return cached;
            }
        }

        List<EsiMarketOrder> payload = requestOrders(typeId, regionId);
        List<MarketOrder> orders = payload != null ? List.copyOf(esiMarketOrderMapper.toDomainList(payload)) : List.of();
        orderBookCache.put(cacheKey, orders);

        log.debug("Fetched {} orders for type {} in region {}", orders.size(), typeId, regionId);
        return orders;
    }

    private List<EsiMarketOrder> requestOrders(int typeId, int regionId) {
        try {
            return esiRestClient
                    .get()
                    .uri(ORDERS_URI, regionId, typeId, datasource)
                    .retrieve()
                    .body(ORDER_LIST);
        } catch (RestClientResponseException e) {
            throw new MarketDataException(
                    "ESI returned " + e.getStatusCode().value() + " for type " + typeId + " in region " + regionId, e);
        } catch (RestClientException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ValuationCancelledException("Order book fetch interrupted for type " + typeId, e);
            }
            throw new MarketDataException("Failed to fetch order book for type " + typeId + " in region " + regionId, e);
        }
    }
}
