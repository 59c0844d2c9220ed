package com.evenexus.market;

import com.evenexus.config.AppraisalConfig;
import com.evenexus.domain.model.MarketOrder;
import com.evenexus.exception.MarketDataException;
import com.evenexus.exception.ValuationCancelledException;
import com.evenexus.observability.AppraisalMetrics;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Fetches the order books for a set of item types with bounded concurrency.
 *
 * <p>For N distinct types, {@code max(1, min(maxConcurrency, N))} workers are submitted to the
 * {@code orderBookFetchExecutor}. Each worker pulls type ids from a shared queue until it is
 * empty, so no more than that many fetches are in flight for one call and every type is
 * fetched exactly once.
 *
 * <p>A failed fetch is logged, counted, and recorded as an empty book; it never fails the
 * call. Cancellation is cooperative: workers check their interrupt flag before each fetch,
 * and interrupting the calling thread cancels all workers and raises
 * {@link ValuationCancelledException}. A cancelled call never returns a partial map.
 */
@Component
public class OrderBookFetcher {

    private static final Logger log = LoggerFactory.getLogger(OrderBookFetcher.class);

    private final MarketDataProvider marketDataProvider;
    private final AsyncTaskExecutor fetchExecutor;
    private final AppraisalMetrics appraisalMetrics;
    private final int maxConcurrency;

    public OrderBookFetcher(
            MarketDataProvider marketDataProvider,
            @Qualifier("orderBookFetchExecutor") AsyncTaskExecutor fetchExecutor,
            AppraisalMetrics appraisalMetrics,
            AppraisalConfig appraisalConfig) {
        this.marketDataProvider = marketDataProvider;
        this.fetchExecutor = fetchExecutor;
        this.appraisalMetrics = appraisalMetrics;
        this.maxConcurrency = appraisalConfig.getMaxConcurrency();
    }

    /**
     * Fetches one order book per distinct type id.
     *
     * @return an entry for every requested type id; failed fetches map to an empty list
     * @throws ValuationCancelledException if the calling thread is interrupted, the workers
     *     are cancelled before every fetch completed, or the executor is shutting down
     */
    public Map<Integer, List<MarketOrder>> fetchAll(Collection<Integer> typeIds, int regionId, boolean forceRefresh) {
        Set<Integer> distinctTypeIds = new LinkedHashSet<>(typeIds);
        if (distinctTypeIds.isEmpty()) {
            return Map.of();
        }

        int concurrency = concurrencyFor(distinctTypeIds.size());
        log.info(
                "Fetching order books: region={}, items={}, concurrency={}, forceRefresh={}",
                regionId,
                distinctTypeIds.size(),
                concurrency,
                forceRefresh);

        long start = System.nanoTime();
        Queue<Integer> pending = new ConcurrentLinkedQueue<>(distinctTypeIds);
        Map<Integer, List<MarketOrder>> results = new ConcurrentHashMap<>();
        List<Future<?>> workers = new ArrayList<>(concurrency);

        try {
            for (int i = 0; i < concurrency; i++) {
                workers.add(fetchExecutor.submit(() -> drain(pending, results, regionId, forceRefresh)));
            }
            for (Future<?> worker : workers) {
                worker.get();
            }
        } catch (InterruptedException e) {
            cancelAll(workers);
            Thread.currentThread().interrupt();
            throw new ValuationCancelledException("Order book fetch interrupted", e);
        } catch (CancellationException e) {
            cancelAll(workers);
            throw new ValuationCancelledException("Order book fetch cancelled", e);
        } catch (RejectedExecutionException e) {
            cancelAll(workers);
            throw new ValuationCancelledException("Order book fetch rejected, executor is shutting down", e);
        } catch (ExecutionException e) {
            cancelAll(workers);
            if (e.getCause() instanceof ValuationCancelledException cancelled) {
                throw cancelled;
            }
            throw new MarketDataException("Order book fetch worker failed", e.getCause());
        }

        if (results.size() < distinctTypeIds.size()) {
            throw new ValuationCancelledException("Order book fetch stopped with "
                    + (distinctTypeIds.size() - results.size()) + " of " + distinctTypeIds.size()
                    + " items outstanding");
        }

        log.info(
                "Fetched {} order books in {} ms",
                results.size(),
                (System.nanoTime() - start) / 1_000_000);
        return Map.copyOf(results);
    }

    int concurrencyFor(int itemCount) {
        return Math.max(1, Math.min(maxConcurrency, itemCount));
    }

    private Void drain(
            Queue<Integer> pending, Map<Integer, List<MarketOrder>> results, int regionId, boolean forceRefresh) {
        while (!Thread.currentThread().isInterrupted()) {
            Integer typeId = pending.poll();
            if (typeId == null) {
                break;
            }
            List<MarketOrder> orders = fetchOne(typeId, regionId, forceRefresh);
            if (orders == null) {
                // interrupted mid-fetch; leave the item unrecorded
                break;
            }
            results.put(typeId, orders);
        }
        return null;
    }

    private List<MarketOrder> fetchOne(int typeId, int regionId, boolean forceRefresh) {
        try {
            List<MarketOrder> orders = marketDataProvider.fetchOrderBook(typeId, regionId, forceRefresh);
            return orders != null ? orders : List.of();
        } catch (ValuationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                return null;
            }
            log.warn("Order book fetch failed for type {} in region {}, valuing as empty: {}",
                    typeId, regionId, e.getMessage());
            appraisalMetrics.recordFetchFailure();
            return List.of();
        }
    }

    private void cancelAll(List<Future<?>> workers) {
        workers.forEach(worker -> worker.cancel(true));
    }
}
