package com.evenexus.appraisal;

import com.evenexus.config.AppraisalConfig;
import com.evenexus.domain.model.ItemDemand;
import com.evenexus.domain.model.ItemValuation;
import com.evenexus.domain.model.MarketOrder;
import com.evenexus.domain.model.PortfolioValuation;
import com.evenexus.domain.model.TradingHub;
import com.evenexus.exception.BusinessException;
import com.evenexus.exception.ValuationCancelledException;
import com.evenexus.market.OrderBookFetcher;
import com.evenexus.observability.AppraisalMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Values a bundle of items against a trading hub's live order books.
 *
 * <p>Pipeline per request:
 * <ol>
 *   <li>Normalize the bundle to one quantity per type ({@link BundleNormalizer})</li>
 *   <li>Fetch every type's region order book with bounded concurrency ({@link OrderBookFetcher})</li>
 *   <li>Walk each book at the hub system for the demanded quantity
 *       ({@link LiquidityConsumptionCalculator})</li>
 *   <li>Sum into bundle totals ({@link PortfolioAggregator})</li>
 *   <li>Scale the totals by the discount percent ({@link ValuationPresenter})</li>
 * </ol>
 *
 * <p>Aggregation only starts once every fetch has completed. If the request is cancelled
 * first, no valuation is produced: {@link #valuate} throws {@link ValuationCancelledException}
 * and the future from {@link #submit} reports cancellation.
 */
@Service
public class AppraisalService {

    private static final Logger log = LoggerFactory.getLogger(AppraisalService.class);

    private final BundleNormalizer bundleNormalizer;
    private final OrderBookFetcher orderBookFetcher;
    private final LiquidityConsumptionCalculator liquidityConsumptionCalculator;
    private final PortfolioAggregator portfolioAggregator;
    private final ValuationPresenter valuationPresenter;
    private final AppraisalMetrics appraisalMetrics;
    private final AppraisalConfig appraisalConfig;
    private final AsyncTaskExecutor appraisalExecutor;

    public AppraisalService(
            BundleNormalizer bundleNormalizer,
            OrderBookFetcher orderBookFetcher,
            LiquidityConsumptionCalculator liquidityConsumptionCalculator,
            PortfolioAggregator portfolioAggregator,
            ValuationPresenter valuationPresenter,
            AppraisalMetrics appraisalMetrics,
            AppraisalConfig appraisalConfig,
            @Qualifier("appraisalExecutor") AsyncTaskExecutor appraisalExecutor) {
        this.bundleNormalizer = bundleNormalizer;
        this.orderBookFetcher = orderBookFetcher;
        this.liquidityConsumptionCalculator = liquidityConsumptionCalculator;
        this.portfolioAggregator = portfolioAggregator;
        this.valuationPresenter = valuationPresenter;
        this.appraisalMetrics = appraisalMetrics;
        this.appraisalConfig = appraisalConfig;
        this.appraisalExecutor = appraisalExecutor;
    }

    /**
     * Values the bundle on the calling thread.
     *
     * @param hub             hub to price at; the configured default when null
     * @param discountPercent percent to apply to the totals; the configured default when null
     *                        or out of range
     * @throws BusinessException           if the bundle is empty or malformed, or the hub ids are
     *                                     not positive
     * @throws ValuationCancelledException if the calling thread is interrupted before every
     *                                     order book has been fetched
     */
    public PortfolioValuation valuate(List<ItemDemand> items, TradingHub hub, Integer discountPercent) {
        TradingHub target = resolveHub(hub);
        if (items == null || items.isEmpty()) {
            throw new BusinessException("At least one item is required");
        }
        Map<Integer, Long> demand = bundleNormalizer.normalize(items);
        int percent = valuationPresenter.resolvePercent(discountPercent, appraisalConfig.getDefaultDiscountPercent());

        log.info(
                "Valuing {} item types ({} lines) at region={} system={}",
                demand.size(),
                items.size(),
                target.getRegionId(),
                target.getSystemId());

        long start = System.nanoTime();
        Map<Integer, List<MarketOrder>> orderBooks;
        try {
            orderBooks = orderBookFetcher.fetchAll(demand.keySet(), target.getRegionId(), appraisalConfig.isForceRefresh());
        } catch (ValuationCancelledException e) {
            appraisalMetrics.recordCancelled();
            throw e;
        }

        List<ItemValuation> itemValuations = new ArrayList<>(demand.size());
        demand.forEach((typeId, quantity) -> itemValuations.add(liquidityConsumptionCalculator.consume(
                typeId, quantity, orderBooks.getOrDefault(typeId, List.of()), target.getSystemId())));

        PortfolioValuation valuation =
                valuationPresenter.applyDiscount(portfolioAggregator.aggregate(itemValuations), percent);

        long elapsed = System.nanoTime() - start;
        appraisalMetrics.recordCompleted(elapsed, valuation.hasInsufficientLiquidity());
        log.info(
                "Valuation done in {} ms: buy={}, sell={}, mid={}, insufficient={}, withoutOrders={}, discount={}%",
                elapsed / 1_000_000,
                valuation.getTotalBuyExecution(),
                valuation.getTotalSellExecution(),
                valuation.getTotalMidExecution(),
                valuation.hasInsufficientLiquidity(),
                valuation.getItemsWithoutOrders(),
                valuation.getDiscountPercent());
        return valuation;
    }

    /**
     * Values the bundle on the appraisal executor. Cancelling the returned future with
     * interruption stops in-flight order book fetches; {@code get()} then throws
     * {@link java.util.concurrent.CancellationException} and no valuation is produced.
     */
    public Future<PortfolioValuation> submit(List<ItemDemand> items, TradingHub hub, Integer discountPercent) {
        return appraisalExecutor.submit(() -> valuate(items, hub, discountPercent));
    }

    private TradingHub resolveHub(TradingHub hub) {
        TradingHub target = hub != null ? hub : appraisalConfig.defaultHub();
        if (!target.isResolvable()) {
            throw new BusinessException(
                    "regionId and systemId must be positive",
                    Map.of("regionId", target.getRegionId(), "systemId", target.getSystemId()));
        }
        return target;
    }
}
