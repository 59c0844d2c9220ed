package com.evenexus.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for the appraisal pipeline.
 *
 * <ul>
 *   <li><b>appraisal.orderbook.fetch.failures</b> (counter): order book fetches that failed and
 *       were valued as empty</li>
 *   <li><b>appraisal.valuations.completed</b> (counter): valuations that produced a result</li>
 *   <li><b>appraisal.valuations.cancelled</b> (counter): valuations abandoned before all fetches
 *       completed</li>
 *   <li><b>appraisal.valuations.insufficient</b> (counter): completed valuations flagged with
 *       insufficient liquidity</li>
 *   <li><b>appraisal.valuation.duration</b> (timer): wall time of a completed valuation, fetches
 *       included</li>
 * </ul>
 */
@Component
public class AppraisalMetrics {

    private final Counter fetchFailureCounter;
    private final Counter completedCounter;
    private final Counter cancelledCounter;
    private final Counter insufficientCounter;
    private final Timer valuationTimer;

    public AppraisalMetrics(MeterRegistry meterRegistry) {
        this.fetchFailureCounter = Counter.builder("appraisal.orderbook.fetch.failures")
                .description("Order book fetches that failed and were valued as empty")
                .register(meterRegistry);

        this.completedCounter = Counter.builder("appraisal.valuations.completed")
                .description("Valuations that produced a result")
                .register(meterRegistry);

        this.cancelledCounter = Counter.builder("appraisal.valuations.cancelled")
                .description("Valuations cancelled before all order books were fetched")
                .register(meterRegistry);

        this.insufficientCounter = Counter.builder("appraisal.valuations.insufficient")
                .description("Completed valuations with insufficient hub liquidity")
                .register(meterRegistry);

        this.valuationTimer = Timer.builder("appraisal.valuation.duration")
                .description("Wall time of a completed valuation including order book fetches")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(60))
                .register(meterRegistry);
    }

    public void recordFetchFailure() {
        fetchFailureCounter.increment();
    }

    public void recordCompleted(long elapsedNanos, boolean insufficientLiquidity) {
        completedCounter.increment();
        if (insufficientLiquidity) {
            insufficientCounter.increment();
        }
        valuationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordCancelled() {
        cancelledCounter.increment();
    }
}
