package com.evenexus.appraisal;

import com.evenexus.config.AppraisalConfig;
import com.evenexus.domain.model.PortfolioValuation;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Applies a user-chosen percentage to valuation totals before display.
 *
 * <p>A percent is valid when it is 1 to 99999. The multiplier is
 * {@code min(cap, percent) / 100}, so 100 leaves totals unchanged and 50 halves them.
 * Per-item valuations are never scaled.
 */
@Component
public class ValuationPresenter {

    public static final int UNDISCOUNTED_PERCENT = 100;

    static final int MAX_PERCENT = 99_999;

    private static final Pattern PERCENT_TEXT = Pattern.compile("[0-9]{1,5}");

    private final int discountCap;

    public ValuationPresenter(AppraisalConfig appraisalConfig) {
        this.discountCap = appraisalConfig.getDiscountCap();
    }

    /**
     * Parses user input. Only plain digits are accepted, at most five of them and nothing
     * else, not even surrounding whitespace. The value must be positive; anything else yields
     * empty.
     */
    public Optional<Integer> parsePercent(String raw) {
        if (raw == null || !PERCENT_TEXT.matcher(raw).matches()) {
            return Optional.empty();
        }
        int percent = Integer.parseInt(raw);
        return percent > 0 ? Optional.of(percent) : Optional.empty();
    }

    public boolean isValidPercent(int percent) {
        return percent > 0 && percent <= MAX_PERCENT;
    }

    public int getDiscountCap() {
        return discountCap;
    }

    public int effectivePercent(int percent) {
        return Math.min(discountCap, percent);
    }

    public BigDecimal multiplier(int percent) {
        return BigDecimal.valueOf(effectivePercent(percent)).movePointLeft(2);
    }

    /**
     * Picks the percent for a request: the requested one when valid, else {@code fallback}.
     */
    public int resolvePercent(Integer requested, int fallback) {
        if (requested != null && isValidPercent(requested)) {
            return requested;
        }
        return fallback;
    }

    /**
     * Scales the three totals by the multiplier for {@code percent}. The midpoint is
     * recomputed from the scaled buy and sell totals so it stays exactly their average.
     *
     * @throws IllegalArgumentException if {@code percent} is out of range
     */
    public PortfolioValuation applyDiscount(PortfolioValuation valuation, int percent) {
        if (!isValidPercent(percent)) {
            throw new IllegalArgumentException("Discount percent out of range: " + percent);
        }
        int effective = effectivePercent(percent);
        if (effective == UNDISCOUNTED_PERCENT) {
            return valuation.toBuilder().discountPercent(effective).build();
        }
        BigDecimal factor = multiplier(percent);
        BigDecimal buy = valuation.getTotalBuyExecution().multiply(factor);
        BigDecimal sell = valuation.getTotalSellExecution().multiply(factor);
        return valuation.toBuilder()
                .totalBuyExecution(buy)
                .totalSellExecution(sell)
                .totalMidExecution(PortfolioAggregator.midpoint(buy, sell))
                .discountPercent(effective)
                .build();
    }
}
