package com.evenexus.config;

import com.evenexus.domain.model.TradingHub;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tuning for the appraisal pipeline, bound to {@code evenexus.appraisal.*}.
 *
 * <p>The default hub is Jita in The Forge, which is where the bulk of the game's
 * trade happens and where appraisals are priced unless a request names another hub.
 */
@Configuration
@ConfigurationProperties(prefix = "evenexus.appraisal")
@Getter
@Setter
public class AppraisalConfig {

    /** Upper bound on order book fetches in flight for a single request. */
    private int maxConcurrency = 10;

    private int defaultRegionId = TradingHub.JITA_REGION_ID;

    private int defaultSystemId = TradingHub.JITA_SYSTEM_ID;

    /** Largest discount percent that takes effect; larger accepted values are clamped. */
    private int discountCap = 99_999;

    /** Discount applied when the caller has not chosen one. */
    private int defaultDiscountPercent = 100;

    /** Whether appraisals bypass the provider's order book cache. */
    private boolean forceRefresh = true;

    public TradingHub defaultHub() {
        return TradingHub.of(defaultRegionId, defaultSystemId);
    }
}
