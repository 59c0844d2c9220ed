package com.evenexus.appraisal;

import com.evenexus.config.AppraisalConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.context.annotation.SessionScope;

/**
 * The discount percent a user last entered, held for the HTTP session only.
 *
 * <p>Invalid input is rejected and the previously accepted value stays in force.
 */
@Slf4j
@Component
@SessionScope
public class DiscountSetting {

    private final ValuationPresenter valuationPresenter;

    private volatile int percent;

    public DiscountSetting(ValuationPresenter valuationPresenter, AppraisalConfig appraisalConfig) {
        this.valuationPresenter = valuationPresenter;
        this.percent = valuationPresenter.isValidPercent(appraisalConfig.getDefaultDiscountPercent())
                ? appraisalConfig.getDefaultDiscountPercent()
                : ValuationPresenter.UNDISCOUNTED_PERCENT;
    }

    /**
     * Stores the percent parsed from {@code raw}.
     *
     * @return false if the text was rejected; the stored percent is then unchanged
     */
    public boolean accept(String raw) {
        return valuationPresenter.parsePercent(raw)
                .map(parsed -> {
                    percent = parsed;
                    log.debug("Discount set to {}%", parsed);
                    return true;
                })
                .orElseGet(() -> {
                    log.debug("Rejected discount input '{}', keeping {}%", raw, percent);
                    return false;
                });
    }

    public int getPercent() {
        return percent;
    }

    /** The requested percent when valid, else the stored one. */
    public int resolve(Integer requested) {
        return valuationPresenter.resolvePercent(requested, percent);
    }
}
