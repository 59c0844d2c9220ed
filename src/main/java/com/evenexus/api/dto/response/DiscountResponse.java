package com.evenexus.api.dto.response;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Current discount for the session. {@code accepted} is only set on update responses;
 * a rejected update leaves {@code percent} at the previously accepted value.
 */
@Data
@Builder
public class DiscountResponse {

    private Boolean accepted;
    private int percent;

    /** {@code percent} clamped to the configured cap; this is what totals are scaled by. */
    private int effectivePercent;

    private int cap;
    private BigDecimal multiplier;
}
