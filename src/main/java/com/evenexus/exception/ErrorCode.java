package com.evenexus.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes returned in the error envelope. {@code retryable} marks outcomes where the same
 * request may succeed later: a cancelled valuation or an unreachable market data source.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    VALUATION_CANCELLED("VALUATION_CANCELLED", 499, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    MARKET_DATA_ERROR("MARKET_DATA_ERROR", 502, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
