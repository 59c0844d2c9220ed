package com.evenexus.exception;

/**
 * Signals that a valuation request was cancelled before every order book fetch completed.
 *
 * <p>A cancelled request never produces a {@link com.evenexus.domain.model.PortfolioValuation};
 * callers distinguish this from a completed valuation that merely reports insufficient liquidity.
 */
public class ValuationCancelledException extends BaseException {

    public ValuationCancelledException(String message) {
        super(ErrorCode.VALUATION_CANCELLED, message);
    }

    public ValuationCancelledException(String message, Throwable cause) {
        super(ErrorCode.VALUATION_CANCELLED, message, cause);
    }
}
